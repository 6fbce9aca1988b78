package com.spellcheck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpellCheckApplication {

	public static void main(String[] args) {
		SpringApplication.run(SpellCheckApplication.class, args);
	}

}
