package com.spellcheck.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SpellCheckProperties.class)
public class SpellCheckConfig {
}
