package com.spellcheck.data;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PhoneticCodeTest {

    @Test
    void mapsConsonantsToSoundClasses() {
        assertEquals("R163", PhoneticCode.encode("robert"));
        assertEquals("R163", PhoneticCode.encode("rupert"));
        assertEquals("A261", PhoneticCode.encode("ashcraft"));
    }

    @Test
    void firstLetterDoesNotCollapseWithFollowingDigit() {
        assertEquals("P123", PhoneticCode.encode("pfister"));
    }

    @Test
    void vowelsAreSkippedWithoutBreakingRuns() {
        assertEquals("B100", PhoneticCode.encode("bob"));
        assertEquals("J250", PhoneticCode.encode("jackson"));
        assertEquals("T000", PhoneticCode.encode("the"));
        assertEquals("T000", PhoneticCode.encode("teh"));
    }

    @Test
    void caseInsensitive() {
        assertEquals(PhoneticCode.encode("robert"), PhoneticCode.encode("ROBERT"));
        assertEquals(PhoneticCode.encode("teh"), PhoneticCode.encode("Teh"));
    }

    @Test
    void alwaysFourCharactersStartingWithUppercasedFirstLetter() {
        for (String w : List.of("a", "ox", "strength", "mississippi", "queue", "zz")) {
            String code = PhoneticCode.encode(w);
            assertEquals(PhoneticCode.LENGTH, code.length(), w);
            assertEquals(Character.toUpperCase(w.charAt(0)), code.charAt(0), w);
        }
    }

    @Test
    void emptyInputHasEmptyCode() {
        assertEquals("", PhoneticCode.encode(""));
        assertEquals("", PhoneticCode.encode(null));
    }
}
