package com.example.artworkextractor;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NameSanitizerTest {
    @Test
    void replacesSpacesWithHyphens() {
        assertEquals("Garden-of-Forking-Paths", NameSanitizer.sanitize("Garden of Forking Paths"));
    }

    @Test
    void removesCharactersUnsafeForFileSystems() {
        assertEquals("ab-cd", NameSanitizer.sanitize("a<b> : c\"d/\\|?*"));
        assertEquals("bell", NameSanitizer.sanitize("be\u0007ll\u0000"));
    }

    @Test
    void collapsesWhitespaceAndHyphenRuns() {
        assertEquals("Dawn-Chorus-2", NameSanitizer.sanitize("  Dawn \t\n Chorus --- 2 "));
        assertEquals("a-b", NameSanitizer.sanitize("--a -- b--"));
    }

    @Test
    void keepsUnicodeLettersAndTreatsUnicodeSpacesAsWhitespace() {
        assertEquals("Ōkami-夜", NameSanitizer.sanitize("Ōkami　夜"));
    }

    @Test
    void returnsEmptyForNothingUsable() {
        assertEquals("", NameSanitizer.sanitize(null));
        assertEquals("", NameSanitizer.sanitize(""));
        assertEquals("", NameSanitizer.sanitize(" - ?* -"));
        assertEquals("", NameSanitizer.sanitize(".."));
    }

    @Test
    void isIdempotent() {
        List<String> samples = List.of(
                "Garden of Forking Paths",
                " -<a>- b\t\tc - ",
                "x::y//z",
                "---",
                "\u0001\u0002 name \u007f",
                "tab\tand\nnewline",
                "- . -",
                "CryptoPunk #7804",
                " nbsp em "
        );
        for (String sample : samples) {
            String once = NameSanitizer.sanitize(sample);
            assertEquals(once, NameSanitizer.sanitize(once), "not idempotent for: " + sample);
        }
    }
}
