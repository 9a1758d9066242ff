package com.example.artworkextractor;

import java.math.BigInteger;
import java.util.Optional;

public final class TokenIdParser {
    private TokenIdParser() {
    }

    /**
     * Parses a decimal or {@code 0x}-prefixed hexadecimal token id. Negative or malformed input yields empty.
     */
    public static Optional<BigInteger> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        try {
            BigInteger parsed;
            if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
                parsed = new BigInteger(trimmed.substring(2), 16);
            } else {
                parsed = new BigInteger(trimmed);
            }
            return parsed.signum() < 0 ? Optional.empty() : Optional.of(parsed);
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}
