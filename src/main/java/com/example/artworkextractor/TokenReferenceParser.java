package com.example.artworkextractor;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a contract/token pair from marketplace links or plain text.
 * <p>
 * Recognized forms, tried in order:
 * <ul>
 *     <li>{@code .../assets/ethereum/0xCONTRACT/TOKEN}</li>
 *     <li>{@code .../token/0xCONTRACT:TOKEN}</li>
 *     <li>{@code 0xCONTRACT/TOKEN} or {@code 0xCONTRACT:TOKEN}</li>
 *     <li>{@code 0xCONTRACT TOKEN} or {@code 0xCONTRACT,TOKEN}</li>
 * </ul>
 */
public final class TokenReferenceParser {
    private static final Pattern ASSET_PATH = Pattern.compile("/assets/(?:ethereum|eth)/([0-9a-fA-Fx]+)/(\\d+)");
    private static final Pattern TOKEN_PATH = Pattern.compile("/token/([0-9a-fA-Fx]+):(\\d+)");
    private static final Pattern DIRECT = Pattern.compile("(0x[0-9a-fA-F]{40})[/:]+(\\d+)");
    private static final Pattern SEPARATOR = Pattern.compile("[,\\s]+");
    private static final Pattern CONTRACT_PREFIX = Pattern.compile("^(0x[0-9a-fA-F]{40})");
    private static final Pattern TOKEN_PREFIX = Pattern.compile("^(\\d+)");

    private TokenReferenceParser() {
    }

    public static Optional<TokenReference> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.trim();
        for (Pattern pattern : new Pattern[]{ASSET_PATH, TOKEN_PATH, DIRECT}) {
            Matcher matcher = pattern.matcher(value);
            if (matcher.find()) {
                return Optional.of(new TokenReference(matcher.group(1), matcher.group(2)));
            }
        }
        String[] parts = SEPARATOR.split(value);
        if (parts.length >= 2) {
            Matcher contract = CONTRACT_PREFIX.matcher(parts[0]);
            Matcher token = TOKEN_PREFIX.matcher(parts[1]);
            if (contract.find() && token.find()) {
                return Optional.of(new TokenReference(contract.group(1), token.group(1)));
            }
        }
        return Optional.empty();
    }
}
