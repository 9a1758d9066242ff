package com.example.artworkextractor;

import java.util.regex.Pattern;

/**
 * Turns display names into file-system safe base names.
 */
public final class NameSanitizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DISALLOWED = Pattern.compile("[<>:\"/\\\\|?*\\p{Cc}]");
    private static final Pattern HYPHEN_RUN = Pattern.compile("-{2,}");
    private static final Pattern EDGE_HYPHENS = Pattern.compile("^-+|-+$");
    private static final Pattern ONLY_DOTS = Pattern.compile("^\\.+$");

    private NameSanitizer() {
    }

    /**
     * Never fails; returns an empty string when nothing usable is left, including for {@code null}.
     * Applying it twice gives the same result as applying it once.
     */
    public static String sanitize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String name = WHITESPACE.matcher(raw).replaceAll("-");
        name = DISALLOWED.matcher(name).replaceAll("");
        name = HYPHEN_RUN.matcher(name).replaceAll("-");
        name = EDGE_HYPHENS.matcher(name).replaceAll("");
        // "." and ".." resolve to directories, not files
        if (ONLY_DOTS.matcher(name).matches()) {
            return "";
        }
        return name;
    }
}
