package com.example.artworkextractor;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Rules for deciding whether two media URLs point at the same resource.
 * <p>
 * {@link #CONTAINMENT} and {@link #HOST_STRIPPED} can flag unrelated URLs whose paths happen to
 * overlap; {@link #EQUALITY} misses the same content served from two different hosts.
 */
public enum DuplicateMatch {
    /** Exact string equality. */
    EQUALITY {
        @Override
        public boolean matches(String first, String second) {
            return first.equals(second);
        }
    },
    /** Either URL is a substring of the other. */
    CONTAINMENT {
        @Override
        public boolean matches(String first, String second) {
            return first.contains(second) || second.contains(first);
        }
    },
    /** Containment after dropping scheme, host and any leading {@code /ipfs/} gateway segment. */
    HOST_STRIPPED {
        @Override
        public boolean matches(String first, String second) {
            String a = stripHost(first);
            String b = stripHost(second);
            if (a.isEmpty() || b.isEmpty()) {
                return first.equals(second);
            }
            return a.contains(b) || b.contains(a);
        }
    };

    public abstract boolean matches(String first, String second);

    static String stripHost(String url) {
        String path;
        try {
            URI uri = new URI(url.trim());
            if ("ipfs".equalsIgnoreCase(uri.getScheme())) {
                // ipfs://<cid>/<path>: the authority is the content id itself
                path = (uri.getRawAuthority() == null ? "" : uri.getRawAuthority())
                        + (uri.getRawPath() == null ? "" : uri.getRawPath());
            } else if (uri.getRawPath() != null && uri.getHost() != null) {
                path = uri.getRawPath();
            } else {
                path = url.trim();
            }
        } catch (URISyntaxException ex) {
            path = url.trim();
        }
        path = trimSlashes(path);
        if (path.toLowerCase(Locale.ROOT).startsWith("ipfs/")) {
            path = path.substring("ipfs/".length());
        }
        return trimSlashes(path);
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
