package com.example.artworkextractor.model;

import java.util.Optional;

/**
 * A media URL found in the metadata document, plus the optional gateway URL and MIME/format hint
 * recorded next to it.
 */
public record MediaCandidate(
        String url,
        Optional<String> gatewayUrl,
        Optional<String> mimeHint
) {
    public MediaCandidate {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Media candidate requires a URL.");
        }
        gatewayUrl = gatewayUrl == null ? Optional.empty() : gatewayUrl;
        mimeHint = mimeHint == null ? Optional.empty() : mimeHint;
    }
}
