package com.example.artworkextractor.model;

import java.util.Optional;

/**
 * Result of media selection: at most one candidate per role.
 */
public record MediaSelection(
        Optional<MediaCandidate> primary,
        Optional<MediaCandidate> thumbnail
) {
    public static MediaSelection empty() {
        return new MediaSelection(Optional.empty(), Optional.empty());
    }
}
