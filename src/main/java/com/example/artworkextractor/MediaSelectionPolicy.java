package com.example.artworkextractor;

/**
 * Tunable heuristics used by {@link MediaSelector}.
 *
 * @param preferGateway  pick a media item's CDN gateway URL over its raw content URL when both exist
 * @param duplicateMatch rule that decides whether the thumbnail repeats the primary media
 */
public record MediaSelectionPolicy(
        boolean preferGateway,
        DuplicateMatch duplicateMatch
) {
    public MediaSelectionPolicy {
        if (duplicateMatch == null) {
            throw new IllegalArgumentException("duplicateMatch is required.");
        }
    }

    public static MediaSelectionPolicy defaults() {
        return new MediaSelectionPolicy(true, DuplicateMatch.HOST_STRIPPED);
    }
}
