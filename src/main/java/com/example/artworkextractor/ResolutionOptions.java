package com.example.artworkextractor;

/**
 * Per-resolution switches handed to {@link ResourceOrchestrator}.
 */
public record ResolutionOptions(boolean downloadThumbnails) {
    public static ResolutionOptions defaults() {
        return new ResolutionOptions(true);
    }
}
