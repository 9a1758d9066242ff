package com.example.artworkextractor.model;

/**
 * A selected media URL with the file extension it will be saved under.
 */
public record ResolvedMedia(
        String url,
        String extension,
        ArtifactRole role
) {
}
