package com.example.artworkextractor;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable runtime settings for the extractor.
 */
public record ExtractorConfig(
        String apiKey,
        Path outputDirectory,
        boolean downloadThumbnails,
        String providerBaseUrl,
        int threadCount,
        Duration requestTimeout,
        MediaSelectionPolicy selectionPolicy,
        int listenerPort,
        boolean s3SyncEnabled,
        Optional<String> s3Bucket,
        Optional<String> s3Prefix,
        Optional<String> s3Region
) {
}
