package com.example.artworkextractor;

import com.example.artworkextractor.model.ArtifactManifest;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a batch: tokens resolved, tokens whose metadata could not be fetched, and one manifest
 * per resolved token in input order.
 */
public record BatchSummary(
        int processed,
        int failed,
        Instant startedAt,
        Instant finishedAt,
        List<ArtifactManifest> manifests
) {
}
