package com.example.artworkextractor;

import com.example.artworkextractor.model.ArtifactManifest;

/**
 * Receives the manifest of every resolved token, after all of its artifacts were attempted.
 */
@FunctionalInterface
public interface ArtifactSyncer extends AutoCloseable {
    void sync(ArtifactManifest manifest);

    @Override
    default void close() {
        // no-op
    }

    static ArtifactSyncer noop() {
        return manifest -> {
        };
    }
}
