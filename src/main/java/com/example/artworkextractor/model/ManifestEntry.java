package com.example.artworkextractor.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One attempted artifact of a resolution.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManifestEntry(
        ArtifactRole role,
        String path,
        long byteSize,
        Status status,
        String source,
        String error
) {
    public enum Status {
        WRITTEN,
        SKIPPED,
        FAILED
    }

    public static ManifestEntry from(ArtifactRole role, String source, WriteResult result) {
        return new ManifestEntry(
                role,
                result.path().toString(),
                result.byteSize(),
                result.skipped() ? Status.SKIPPED : Status.WRITTEN,
                source,
                null
        );
    }

    public static ManifestEntry failed(ArtifactRole role, String path, String source, String error) {
        return new ManifestEntry(role, path, 0L, Status.FAILED, source, error);
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
