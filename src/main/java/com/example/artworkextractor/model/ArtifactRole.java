package com.example.artworkextractor.model;

/**
 * The kinds of artifact produced for one token, each mapped to its own file name suffix.
 */
public enum ArtifactRole {
    PRIMARY(""),
    THUMBNAIL("-thumbnail"),
    METADATA(""),
    TOKEN_METADATA("-token");

    private final String suffix;

    ArtifactRole(String suffix) {
        this.suffix = suffix;
    }

    public String fileName(String baseName, String extension) {
        return baseName + suffix + "." + extension;
    }

    public boolean isMedia() {
        return this == PRIMARY || this == THUMBNAIL;
    }
}
