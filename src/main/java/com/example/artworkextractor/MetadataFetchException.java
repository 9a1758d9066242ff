package com.example.artworkextractor;

import java.io.IOException;

/**
 * Raised when the metadata provider cannot return a document for a token.
 */
public class MetadataFetchException extends IOException {
    public enum Kind {
        NOT_FOUND,
        RATE_LIMITED,
        UPSTREAM
    }

    private final Kind kind;

    public MetadataFetchException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MetadataFetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
