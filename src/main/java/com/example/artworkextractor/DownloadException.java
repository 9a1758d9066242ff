package com.example.artworkextractor;

import java.io.IOException;

/**
 * Raised when a media URL cannot be fetched. {@link #statusCode()} is -1 for network errors and timeouts.
 */
public class DownloadException extends IOException {
    private final String url;
    private final int statusCode;

    public DownloadException(String url, int statusCode) {
        super("Failed to download " + url + " (HTTP " + statusCode + ")");
        this.url = url;
        this.statusCode = statusCode;
    }

    public DownloadException(String url, Throwable cause) {
        super("Failed to download " + url + ": " + cause.getMessage(), cause);
        this.url = url;
        this.statusCode = -1;
    }

    public String url() {
        return url;
    }

    public int statusCode() {
        return statusCode;
    }
}
