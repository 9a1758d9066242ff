package com.example.artworkextractor.model;

import java.nio.file.Path;

/**
 * Outcome of one successful artifact write. {@code skipped} is true when the file already existed.
 */
public record WriteResult(
        Path path,
        long byteSize,
        boolean skipped
) {
}
