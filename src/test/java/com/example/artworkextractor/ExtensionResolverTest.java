package com.example.artworkextractor;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExtensionResolverTest {
    private final ExtensionResolver resolver = new ExtensionResolver();

    @Test
    void urlExtensionWinsOverMimeHint() {
        assertEquals("png", resolver.resolve("https://x/a.png?x=1", "image/jpeg"));
    }

    @Test
    void fallsBackToMimeHint() {
        assertEquals("jpg", resolver.resolve("https://x/a", "image/jpeg"));
    }

    @Test
    void defaultsToBinWithoutHint() {
        assertEquals("bin", resolver.resolve("https://x/a", Optional.empty()));
        assertEquals("bin", resolver.resolve("https://x/a", (String) null));
    }

    @Test
    void lowercasesUrlExtensionsAndIgnoresFragments() {
        assertEquals("jpeg", resolver.resolve("https://x/IMG_01.JPEG#frag", Optional.empty()));
        assertEquals("mp4", resolver.resolve("ipfs://QmHash/video.mp4", "image/gif"));
    }

    @Test
    void ignoresNonMediaSuffixesOnTheUrl() {
        assertEquals("webp", resolver.resolve("https://example.com", "image/webp"));
        assertEquals("gif", resolver.resolve("https://x/metadata/token.php?id=1", "image/gif"));
    }

    @Test
    void normalizesMimeParametersAndCase() {
        assertEquals("svg", resolver.resolve("https://x/a", " Image/SVG+XML; charset=utf-8 "));
        assertEquals("webm", resolver.resolve("https://x/a", "video/webm"));
    }

    @Test
    void acceptsBareFormatHints() {
        assertEquals("png", resolver.resolve("https://x/a", "png"));
        assertEquals("jpg", resolver.resolve("https://x/a", "JPEG"));
        assertEquals("mp4", resolver.resolve("https://x/a", "mp4"));
    }

    @Test
    void genericOrUnknownMimeTypesFallBackToBin() {
        assertEquals("bin", resolver.resolve("https://x/a", "application/octet-stream"));
        assertEquals("bin", resolver.resolve("https://x/a", "image/x-made-up-format"));
        assertEquals("bin", resolver.resolve("https://x/a", "   "));
    }

    @Test
    void usesMimeRegistryForTypesOutsideTheExplicitTable() {
        assertEquals("pdf", resolver.resolve("https://x/a", "application/pdf"));
    }
}
