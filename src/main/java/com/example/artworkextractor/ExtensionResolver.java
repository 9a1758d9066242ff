package com.example.artworkextractor;

import org.apache.tika.mime.MimeType;
import org.apache.tika.mime.MimeTypeException;
import org.apache.tika.mime.MimeTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the file extension for a media URL.
 * <p>
 * Resolution order: a known media extension on the URL path, then the MIME (or bare format) hint,
 * then {@value #DEFAULT_EXTENSION}. URLs win because provider MIME metadata is often generic or wrong.
 */
public class ExtensionResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExtensionResolver.class);

    static final String DEFAULT_EXTENSION = "bin";

    private static final Pattern PATH_EXTENSION = Pattern.compile("\\.([A-Za-z0-9]{2,5})$");

    private static final Set<String> MEDIA_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "gif", "webp", "svg", "bmp", "tif", "tiff", "avif", "heic", "ico",
            "mp4", "webm", "mov", "m4v", "ogv", "mkv", "avi",
            "mp3", "wav", "ogg", "flac", "m4a",
            "glb", "gltf", "html"
    );

    private static final Map<String, String> FORMAT_TO_MIME = Map.ofEntries(
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("webp", "image/webp"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("webm", "video/webm"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("m4v", "video/x-m4v"),
            Map.entry("glb", "model/gltf-binary"),
            Map.entry("gltf", "model/gltf+json")
    );

    // Types the MIME registry either lacks or maps to an uncommon first extension.
    private static final Map<String, String> MIME_TO_EXTENSION = Map.ofEntries(
            Map.entry("image/jpeg", "jpg"),
            Map.entry("image/jpg", "jpg"),
            Map.entry("image/pjpeg", "jpg"),
            Map.entry("image/png", "png"),
            Map.entry("image/gif", "gif"),
            Map.entry("image/webp", "webp"),
            Map.entry("image/svg+xml", "svg"),
            Map.entry("image/bmp", "bmp"),
            Map.entry("image/avif", "avif"),
            Map.entry("video/mp4", "mp4"),
            Map.entry("video/webm", "webm"),
            Map.entry("video/quicktime", "mov"),
            Map.entry("video/x-m4v", "m4v"),
            Map.entry("model/gltf-binary", "glb"),
            Map.entry("model/gltf+json", "gltf"),
            Map.entry("application/octet-stream", DEFAULT_EXTENSION)
    );

    private final MimeTypes mimeTypes;

    public ExtensionResolver() {
        this(MimeTypes.getDefaultMimeTypes());
    }

    public ExtensionResolver(MimeTypes mimeTypes) {
        this.mimeTypes = mimeTypes;
    }

    /**
     * Returns a lowercase extension without the leading dot. Never fails.
     */
    public String resolve(String url, Optional<String> mimeHint) {
        Optional<String> fromUrl = fromUrl(url);
        if (fromUrl.isPresent()) {
            return fromUrl.get();
        }
        return mimeHint
                .map(ExtensionResolver::normalizeMime)
                .filter(mime -> !mime.isEmpty())
                .flatMap(this::fromMime)
                .orElse(DEFAULT_EXTENSION);
    }

    public String resolve(String url, String mimeHint) {
        return resolve(url, Optional.ofNullable(mimeHint));
    }

    static Optional<String> fromUrl(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String path = stripQueryAndFragment(url.trim());
        int slash = path.lastIndexOf('/');
        String lastSegment = slash >= 0 ? path.substring(slash + 1) : path;
        Matcher matcher = PATH_EXTENSION.matcher(lastSegment);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String extension = matcher.group(1).toLowerCase(Locale.ROOT);
        return MEDIA_EXTENSIONS.contains(extension) ? Optional.of(extension) : Optional.empty();
    }

    /**
     * Lowercases, drops parameters such as {@code ;charset=} and expands bare formats ("png") to MIME types.
     */
    static String normalizeMime(String hint) {
        String mime = hint.trim().toLowerCase(Locale.ROOT);
        int semicolon = mime.indexOf(';');
        if (semicolon >= 0) {
            mime = mime.substring(0, semicolon).trim();
        }
        if (mime.isEmpty() || mime.contains("/")) {
            return mime;
        }
        return FORMAT_TO_MIME.getOrDefault(mime, "image/" + mime);
    }

    private Optional<String> fromMime(String mime) {
        String known = MIME_TO_EXTENSION.get(mime);
        if (known != null) {
            return Optional.of(known);
        }
        try {
            MimeType type = mimeTypes.forName(mime);
            String extension = type.getExtension();
            if (extension == null || extension.length() < 2) {
                return Optional.empty();
            }
            return Optional.of(extension.substring(1).toLowerCase(Locale.ROOT));
        } catch (MimeTypeException ex) {
            LOGGER.debug("Ignoring unparseable MIME hint {}", mime, ex);
            return Optional.empty();
        }
    }

    private static String stripQueryAndFragment(String url) {
        int end = url.length();
        int query = url.indexOf('?');
        if (query >= 0) {
            end = query;
        }
        int fragment = url.indexOf('#');
        if (fragment >= 0 && fragment < end) {
            end = fragment;
        }
        return url.substring(0, end);
    }
}
