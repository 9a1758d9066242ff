package com.example.artworkextractor;

import com.example.artworkextractor.model.ArtifactManifest;
import com.example.artworkextractor.model.ArtifactRole;
import com.example.artworkextractor.model.ManifestEntry;
import com.example.artworkextractor.model.MediaCandidate;
import com.example.artworkextractor.model.MediaSelection;
import com.example.artworkextractor.model.MetadataDocument;
import com.example.artworkextractor.model.ResolvedMedia;
import com.example.artworkextractor.model.SimplifiedMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Produces every artifact of one token: primary media, thumbnail, simplified metadata and the full
 * provider response.
 * <p>
 * Each artifact is attempted independently; a failure is recorded in the returned manifest and the
 * remaining artifacts are still written. The finished manifest is handed to the {@link ArtifactSyncer}.
 */
public class ResourceOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResourceOrchestrator.class);

    private final MediaSelector mediaSelector;
    private final ExtensionResolver extensionResolver;
    private final ArtifactWriter artifactWriter;
    private final ArtifactSyncer artifactSyncer;

    public ResourceOrchestrator(MediaSelector mediaSelector,
                                ExtensionResolver extensionResolver,
                                ArtifactWriter artifactWriter,
                                ArtifactSyncer artifactSyncer) {
        this.mediaSelector = mediaSelector;
        this.extensionResolver = extensionResolver;
        this.artifactWriter = artifactWriter;
        this.artifactSyncer = artifactSyncer == null ? ArtifactSyncer.noop() : artifactSyncer;
    }

    public ResourceOrchestrator(MediaSelector mediaSelector,
                                ExtensionResolver extensionResolver,
                                ArtifactWriter artifactWriter) {
        this(mediaSelector, extensionResolver, artifactWriter, ArtifactSyncer.noop());
    }

    public ArtifactManifest resolveAndSave(MetadataDocument document,
                                           String tokenId,
                                           String contractAddress,
                                           ResolutionOptions options) {
        LOGGER.debug("Saving resources for {}/{}", contractAddress, tokenId);
        String baseName = baseName(document, tokenId);
        LOGGER.debug("Using base name {}", baseName);

        MediaSelection selection = mediaSelector.select(document, options.downloadThumbnails());
        List<ManifestEntry> entries = new ArrayList<>();
        selection.primary().ifPresent(candidate -> entries.add(saveMedia(baseName, candidate, ArtifactRole.PRIMARY)));
        selection.thumbnail().ifPresent(candidate -> entries.add(saveMedia(baseName, candidate, ArtifactRole.THUMBNAIL)));
        if (selection.primary().isEmpty()) {
            LOGGER.info("No primary media found for {}/{}", contractAddress, tokenId);
        }

        entries.add(saveJson(baseName, ArtifactRole.METADATA, () -> simplify(document)));
        entries.add(saveJson(baseName, ArtifactRole.TOKEN_METADATA, document::root));

        ArtifactManifest manifest = new ArtifactManifest(contractAddress, tokenId, baseName, entries);
        if (manifest.hasFailures()) {
            LOGGER.warn("Token {}/{} finished with failed artifacts", contractAddress, tokenId);
        }
        artifactSyncer.sync(manifest);
        return manifest;
    }

    /**
     * {@code metadata.name}, then {@code title}, then {@code token-<tokenId>}, each sanitized.
     */
    static String baseName(MetadataDocument document, String tokenId) {
        String fromName = NameSanitizer.sanitize(document.text("metadata", "name").orElse(""));
        if (!fromName.isEmpty()) {
            return fromName;
        }
        String fromTitle = NameSanitizer.sanitize(document.text("title").orElse(""));
        if (!fromTitle.isEmpty()) {
            return fromTitle;
        }
        String fallback = NameSanitizer.sanitize("token-" + tokenId);
        return fallback.isEmpty() ? "token" : fallback;
    }

    /**
     * Projects the fixed fields from the {@code metadata} section, or from the top level when there is none.
     */
    static SimplifiedMetadata simplify(MetadataDocument document) {
        String[] section = document.isObject("metadata") ? new String[]{"metadata"} : new String[0];
        return new SimplifiedMetadata(
                document.text(path(section, "name")).orElse(null),
                document.text(path(section, "description")).orElse(null),
                tags(document.node(path(section, "tags"))),
                document.text(path(section, "createdBy")).orElse(null),
                yearCreated(document.node(path(section, "yearCreated")))
        );
    }

    private ManifestEntry saveMedia(String baseName, MediaCandidate candidate, ArtifactRole role) {
        String extension = mediaExtension(extensionResolver.resolve(candidate.url(), candidate.mimeHint()));
        ResolvedMedia media = new ResolvedMedia(candidate.url(), extension, role);
        try {
            return ManifestEntry.from(role, candidate.url(), artifactWriter.download(baseName, media));
        } catch (IOException ex) {
            LOGGER.warn("Failed to save {} media from {}", role, candidate.url(), ex);
            return ManifestEntry.failed(role,
                    artifactWriter.pathFor(baseName, role, extension).toString(),
                    candidate.url(),
                    ex.getMessage());
        }
    }

    /**
     * {@code <baseName>.json} belongs to the simplified metadata, so media resolved as JSON is saved as {@code .bin}.
     */
    static String mediaExtension(String extension) {
        return "json".equalsIgnoreCase(extension) ? ExtensionResolver.DEFAULT_EXTENSION : extension;
    }

    private ManifestEntry saveJson(String baseName, ArtifactRole role, JsonSource source) {
        try {
            return ManifestEntry.from(role, null, artifactWriter.writeJson(baseName, role, source.get()));
        } catch (IOException | UncheckedIOException ex) {
            LOGGER.warn("Failed to write {} for {}", role, baseName, ex);
            return ManifestEntry.failed(role,
                    artifactWriter.pathFor(baseName, role, "json").toString(),
                    null,
                    ex.getMessage());
        }
    }

    private static List<String> tags(JsonNode node) {
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            node.forEach(element -> {
                if (element.isValueNode() && !element.isNull() && !element.asText().isBlank()) {
                    values.add(element.asText());
                }
            });
            return values.isEmpty() ? null : List.copyOf(values);
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            return List.of(node.asText());
        }
        return null;
    }

    private static JsonNode yearCreated(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble() == 0.0 ? null : node;
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            return node;
        }
        return null;
    }

    private static String[] path(String[] prefix, String field) {
        String[] path = new String[prefix.length + 1];
        System.arraycopy(prefix, 0, path, 0, prefix.length);
        path[prefix.length] = field;
        return path;
    }

    @FunctionalInterface
    private interface JsonSource {
        Object get() throws IOException;
    }
}
