package com.example.artworkextractor;

import com.example.artworkextractor.model.MediaCandidate;
import com.example.artworkextractor.model.MediaSelection;
import com.example.artworkextractor.model.MetadataDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chooses the primary and thumbnail media of a token from its provider metadata.
 * <p>
 * The primary comes from {@code metadata.media.uri} (full resolution when present), the thumbnail
 * from the first entry of the top-level {@code media} array. Selection never fails: a missing or
 * malformed location simply yields no candidate for that role.
 */
public class MediaSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(MediaSelector.class);

    private final MediaSelectionPolicy policy;

    public MediaSelector(MediaSelectionPolicy policy) {
        this.policy = policy;
    }

    public MediaSelector() {
        this(MediaSelectionPolicy.defaults());
    }

    public MediaSelection select(MetadataDocument document, boolean downloadThumbnails) {
        Optional<MediaCandidate> primary = primaryCandidate(document);
        if (!downloadThumbnails) {
            LOGGER.info("Skipping thumbnail selection (thumbnail downloads disabled)");
            return new MediaSelection(primary, Optional.empty());
        }
        Optional<MediaCandidate> thumbnail = thumbnailCandidate(document);
        if (primary.isPresent() && thumbnail.isPresent() && isDuplicate(primary.get(), thumbnail.get())) {
            LOGGER.info("Skipping duplicate thumbnail {} (same resource as primary {})",
                    thumbnail.get().url(), primary.get().url());
            thumbnail = Optional.empty();
        }
        return new MediaSelection(primary, thumbnail);
    }

    Optional<MediaCandidate> primaryCandidate(MetadataDocument document) {
        if (!document.isObject("metadata", "media")) {
            return Optional.empty();
        }
        return document.text("metadata", "media", "uri")
                .map(uri -> new MediaCandidate(uri, Optional.empty(), document.text("metadata", "media", "mimeType")));
    }

    Optional<MediaCandidate> thumbnailCandidate(MetadataDocument document) {
        if (!document.node("media").isArray() || !document.isObject("media", "0")) {
            return Optional.empty();
        }
        Optional<String> gateway = document.text("media", "0", "gateway");
        Optional<String> raw = document.text("media", "0", "raw");
        Optional<String> format = document.text("media", "0", "format");
        Optional<String> chosen = policy.preferGateway() ? gateway.or(() -> raw) : raw.or(() -> gateway);
        return chosen.map(url -> new MediaCandidate(url, gateway, format));
    }

    private boolean isDuplicate(MediaCandidate primary, MediaCandidate thumbnail) {
        List<String> thumbnailUrls = new ArrayList<>();
        thumbnailUrls.add(thumbnail.url());
        thumbnail.gatewayUrl().ifPresent(thumbnailUrls::add);
        for (String url : thumbnailUrls) {
            if (policy.duplicateMatch().matches(primary.url(), url)) {
                return true;
            }
        }
        return false;
    }
}
