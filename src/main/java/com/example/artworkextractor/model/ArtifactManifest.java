package com.example.artworkextractor.model;

import java.util.List;
import java.util.Optional;

/**
 * Ordered record of every artifact attempted for one token: primary, thumbnail, metadata,
 * token metadata. Roles that were never attempted (no candidate, duplicate, disabled) are absent.
 */
public record ArtifactManifest(
        String contractAddress,
        String tokenId,
        String baseName,
        List<ManifestEntry> entries
) {
    public ArtifactManifest {
        entries = List.copyOf(entries);
    }

    public Optional<ManifestEntry> entry(ArtifactRole role) {
        return entries.stream().filter(entry -> entry.role() == role).findFirst();
    }

    public boolean hasFailures() {
        return entries.stream().anyMatch(ManifestEntry::isFailure);
    }
}
