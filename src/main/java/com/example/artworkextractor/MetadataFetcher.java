package com.example.artworkextractor;

import com.example.artworkextractor.model.MetadataDocument;

@FunctionalInterface
public interface MetadataFetcher {
    /**
     * Returns the provider metadata for one token. Implementations do not retry.
     */
    MetadataDocument fetch(String contractAddress, String tokenId) throws MetadataFetchException;
}
