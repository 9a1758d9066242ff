package com.example.artworkextractor;

/**
 * A token to resolve: contract address plus decimal token id.
 */
public record TokenReference(String contractAddress, String tokenId) {
    @Override
    public String toString() {
        return contractAddress + "/" + tokenId;
    }
}
