package com.example.artworkextractor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive range of token ids on one contract.
 */
public record TokenRange(String contractAddress, BigInteger first, BigInteger last) {
    public TokenRange {
        if (contractAddress == null || contractAddress.isBlank()) {
            throw new IllegalArgumentException("Contract address is required.");
        }
        if (first == null) {
            throw new IllegalArgumentException("First token id is required.");
        }
        if (last == null) {
            last = first;
        }
    }

    /**
     * Returns the references in ascending order; empty when {@code last < first}.
     */
    public List<TokenReference> references() {
        List<TokenReference> references = new ArrayList<>();
        for (BigInteger id = first; id.compareTo(last) <= 0; id = id.add(BigInteger.ONE)) {
            references.add(new TokenReference(contractAddress, id.toString()));
        }
        return references;
    }
}
