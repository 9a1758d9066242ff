package com.example.artworkextractor.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Read-only view over a provider metadata response.
 * <p>
 * The provider schema varies by minting pipeline, so the document stays an untyped JSON tree and
 * every lookup treats an absent or mistyped node as "not present" rather than an error.
 */
public final class MetadataDocument {
    private final JsonNode root;

    private MetadataDocument(JsonNode root) {
        this.root = root;
    }

    public static MetadataDocument of(JsonNode root) {
        Objects.requireNonNull(root, "root");
        return new MetadataDocument(root.deepCopy());
    }

    /**
     * Returns a defensive copy of the whole tree, used when the document is written out unchanged.
     */
    public JsonNode root() {
        return root.deepCopy();
    }

    /**
     * Walks object fields by name. Array elements are addressed by their decimal index.
     */
    public JsonNode node(String... path) {
        JsonNode current = root;
        for (String segment : path) {
            if (current == null || current.isMissingNode() || current.isNull()) {
                return MissingNode.getInstance();
            }
            if (current.isArray() && isIndex(segment)) {
                current = current.path(Integer.parseInt(segment));
            } else if (current.isObject()) {
                current = current.path(segment);
            } else {
                return MissingNode.getInstance();
            }
        }
        return current == null ? MissingNode.getInstance() : current;
    }

    /**
     * Returns the non-blank textual value at {@code path}. Numbers and booleans are rendered as text.
     */
    public Optional<String> text(String... path) {
        JsonNode node = node(path);
        if (!node.isValueNode() || node.isNull()) {
            return Optional.empty();
        }
        String value = node.asText();
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public boolean isObject(String... path) {
        return node(path).isObject();
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
