package com.example.artworkextractor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Lossy projection of the provider metadata written next to the media files.
 * Absent fields are omitted from the serialized form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "description", "tags", "createdBy", "yearCreated"})
public record SimplifiedMetadata(
        String name,
        String description,
        List<String> tags,
        String createdBy,
        JsonNode yearCreated
) {
}
