package com.convoflow.schema;

import com.convoflow.schema.model.FlowDocument;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of flow documents.
 * JSON excludes null values when serializing; unknown fields are ignored when reading.
 */
public final class FlowJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private FlowJson() {
    }

    /**
     * Deserializes a flow document from a JSON string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static FlowDocument fromJson(String json) {
        try {
            return MAPPER.readValue(json, FlowDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes a flow document to an indented JSON string (nulls excluded).
     */
    public static String toJson(FlowDocument document) {
        try {
            return MAPPER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Parses raw JSON into a tree, for structural validation before binding. */
    public static JsonNode readTree(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static JsonNode toTree(FlowDocument document) {
        return MAPPER.valueToTree(document);
    }

    public static FlowDocument fromTree(JsonNode tree) {
        try {
            return MAPPER.treeToValue(tree, FlowDocument.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
