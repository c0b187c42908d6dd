package com.skyquorum.sources.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyquorum.core.util.JsonUtils;

import java.io.IOException;

/**
 * Tree-model helpers shared by the HTTP adapters. Anything structurally wrong with a payload becomes a
 * {@link FailureKind#PARSE} failure.
 */
public final class SourcePayloads {
    private SourcePayloads() {
    }

    public static JsonNode parse(String sourceId, byte[] body) {
        try {
            JsonNode root = JsonUtils.objectMapper().readTree(body);
            if (root == null || !root.isObject()) {
                throw new SourceException(sourceId, FailureKind.PARSE, "Expected a JSON object from " + sourceId);
            }
            return root;
        } catch (IOException e) {
            throw new SourceException(sourceId, FailureKind.PARSE, "Malformed JSON from " + sourceId, e);
        }
    }

    public static double requireNumber(String sourceId, JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isNumber()) {
            throw new SourceException(sourceId, FailureKind.PARSE, "Missing numeric field '" + field + "' from " + sourceId);
        }
        return value.asDouble();
    }

    public static JsonNode requireArray(String sourceId, JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isArray()) {
            throw new SourceException(sourceId, FailureKind.PARSE, "Missing array '" + field + "' from " + sourceId);
        }
        return value;
    }
}
