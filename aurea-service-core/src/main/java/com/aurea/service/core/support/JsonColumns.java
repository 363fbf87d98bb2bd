package com.aurea.service.core.support;

import com.aurea.service.core.model.StageEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Decodes the jsonb columns of the session and event tables. */
public final class JsonColumns {
    private static final ObjectMapper M = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT = new TypeReference<>() {};

    static {
        M.findAndRegisterModules();
    }

    private JsonColumns() {}

    public static Map<String, Object> readObject(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return Collections.unmodifiableMap(M.readValue(json, OBJECT));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON object decode failed", e);
        }
    }

    /**
     * Stage history entries are {@code {"stage": ..., "enteredAt": ...}} where {@code enteredAt} is either epoch
     * milliseconds or an ISO-8601 string.
     */
    public static List<StageEntry> readStageHistory(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = M.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stage history decode failed", e);
        }
        if (!root.isArray()) {
            return List.of();
        }
        List<StageEntry> entries = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            String stage = node.path("stage").asText(null);
            if (stage == null) {
                continue;
            }
            entries.add(new StageEntry(stage, enteredAt(node.get("enteredAt"))));
        }
        return List.copyOf(entries);
    }

    private static Instant enteredAt(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        return Instant.parse(node.asText());
    }
}
