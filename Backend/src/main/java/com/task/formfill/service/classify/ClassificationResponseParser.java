package com.task.formfill.service.classify;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls the {@code fields} array out of a chat completion, tolerating Markdown fences and
 * chatter around the JSON.
 */
public class ClassificationResponseParser {

    private final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public List<ClassificationEntry> parse(String content) throws Exception {
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("Classification model returned an empty response");
        }

        JsonNode root = om.readTree(cleanJsonResponse(content));
        JsonNode fields = root.isArray() ? root : root.path("fields");
        if (!fields.isArray()) {
            throw new IllegalStateException("Classification response has no fields array");
        }

        List<ClassificationEntry> entries = new ArrayList<>();
        for (JsonNode node : fields) {
            entries.add(om.treeToValue(node, ClassificationEntry.class));
        }
        return entries;
    }

    static String cleanJsonResponse(String json) {
        json = json.trim();
        if (json.startsWith("```")) {
            json = json.replace("```json", "").replace("```", "").trim();
        }
        if (json.startsWith("[")) {
            return json;
        }
        int start = json.indexOf("{");
        int end = json.lastIndexOf("}");
        if (start >= 0 && end > start) {
            return json.substring(start, end + 1);
        }
        return json;
    }
}
