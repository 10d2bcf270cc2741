package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to produce one filled document. Byte arrays travel as base64 in JSON.
 */
public record RenderRequest(
        @JsonProperty("document")
        byte[] document,

        @JsonProperty("mime_type")
        String mimeType,

        @JsonProperty("fields")
        List<ClassifiedField> fields,

        @JsonProperty("mappings")
        List<FieldMapping> mappings,

        @JsonProperty("signature_image")
        byte[] signatureImage,

        // keyed by field id, falling back to field key
        @JsonProperty("date_overrides")
        Map<String, String> dateOverrides
) {

    public RenderRequest {
        fields = fields == null ? List.of() : List.copyOf(fields);
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
        dateOverrides = dateOverrides == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(dateOverrides));
    }
}
