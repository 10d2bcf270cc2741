package com.task.formfill.model;

import java.util.List;

public record RenderResult(
        byte[] document,
        int pageCount,
        List<String> skippedFieldIds
) {

    public RenderResult {
        skippedFieldIds = skippedFieldIds == null ? List.of() : List.copyOf(skippedFieldIds);
    }
}
