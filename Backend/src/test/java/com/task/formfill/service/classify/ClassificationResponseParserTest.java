package com.task.formfill.service.classify;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClassificationResponseParserTest {

    private final ClassificationResponseParser parser = new ClassificationResponseParser();

    @Test
    public void parsesFencedFieldsObject() throws Exception {
        String content = """
                ```json
                {"fields": [{"id": "c1", "key": "full_name", "label": "Full Name", "type": "text",
                  "required": true, "confidence": 0.92, "suggestions": ["Jane Doe"], "extra": 1}]}
                ```
                """;

        List<ClassificationEntry> entries = parser.parse(content);

        assertEquals(1, entries.size());
        ClassificationEntry e = entries.get(0);
        assertEquals("c1", e.candidateId());
        assertEquals("full_name", e.key());
        assertEquals("text", e.type());
        assertTrue(e.required());
        assertEquals(0.92, e.confidence(), 1e-9);
        assertEquals(List.of("Jane Doe"), e.suggestions());
    }

    @Test
    public void acceptsBareArrayAndSurroundingChatter() throws Exception {
        assertEquals(2, parser.parse("[{\"id\": \"a\"}, {\"id\": \"b\"}]").size());
        assertEquals(1, parser.parse("Here you go: {\"fields\": [{\"id\": \"a\"}]} Hope this helps!").size());
    }

    @Test
    public void rejectsEmptyOrFieldlessResponses() {
        assertThrows(IllegalStateException.class, () -> parser.parse("  "));
        assertThrows(IllegalStateException.class, () -> parser.parse("{\"items\": []}"));
        assertThrows(Exception.class, () -> parser.parse("not json at all"));
    }
}
