package com.task.formfill.service.ocr;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HttpOcrProviderTest {

    private final ObjectMapper om = new ObjectMapper();
    private final HttpOcrProvider provider = new HttpOcrProvider(new OkHttpClient(), "http://localhost/recognize");

    @Test
    public void parsesWrappedWordBoxes() throws Exception {
        String body = """
                {"data": {"width": 1000, "height": 500, "words": [
                  {"text": " Name ", "confidence": 91.5, "bbox": {"x0": 100, "y0": 50, "x1": 180, "y1": 70}},
                  {"text": "Date", "confidence": 40, "bbox": {"x0": 600, "y0": 50, "x1": 650, "y1": 70}}
                ]}}
                """;

        OcrProvider.PageResult page = provider.parse(om.readTree(body));

        assertFalse(page.isNormalized());
        assertEquals(1000, page.getImageWidth());
        assertEquals(500, page.getImageHeight());
        assertEquals(2, page.getTokens().size());

        OcrProvider.Token name = page.getTokens().get(0);
        assertEquals("Name", name.getText());
        assertEquals(91.5f, name.getConfidence(), 1e-6);
        assertEquals(100, name.getLeft(), 1e-9);
        assertEquals(80, name.getWidth(), 1e-9);
        assertEquals(20, name.getHeight(), 1e-9);
    }

    @Test
    public void acceptsLinesArrayWithoutWrapper() throws Exception {
        String body = """
                {"width": 10, "height": 10, "lines": [{"text": "Sign here", "confidence": 80, "bbox": {"x0": 1, "y0": 1, "x1": 5, "y1": 2}}]}
                """;

        OcrProvider.PageResult page = provider.parse(om.readTree(body));

        assertEquals(1, page.getTokens().size());
        assertEquals("Sign here", page.getTokens().get(0).getText());
    }

    @Test
    public void missingWordsYieldsNoTokens() throws Exception {
        OcrProvider.PageResult page = provider.parse(om.readTree("{\"result\": {\"width\": 0}}"));

        assertTrue(page.getTokens().isEmpty());
        assertEquals(1, page.getImageWidth());
    }
}
