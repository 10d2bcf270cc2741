package com.task.formfill.service.ocr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Remote OCR service reached over HTTP. The service answers with Tesseract-style word boxes:
 * {@code {"width":..,"height":..,"words":[{"text":..,"confidence":..,"bbox":{"x0":..,"y0":..,"x1":..,"y1":..}}]}},
 * optionally wrapped in {@code data} or {@code result}.
 */
@Service
public class HttpOcrProvider implements OcrProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpOcrProvider.class);

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String ocrUrl;

    public HttpOcrProvider(
            OkHttpClient http,
            @Value("${formfill.ocr.http.url:http://ocr-service:8000/recognize}") String ocrUrl
    ) {
        this.http = http;
        this.ocrUrl = ocrUrl;
    }

    @Override
    public String name() {
        return "http";
    }

    @Override
    public PageResult recognize(byte[] image, String mimeType) throws Exception {
        RequestBody fileBody = RequestBody.create(image, MediaType.parse(mimeType));
        MultipartBody requestBody = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("file", "page", fileBody)
                .build();

        Request request = new Request.Builder()
                .url(ocrUrl)
                .post(requestBody)
                .build();

        try (Response response = http.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IllegalStateException("OCR service returned: " + response.code() + " - " + response.message());
            }

            String body = response.body() == null ? "" : response.body().string();
            return parse(om.readTree(body));
        }
    }

    PageResult parse(JsonNode root) {
        JsonNode data = root;
        if (root.has("data")) data = root.get("data");
        else if (root.has("result")) data = root.get("result");

        int width = data.path("width").asInt(1);
        int height = data.path("height").asInt(1);

        List<Token> tokens = new ArrayList<>();
        JsonNode words = data.has("words") ? data.get("words") : data.path("lines");
        if (words.isArray()) {
            int idx = 0;
            for (JsonNode w : words) {
                String text = w.path("text").asText("").trim();
                JsonNode box = w.path("bbox");
                double x0 = box.path("x0").asDouble();
                double y0 = box.path("y0").asDouble();
                double x1 = box.path("x1").asDouble();
                double y1 = box.path("y1").asDouble();
                tokens.add(new Token(
                        "http-" + idx++,
                        text,
                        (float) w.path("confidence").asDouble(0),
                        x0, y0, x1 - x0, y1 - y0));
            }
        } else {
            log.warn("OCR service response had no words or lines array");
        }
        return new PageResult(Math.max(width, 1), Math.max(height, 1), false, tokens);
    }
}
