package com.task.formfill.service.ocr;

import java.util.List;

/**
 * Text-recognition backend. Implementations report word or line boxes either in pixels
 * of the submitted image or already normalized to the page, with confidence on a 0-100 scale.
 */
public interface OcrProvider {

    String name();

    PageResult recognize(byte[] image, String mimeType) throws Exception;

    public static class PageResult {
        private final int imageWidth;
        private final int imageHeight;
        private final boolean normalized;
        private final List<Token> tokens;

        public PageResult(int imageWidth, int imageHeight, boolean normalized, List<Token> tokens) {
            this.imageWidth = imageWidth;
            this.imageHeight = imageHeight;
            this.normalized = normalized;
            this.tokens = tokens == null ? List.of() : tokens;
        }

        public static PageResult normalized(List<Token> tokens) {
            return new PageResult(1, 1, true, tokens);
        }

        public int getImageWidth() { return imageWidth; }
        public int getImageHeight() { return imageHeight; }
        public boolean isNormalized() { return normalized; }
        public List<Token> getTokens() { return tokens; }
    }

    public static class Token {
        private final String id;
        private final String text;
        private final float confidence;
        private final double left;
        private final double top;
        private final double width;
        private final double height;

        public Token(String id, String text, float confidence, double left, double top, double width, double height) {
            this.id = id;
            this.text = text;
            this.confidence = confidence;
            this.left = left;
            this.top = top;
            this.width = width;
            this.height = height;
        }

        public String getId() { return id; }
        public String getText() { return text; }
        public float getConfidence() { return confidence; }
        public double getLeft() { return left; }
        public double getTop() { return top; }
        public double getWidth() { return width; }
        public double getHeight() { return height; }
    }
}
