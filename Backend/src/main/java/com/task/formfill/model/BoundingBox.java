package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Position of a detection on a page, normalized to the page size with the origin at the top-left corner.
 */
public record BoundingBox(
        @JsonProperty("page")
        int page,

        @JsonProperty("x")
        double x,

        @JsonProperty("y")
        double y,

        @JsonProperty("width")
        double width,

        @JsonProperty("height")
        double height
) {

    /**
     * Providers occasionally report boxes slightly outside the page. Pull them back so that
     * {@code x + width <= 1} and {@code y + height <= 1}.
     */
    public BoundingBox clamped() {
        double cx = clamp01(x);
        double cy = clamp01(y);
        double cw = Math.min(clamp01(width), 1.0 - cx);
        double ch = Math.min(clamp01(height), 1.0 - cy);
        return new BoundingBox(Math.max(1, page), cx, cy, cw, ch);
    }

    public double centerX() {
        return x + width / 2;
    }

    public double centerY() {
        return y + height / 2;
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public double distanceTo(BoundingBox other) {
        double dx = other.centerX() - centerX();
        double dy = other.centerY() - centerY();
        return Math.sqrt(dx * dx + dy * dy);
    }

    public BoundingBox union(BoundingBox other) {
        double left = Math.min(x, other.x);
        double top = Math.min(y, other.y);
        double r = Math.max(right(), other.right());
        double b = Math.max(bottom(), other.bottom());
        return new BoundingBox(page, left, top, r - left, b - top);
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v) || v < 0) return 0;
        return Math.min(v, 1.0);
    }
}
