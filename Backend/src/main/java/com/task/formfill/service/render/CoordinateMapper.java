package com.task.formfill.service.render;

import com.task.formfill.model.BoundingBox;

/**
 * Conversions between normalized top-left-origin boxes and absolute bottom-left-origin
 * drawing coordinates.
 */
public final class CoordinateMapper {

    private CoordinateMapper() {
    }

    /**
     * {@code x_abs = x * W}, {@code y_abs = H - y * H - height * H}. The box is clamped to the
     * page first, so the result always satisfies {@code 0 <= y_abs} and {@code y_abs + height_abs <= H}.
     */
    public static Rect toAbsolute(BoundingBox bbox, double pageWidth, double pageHeight) {
        BoundingBox b = bbox.clamped();
        double width = b.width() * pageWidth;
        double height = b.height() * pageHeight;
        double x = b.x() * pageWidth;
        double y = Math.max(0, pageHeight - b.y() * pageHeight - height);
        return new Rect(x, y, width, height);
    }

    /**
     * Largest rectangle with the source's aspect ratio that fits inside {@code box}, centered in it.
     */
    public static Rect fitPreserving(double sourceWidth, double sourceHeight, Rect box) {
        if (sourceWidth <= 0 || sourceHeight <= 0 || box.width() <= 0 || box.height() <= 0) {
            return new Rect(box.x(), box.y(), 0, 0);
        }
        double aspect = sourceWidth / sourceHeight;
        double drawWidth = box.width();
        double drawHeight = box.height();
        if (box.width() / box.height() > aspect) {
            drawWidth = box.height() * aspect;
        } else {
            drawHeight = box.width() / aspect;
        }
        return new Rect(
                box.x() + (box.width() - drawWidth) / 2,
                box.y() + (box.height() - drawHeight) / 2,
                drawWidth,
                drawHeight);
    }

    public record Rect(double x, double y, double width, double height) {

        public Rect translate(double dx, double dy) {
            return new Rect(x + dx, y + dy, width, height);
        }

        public double centerX() {
            return x + width / 2;
        }

        public double centerY() {
            return y + height / 2;
        }
    }
}
