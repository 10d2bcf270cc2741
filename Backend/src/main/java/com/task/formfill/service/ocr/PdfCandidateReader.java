package com.task.formfill.service.ocr;

import com.task.formfill.model.BoundingBox;
import com.task.formfill.model.Candidate;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads candidates straight out of a PDF: positioned text runs from the text layer and
 * interactive form widgets from the AcroForm.
 */
@Component
public class PdfCandidateReader {

    static final double TEXT_CONFIDENCE = 0.95;
    static final double WIDGET_CONFIDENCE = 1.0;

    public List<Candidate> readTextRuns(PDDocument doc) throws IOException {
        RunCollector collector = new RunCollector();
        collector.writeText(doc, Writer.nullWriter());
        return collector.runs;
    }

    public List<Candidate> readFormWidgets(PDDocument doc) throws IOException {
        List<Candidate> out = new ArrayList<>();
        PDAcroForm form = doc.getDocumentCatalog().getAcroForm();
        if (form == null) return out;

        Map<COSDictionary, String> fieldNames = new HashMap<>();
        for (PDField field : form.getFieldTree()) {
            for (PDAnnotationWidget widget : field.getWidgets()) {
                fieldNames.put(widget.getCOSObject(), field.getFullyQualifiedName());
            }
        }

        int pageNo = 0;
        for (PDPage page : doc.getPages()) {
            pageNo++;
            PDRectangle box = page.getCropBox();
            for (PDAnnotation annotation : page.getAnnotations()) {
                if (!(annotation instanceof PDAnnotationWidget)) continue;
                String name = fieldNames.get(annotation.getCOSObject());
                PDRectangle r = annotation.getRectangle();
                if (name == null || name.isBlank() || r == null) continue;

                BoundingBox bbox = new BoundingBox(
                        pageNo,
                        (r.getLowerLeftX() - box.getLowerLeftX()) / box.getWidth(),
                        1 - (r.getUpperRightY() - box.getLowerLeftY()) / box.getHeight(),
                        r.getWidth() / box.getWidth(),
                        r.getHeight() / box.getHeight()
                ).clamped();
                out.add(new Candidate("field-" + pageNo + "-" + name, name, WIDGET_CONFIDENCE, bbox, List.of()));
            }
        }
        return out;
    }

    /** Renders every page to PNG for documents without a text layer. */
    public List<byte[]> rasterize(PDDocument doc, float dpi) throws IOException {
        PDFRenderer renderer = new PDFRenderer(doc);
        List<byte[]> pages = new ArrayList<>();
        for (int i = 0; i < doc.getNumberOfPages(); i++) {
            BufferedImage image = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            pages.add(out.toByteArray());
        }
        return pages;
    }

    private static final class RunCollector extends PDFTextStripper {

        private final List<Candidate> runs = new ArrayList<>();

        RunCollector() throws IOException {
            setSortByPosition(true);
        }

        @Override
        protected void writeString(String text, List<TextPosition> positions) throws IOException {
            String trimmed = text == null ? "" : text.trim();
            if (trimmed.isEmpty() || positions == null || positions.isEmpty()) return;

            float left = Float.MAX_VALUE;
            float top = Float.MAX_VALUE;
            float right = -Float.MAX_VALUE;
            float bottom = -Float.MAX_VALUE;
            for (TextPosition p : positions) {
                left = Math.min(left, p.getXDirAdj());
                right = Math.max(right, p.getXDirAdj() + p.getWidthDirAdj());
                top = Math.min(top, p.getYDirAdj() - p.getHeightDir());
                bottom = Math.max(bottom, p.getYDirAdj());
            }

            TextPosition first = positions.get(0);
            float pageWidth = first.getPageWidth();
            float pageHeight = first.getPageHeight();
            if (pageWidth <= 0 || pageHeight <= 0) return;

            int page = getCurrentPageNo();
            BoundingBox bbox = new BoundingBox(
                    page,
                    left / pageWidth,
                    top / pageHeight,
                    (right - left) / pageWidth,
                    (bottom - top) / pageHeight
            ).clamped();
            runs.add(new Candidate("pdf-" + page + "-" + runs.size(), trimmed, TEXT_CONFIDENCE, bbox, List.of()));
        }
    }
}
