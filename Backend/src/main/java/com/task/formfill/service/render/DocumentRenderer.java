package com.task.formfill.service.render;

import com.task.formfill.model.ClassifiedField;
import com.task.formfill.model.FieldMapping;
import com.task.formfill.model.FieldType;
import com.task.formfill.model.RenderRequest;
import com.task.formfill.model.RenderResult;
import com.task.formfill.service.CandidateExtractor;
import com.task.formfill.service.ErrorKind;
import com.task.formfill.service.ProcessingException;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Draws resolved values onto the original document and returns a new PDF. A PDF input keeps
 * its pages; a single JPEG or PNG becomes a one-page PDF with the image as background.
 *
 * <p>Drawing happens in three passes: mapped values, then the signature image into unmapped
 * signature fields, then date overrides. A field that cannot be drawn is skipped and reported
 * in {@link RenderResult#skippedFieldIds()}; the rest of the document is still produced.
 */
@Service
public class DocumentRenderer {

    private static final Logger log = LoggerFactory.getLogger(DocumentRenderer.class);

    private static final Set<String> FALSY = Set.of("false", "no", "off", "0", "unchecked");

    private final Tracer tracer;
    private final float defaultFontSize;
    private final float padding;

    public DocumentRenderer(
            Tracer tracer,
            @Value("${formfill.render.default-font-size:12}") float defaultFontSize,
            @Value("${formfill.render.padding:2}") float padding
    ) {
        this.tracer = tracer;
        this.defaultFontSize = defaultFontSize;
        this.padding = padding;
    }

    public RenderResult render(RenderRequest request) {
        if (request == null || request.document() == null || request.document().length == 0) {
            throw ProcessingException.validation("document is required");
        }
        String mime = request.mimeType() == null ? "" : request.mimeType().toLowerCase(Locale.ROOT).trim();

        Span span = tracer.spanBuilder("pdf.render")
                .setAttribute("mime.type", mime)
                .setAttribute("fields.count", request.fields().size())
                .startSpan();

        try (Scope ignored = span.makeCurrent(); PDDocument doc = open(request.document(), mime)) {
            Pass pass = new Pass(doc, request);
            pass.drawMappings();
            pass.drawSignatures();
            pass.drawDateOverrides();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);

            List<String> skipped = new ArrayList<>(pass.skipped);
            span.setAttribute("pages.count", doc.getNumberOfPages());
            span.setAttribute("fields.skipped", skipped.size());
            log.info("Rendered {} page(s), {} field(s) skipped", doc.getNumberOfPages(), skipped.size());
            return new RenderResult(out.toByteArray(), doc.getNumberOfPages(), skipped);
        } catch (IOException e) {
            span.setAttribute("error", true);
            span.setAttribute("error.message", String.valueOf(e.getMessage()));
            throw new ProcessingException(ErrorKind.RENDER_FAILURE, "Rendering failed: " + e.getMessage(), e);
        } finally {
            span.end();
        }
    }

    private PDDocument open(byte[] bytes, String mime) throws IOException {
        if (CandidateExtractor.PDF.equals(mime)) {
            try {
                return Loader.loadPDF(bytes);
            } catch (IOException e) {
                throw new ProcessingException(ErrorKind.UNSUPPORTED_INPUT, "PDF could not be read: " + e.getMessage(), e);
            }
        }
        if (!CandidateExtractor.IMAGE_TYPES.contains(mime)) {
            throw ProcessingException.unsupported("Unsupported file type: " + mime);
        }

        PDDocument doc = new PDDocument();
        try {
            PDImageXObject image = PDImageXObject.createFromByteArray(doc, bytes, "background");
            PDPage page = new PDPage(new PDRectangle(image.getWidth(), image.getHeight()));
            doc.addPage(page);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.drawImage(image, 0, 0, image.getWidth(), image.getHeight());
            }
            return doc;
        } catch (IOException | IllegalArgumentException e) {
            doc.close();
            throw new ProcessingException(ErrorKind.UNSUPPORTED_INPUT, "Image could not be read: " + e.getMessage(), e);
        }
    }

    /** State of one render call. */
    private final class Pass {

        private final PDDocument doc;
        private final RenderRequest request;
        private final PDFont font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        private final Map<String, ClassifiedField> fieldsById = new LinkedHashMap<>();
        private final Set<String> mappedFieldIds = new LinkedHashSet<>();
        private final Set<String> skipped = new LinkedHashSet<>();
        private PDImageXObject signature;
        private boolean signatureDecoded;

        Pass(PDDocument doc, RenderRequest request) {
            this.doc = doc;
            this.request = request;
            for (ClassifiedField f : request.fields()) {
                if (f != null && f.id() != null) fieldsById.putIfAbsent(f.id(), f);
            }
        }

        void drawMappings() {
            for (FieldMapping mapping : request.mappings()) {
                if (mapping == null || !mapping.hasValue()) continue;
                ClassifiedField field = fieldsById.get(mapping.fieldId());
                if (field == null) {
                    skip(mapping.fieldId(), "no classified field with this id");
                    continue;
                }
                mappedFieldIds.add(field.id());
                if (field.type() == FieldType.DATE && dateOverride(field) != null) continue;
                drawField(field, mapping.value());
            }
        }

        void drawSignatures() {
            if (request.signatureImage() == null || request.signatureImage().length == 0) return;
            for (ClassifiedField field : fieldsById.values()) {
                if (field.type() != FieldType.SIGNATURE || mappedFieldIds.contains(field.id())) continue;
                PDPage page = pageOf(field);
                if (page == null) continue;
                PDImageXObject image = signatureImage();
                if (image == null) {
                    skip(field.id(), "signature image could not be decoded");
                    continue;
                }
                try {
                    drawImage(page, box(field, page), image);
                } catch (IOException e) {
                    skip(field.id(), e.getMessage());
                }
            }
        }

        void drawDateOverrides() {
            for (ClassifiedField field : fieldsById.values()) {
                if (field.type() != FieldType.DATE) continue;
                String value = dateOverride(field);
                if (value == null || value.isBlank()) continue;
                PDPage page = pageOf(field);
                if (page == null) continue;
                try {
                    drawText(page, box(field, page), value);
                } catch (IOException e) {
                    skip(field.id(), e.getMessage());
                }
            }
        }

        private void drawField(ClassifiedField field, Object value) {
            PDPage page = pageOf(field);
            if (page == null) return;
            CoordinateMapper.Rect box = box(field, page);
            try {
                switch (field.type()) {
                    case CHECKBOX:
                        if (isChecked(value)) drawCheck(page, box);
                        break;
                    case SIGNATURE:
                        PDImageXObject image = request.signatureImage() == null ? null : signatureImage();
                        if (image != null) {
                            drawImage(page, box, image);
                        } else {
                            drawText(page, box, String.valueOf(value));
                        }
                        break;
                    default:
                        drawText(page, box, String.valueOf(value));
                }
            } catch (IOException e) {
                skip(field.id(), e.getMessage());
            }
        }

        private PDPage pageOf(ClassifiedField field) {
            if (field.bbox() == null) {
                skip(field.id(), "field has no bounding box");
                return null;
            }
            int index = field.bbox().page() - 1;
            if (index < 0 || index >= doc.getNumberOfPages()) {
                skip(field.id(), "page " + field.bbox().page() + " does not exist");
                return null;
            }
            return doc.getPage(index);
        }

        private CoordinateMapper.Rect box(ClassifiedField field, PDPage page) {
            PDRectangle area = page.getCropBox();
            return CoordinateMapper.toAbsolute(field.bbox(), area.getWidth(), area.getHeight())
                    .translate(area.getLowerLeftX(), area.getLowerLeftY());
        }

        private String dateOverride(ClassifiedField field) {
            Map<String, String> overrides = request.dateOverrides();
            String value = overrides.get(field.id());
            return value != null ? value : overrides.get(field.key());
        }

        private PDImageXObject signatureImage() {
            if (!signatureDecoded) {
                signatureDecoded = true;
                try {
                    signature = PDImageXObject.createFromByteArray(doc, request.signatureImage(), "signature");
                } catch (IOException | IllegalArgumentException e) {
                    log.warn("Signature image could not be decoded: {}", e.getMessage());
                }
            }
            return signature;
        }

        private void drawText(PDPage page, CoordinateMapper.Rect box, String value) throws IOException {
            float fontSize = (float) Math.min(defaultFontSize, 0.7 * box.height());
            if (fontSize <= 0) return;
            String text = fitToWidth(encodable(value), fontSize, box.width() - 2 * padding);
            if (text.isEmpty()) return;

            try (PDPageContentStream cs = new PDPageContentStream(doc, page, PDPageContentStream.AppendMode.APPEND, true, true)) {
                cs.beginText();
                cs.setFont(font, fontSize);
                cs.newLineAtOffset((float) (box.x() + padding), (float) (box.y() + (box.height() - fontSize) / 2));
                cs.showText(text);
                cs.endText();
            }
        }

        private void drawCheck(PDPage page, CoordinateMapper.Rect box) throws IOException {
            double size = Math.min(box.width(), box.height()) * 0.6;
            if (size <= 0) return;
            double left = box.centerX() - size / 2;
            double bottom = box.centerY() - size / 2;

            try (PDPageContentStream cs = new PDPageContentStream(doc, page, PDPageContentStream.AppendMode.APPEND, true, true)) {
                cs.setLineWidth((float) Math.max(1, size / 8));
                cs.moveTo((float) left, (float) (bottom + size * 0.5));
                cs.lineTo((float) (left + size * 0.35), (float) bottom);
                cs.lineTo((float) (left + size), (float) (bottom + size));
                cs.stroke();
            }
        }

        private void drawImage(PDPage page, CoordinateMapper.Rect box, PDImageXObject image) throws IOException {
            CoordinateMapper.Rect target = CoordinateMapper.fitPreserving(image.getWidth(), image.getHeight(), box);
            if (target.width() <= 0 || target.height() <= 0) return;
            try (PDPageContentStream cs = new PDPageContentStream(doc, page, PDPageContentStream.AppendMode.APPEND, true, true)) {
                cs.drawImage(image, (float) target.x(), (float) target.y(), (float) target.width(), (float) target.height());
            }
        }

        /** Standard fonts cover WinAnsi only; anything else is replaced with '?'. */
        private String encodable(String value) {
            String flat = value.replaceAll("[\\r\\n\\t]+", " ");
            StringBuilder sb = new StringBuilder(flat.length());
            for (int i = 0; i < flat.length(); i++) {
                char c = flat.charAt(i);
                try {
                    font.encode(String.valueOf(c));
                    sb.append(c);
                } catch (IOException | IllegalArgumentException e) {
                    sb.append('?');
                }
            }
            return sb.toString();
        }

        private String fitToWidth(String text, float fontSize, double maxWidth) throws IOException {
            String s = text;
            while (!s.isEmpty() && font.getStringWidth(s) / 1000f * fontSize > maxWidth) {
                s = s.substring(0, s.length() - 1);
            }
            return s;
        }

        private void skip(String fieldId, String reason) {
            if (skipped.add(String.valueOf(fieldId))) {
                log.warn("Skipping field {}: {}", fieldId, reason);
            }
        }
    }

    private static boolean isChecked(Object value) {
        if (value instanceof Boolean b) return b;
        if (value == null) return false;
        String s = value.toString().trim().toLowerCase(Locale.ROOT);
        return !s.isEmpty() && !FALSY.contains(s);
    }
}
