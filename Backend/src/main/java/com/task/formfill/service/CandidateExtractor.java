package com.task.formfill.service;

import com.task.formfill.model.BoundingBox;
import com.task.formfill.model.Candidate;
import com.task.formfill.model.ExtractionResult;
import com.task.formfill.service.ocr.OcrProvider;
import com.task.formfill.service.ocr.OcrProviderSelector;
import com.task.formfill.service.ocr.PdfCandidateReader;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns raw document bytes into a flat list of positioned candidates.
 * PDFs are read from their text layer and form widgets; image-only PDFs and raster images go
 * through the recognition providers chosen by {@link OcrProviderSelector}.
 */
@Service
public class CandidateExtractor {

    private static final Logger log = LoggerFactory.getLogger(CandidateExtractor.class);

    public static final String PDF = "application/pdf";
    /** Raster types that recognition and rendering can both decode. */
    public static final Set<String> IMAGE_TYPES = Set.of("image/jpeg", "image/jpg", "image/png");

    private final PdfCandidateReader pdfReader;
    private final OcrProviderSelector selector;
    private final Tracer tracer;
    private final double minConfidence;
    private final float renderDpi;

    public CandidateExtractor(
            PdfCandidateReader pdfReader,
            OcrProviderSelector selector,
            Tracer tracer,
            @Value("${formfill.ocr.min-confidence:0.30}") double minConfidence,
            @Value("${formfill.ocr.pdf-render-dpi:144}") float renderDpi
    ) {
        this.pdfReader = pdfReader;
        this.selector = selector;
        this.tracer = tracer;
        this.minConfidence = minConfidence;
        this.renderDpi = renderDpi;
    }

    public ExtractionResult extract(byte[] document, String mimeType) {
        long t0 = System.currentTimeMillis();

        Span span = tracer.spanBuilder("ocr.extract")
                .setAttribute("mime.type", String.valueOf(mimeType))
                .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            if (document == null || document.length == 0) {
                throw ProcessingException.validation("Document bytes are required");
            }
            String mime = normalizeMime(mimeType);
            if (mime.isEmpty()) {
                throw ProcessingException.validation("Mime type is required");
            }

            Extraction extraction;
            if (PDF.equals(mime)) {
                extraction = extractPdf(document);
            } else if (IMAGE_TYPES.contains(mime)) {
                extraction = recognizeImage(document, mime, 1);
                extraction = new Extraction(extraction.candidates(), 1, extraction.provider());
            } else {
                throw ProcessingException.unsupported("Unsupported file type: " + mimeType);
            }

            span.setAttribute("candidates.count", extraction.candidates().size());
            span.setAttribute("ocr.provider", extraction.provider());
            log.info("Extracted {} candidates from {} page(s) via {}",
                    extraction.candidates().size(), extraction.pages(), extraction.provider());

            return ExtractionResult.success(extraction.candidates(), extraction.pages(), extraction.provider(),
                    System.currentTimeMillis() - t0);

        } catch (ProcessingException ex) {
            span.setAttribute("error", true);
            span.setAttribute("error.message", ex.getMessage());
            log.warn("Extraction failed ({}): {}", ex.getKind(), ex.getMessage());
            return ExtractionResult.failure(ex.getMessage(), ex.getKind().name(), System.currentTimeMillis() - t0);
        } finally {
            span.end();
        }
    }

    private Extraction extractPdf(byte[] document) {
        try (PDDocument doc = Loader.loadPDF(document)) {
            List<Candidate> candidates = new ArrayList<>(pdfReader.readTextRuns(doc));
            candidates.addAll(pdfReader.readFormWidgets(doc));
            int pages = doc.getNumberOfPages();
            if (!candidates.isEmpty()) {
                return new Extraction(candidates, pages, "pdf-text");
            }

            log.info("PDF has no text layer, recognizing {} rendered page(s)", pages);
            List<byte[]> images = pdfReader.rasterize(doc, renderDpi);
            String provider = null;
            for (int i = 0; i < images.size(); i++) {
                Extraction page = recognizeImage(images.get(i), "image/png", i + 1);
                candidates.addAll(page.candidates());
                provider = page.provider();
            }
            return new Extraction(candidates, pages, provider == null ? "pdf-text" : provider);
        } catch (IOException ex) {
            throw new ProcessingException(ErrorKind.UNSUPPORTED_INPUT, "PDF could not be read: " + ex.getMessage(), ex);
        }
    }

    private Extraction recognizeImage(byte[] image, String mime, int pageNumber) {
        List<OcrProvider> providers = selector.select(image.length);
        if (providers.isEmpty()) {
            throw ProcessingException.provider("No text-recognition provider configured", null);
        }

        Exception last = null;
        for (OcrProvider provider : providers) {
            try {
                OcrProvider.PageResult result = provider.recognize(image, mime);
                return new Extraction(toCandidates(result, pageNumber), 1, provider.name());
            } catch (Exception ex) {
                last = ex;
                log.warn("OCR provider {} failed, trying next: {}", provider.name(), ex.getMessage());
            }
        }
        throw ProcessingException.provider("All text-recognition providers failed", last);
    }

    List<Candidate> toCandidates(OcrProvider.PageResult result, int pageNumber) {
        List<Candidate> out = new ArrayList<>();
        double w = result.isNormalized() ? 1.0 : Math.max(1, result.getImageWidth());
        double h = result.isNormalized() ? 1.0 : Math.max(1, result.getImageHeight());

        for (OcrProvider.Token token : result.getTokens()) {
            String text = token.getText() == null ? "" : token.getText().trim();
            double confidence = Math.max(0, Math.min(1, token.getConfidence() / 100.0));
            if (text.isEmpty() || confidence < minConfidence) continue;

            BoundingBox bbox = new BoundingBox(
                    pageNumber,
                    token.getLeft() / w,
                    token.getTop() / h,
                    token.getWidth() / w,
                    token.getHeight() / h
            ).clamped();
            out.add(new Candidate("p" + pageNumber + "-" + token.getId(), text, confidence, bbox, List.of()));
        }
        return out;
    }

    private static String normalizeMime(String mimeType) {
        if (mimeType == null) return "";
        String mime = mimeType.toLowerCase(Locale.ROOT).trim();
        int semi = mime.indexOf(';');
        return semi >= 0 ? mime.substring(0, semi).trim() : mime;
    }

    private record Extraction(List<Candidate> candidates, int pages, String provider) {}
}
