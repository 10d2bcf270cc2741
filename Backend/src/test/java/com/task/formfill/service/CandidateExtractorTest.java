package com.task.formfill.service;

import com.task.formfill.model.Candidate;
import com.task.formfill.model.ExtractionResult;
import com.task.formfill.service.ocr.OcrProvider;
import com.task.formfill.service.ocr.OcrProviderSelector;
import com.task.formfill.service.ocr.PdfCandidateReader;
import io.opentelemetry.api.OpenTelemetry;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDTextField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class CandidateExtractorTest {

    @Mock
    private OcrProviderSelector selector;

    @Mock
    private OcrProvider cloud;

    @Mock
    private OcrProvider local;

    private CandidateExtractor extractor;

    @BeforeEach
    public void setUp() {
        lenient().when(cloud.name()).thenReturn("textract");
        lenient().when(local.name()).thenReturn("tesseract");
        extractor = new CandidateExtractor(new PdfCandidateReader(), selector,
                OpenTelemetry.noop().getTracer("test"), 0.30, 72f);
    }

    private static OcrProvider.PageResult page(OcrProvider.Token... tokens) {
        return new OcrProvider.PageResult(1000, 500, false, List.of(tokens));
    }

    @Test
    public void imageUsesCloudProviderAndNormalizesTokens() throws Exception {
        when(selector.select(anyLong())).thenReturn(List.of(cloud, local));
        when(cloud.recognize(any(), eq("image/png"))).thenReturn(page(
                new OcrProvider.Token("1", "Name", 90f, 100, 50, 200, 25),
                new OcrProvider.Token("2", "smudge", 20f, 400, 50, 50, 25)
        ));

        ExtractionResult result = extractor.extract(new byte[]{1, 2, 3}, "image/png");

        assertTrue(result.success());
        assertEquals("textract", result.provider());
        assertEquals(1, result.totalPages());
        assertEquals(1, result.candidates().size());

        Candidate c = result.candidates().get(0);
        assertEquals("Name", c.rawText());
        assertEquals(0.90, c.confidence(), 1e-6);
        assertEquals(0.10, c.bbox().x(), 1e-9);
        assertEquals(0.10, c.bbox().y(), 1e-9);
        assertEquals(0.20, c.bbox().width(), 1e-9);
        assertEquals(0.05, c.bbox().height(), 1e-9);
        verifyNoInteractions(local);
    }

    @Test
    public void cloudFailureFallsBackToLocalRecognizer() throws Exception {
        when(selector.select(anyLong())).thenReturn(List.of(cloud, local));
        when(cloud.recognize(any(), anyString())).thenThrow(new IllegalStateException("throttled"));
        when(local.recognize(any(), anyString())).thenReturn(page(
                new OcrProvider.Token("1", "Signature", 75f, 0, 0, 100, 20)));

        ExtractionResult result = extractor.extract(new byte[]{1}, "image/jpeg");

        assertTrue(result.success());
        assertEquals("tesseract", result.provider());
        assertEquals("Signature", result.candidates().get(0).rawText());
    }

    @Test
    public void allProvidersFailingReportsProviderFailure() throws Exception {
        when(selector.select(anyLong())).thenReturn(List.of(cloud, local));
        when(cloud.recognize(any(), anyString())).thenThrow(new IllegalStateException("down"));
        when(local.recognize(any(), anyString())).thenThrow(new IOException("no tessdata"));

        ExtractionResult result = extractor.extract(new byte[]{1}, "image/png");

        assertFalse(result.success());
        assertTrue(result.candidates().isEmpty());
        assertEquals(ErrorKind.PROVIDER_FAILURE.name(), result.errorKind());
        assertTrue(result.processingTimeMs() >= 0);
    }

    @Test
    public void unsupportedMimeTypeIsRejectedWithoutRecognition() {
        ExtractionResult result = extractor.extract(new byte[]{1}, "text/plain");

        assertFalse(result.success());
        assertEquals(ErrorKind.UNSUPPORTED_INPUT.name(), result.errorKind());
        verifyNoInteractions(selector);
    }

    @Test
    public void webpIsUnsupportedRatherThanProviderFailure() {
        ExtractionResult result = extractor.extract(new byte[]{1, 2}, "image/webp");

        assertFalse(result.success());
        assertEquals(ErrorKind.UNSUPPORTED_INPUT.name(), result.errorKind());
        verifyNoInteractions(selector, cloud, local);
    }

    @Test
    public void missingDocumentIsValidationFailure() {
        ExtractionResult result = extractor.extract(new byte[0], "image/png");

        assertFalse(result.success());
        assertEquals(ErrorKind.VALIDATION_FAILURE.name(), result.errorKind());
    }

    @Test
    public void pdfTextLayerAndFormFieldsAreReadDirectly() throws Exception {
        byte[] pdf;
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            doc.addPage(page);
            try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                cs.beginText();
                cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                cs.newLineAtOffset(72, 700);
                cs.showText("Patient Name");
                cs.endText();
            }

            PDAcroForm form = new PDAcroForm(doc);
            doc.getDocumentCatalog().setAcroForm(form);
            PDTextField field = new PDTextField(form);
            field.setPartialName("date_of_birth");
            PDAnnotationWidget widget = field.getWidgets().get(0);
            widget.setRectangle(new PDRectangle(100, 600, 200, 20));
            widget.setPage(page);
            page.getAnnotations().add(widget);
            form.getFields().add(field);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            pdf = out.toByteArray();
        }

        ExtractionResult result = extractor.extract(pdf, "application/pdf");

        assertTrue(result.success());
        assertEquals("pdf-text", result.provider());
        assertEquals(1, result.totalPages());

        Optional<Candidate> text = result.candidates().stream().filter(c -> c.rawText().contains("Patient")).findFirst();
        assertTrue(text.isPresent());
        assertEquals(0.95, text.get().confidence(), 1e-9);
        assertEquals(72.0 / 612, text.get().bbox().x(), 0.01);

        Optional<Candidate> widgetCandidate = result.candidates().stream().filter(c -> c.rawText().equals("date_of_birth")).findFirst();
        assertTrue(widgetCandidate.isPresent());
        assertEquals(1.0, widgetCandidate.get().confidence(), 1e-9);
        assertEquals(100.0 / 612, widgetCandidate.get().bbox().x(), 1e-6);
        assertEquals(1 - 620.0 / 792, widgetCandidate.get().bbox().y(), 1e-6);

        verifyNoInteractions(selector);
    }

    @Test
    public void imageOnlyPdfIsRasterizedAndRecognized() throws Exception {
        byte[] pdf;
        try (PDDocument doc = new PDDocument()) {
            doc.addPage(new PDPage(PDRectangle.A6));
            doc.addPage(new PDPage(PDRectangle.A6));
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            pdf = out.toByteArray();
        }
        when(selector.select(anyLong())).thenReturn(List.of(local));
        when(local.recognize(any(), eq("image/png"))).thenReturn(page(
                new OcrProvider.Token("1", "Email", 88f, 10, 10, 100, 20)));

        ExtractionResult result = extractor.extract(pdf, "application/pdf");

        assertTrue(result.success());
        assertEquals(2, result.totalPages());
        assertEquals(2, result.candidates().size());
        assertEquals(1, result.candidates().get(0).bbox().page());
        assertEquals(2, result.candidates().get(1).bbox().page());
        verify(local, times(2)).recognize(any(), eq("image/png"));
    }

    @Test
    public void corruptPdfIsUnsupportedInput() {
        ExtractionResult result = extractor.extract("not a pdf".getBytes(), "application/pdf");

        assertFalse(result.success());
        assertEquals(ErrorKind.UNSUPPORTED_INPUT.name(), result.errorKind());
    }
}
