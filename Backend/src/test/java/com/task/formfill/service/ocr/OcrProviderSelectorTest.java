package com.task.formfill.service.ocr;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class OcrProviderSelectorTest {

    private static final long TEN_MB = 10L * 1024 * 1024;

    @Mock
    private OcrProvider textract;

    @Mock
    private OcrProvider tesseract;

    @BeforeEach
    public void setUp() {
        lenient().when(textract.name()).thenReturn("textract");
        lenient().when(tesseract.name()).thenReturn("tesseract");
    }

    @Test
    public void prefersCloudProviderForSmallPayloads() {
        OcrProviderSelector selector = new OcrProviderSelector(List.of(tesseract, textract), "textract", "tesseract", TEN_MB, false);

        assertEquals(List.of(textract, tesseract), selector.select(1024));
    }

    @Test
    public void skipsCloudProviderAboveSizeCeiling() {
        OcrProviderSelector selector = new OcrProviderSelector(List.of(tesseract, textract), "textract", "tesseract", TEN_MB, false);

        assertEquals(List.of(tesseract), selector.select(TEN_MB + 1));
    }

    @Test
    public void devModeUsesLocalRecognizerOnly() {
        OcrProviderSelector selector = new OcrProviderSelector(List.of(tesseract, textract), "textract", "tesseract", TEN_MB, true);

        assertEquals(List.of(tesseract), selector.select(10));
    }

    @Test
    public void unknownCloudProviderFallsBackToLocal() {
        OcrProviderSelector selector = new OcrProviderSelector(List.of(tesseract), "textract", "tesseract", TEN_MB, false);

        assertEquals(List.of(tesseract), selector.select(10));
    }
}
