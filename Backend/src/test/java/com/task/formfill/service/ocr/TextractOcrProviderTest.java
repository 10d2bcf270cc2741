package com.task.formfill.service.ocr;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentRequest;
import software.amazon.awssdk.services.textract.model.AnalyzeDocumentResponse;
import software.amazon.awssdk.services.textract.model.Block;
import software.amazon.awssdk.services.textract.model.BlockType;
import software.amazon.awssdk.services.textract.model.BoundingBox;
import software.amazon.awssdk.services.textract.model.EntityType;
import software.amazon.awssdk.services.textract.model.FeatureType;
import software.amazon.awssdk.services.textract.model.Geometry;
import software.amazon.awssdk.services.textract.model.Relationship;
import software.amazon.awssdk.services.textract.model.RelationshipType;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class TextractOcrProviderTest {

    @Mock
    private TextractClient textract;

    private static Geometry geometry(float left, float top, float width, float height) {
        return Geometry.builder()
                .boundingBox(BoundingBox.builder().left(left).top(top).width(width).height(height).build())
                .build();
    }

    @Test
    public void emitsLinesAndFormKeys() {
        Block line = Block.builder().id("l1").blockType(BlockType.LINE).text("Patient Name")
                .confidence(98.5f).geometry(geometry(0.1f, 0.2f, 0.3f, 0.02f)).build();
        Block word1 = Block.builder().id("w1").blockType(BlockType.WORD).text("Date").build();
        Block word2 = Block.builder().id("w2").blockType(BlockType.WORD).text("Signed").build();
        Block key = Block.builder().id("k1").blockType(BlockType.KEY_VALUE_SET)
                .entityTypes(EntityType.KEY).confidence(77f).geometry(geometry(0.5f, 0.8f, 0.2f, 0.03f))
                .relationships(Relationship.builder().type(RelationshipType.CHILD).ids("w1", "w2").build())
                .build();
        Block value = Block.builder().id("v1").blockType(BlockType.KEY_VALUE_SET)
                .entityTypes(EntityType.VALUE).geometry(geometry(0.7f, 0.8f, 0.2f, 0.03f)).build();

        when(textract.analyzeDocument(any(AnalyzeDocumentRequest.class)))
                .thenReturn(AnalyzeDocumentResponse.builder().blocks(line, word1, word2, key, value).build());

        TextractOcrProvider provider = new TextractOcrProvider(textract);
        OcrProvider.PageResult page = provider.recognize(new byte[]{1, 2, 3}, "image/png");

        assertTrue(page.isNormalized());
        assertEquals(2, page.getTokens().size());
        assertEquals("Patient Name", page.getTokens().get(0).getText());
        assertEquals(98.5f, page.getTokens().get(0).getConfidence(), 1e-6);
        assertEquals("textract-key-k1", page.getTokens().get(1).getId());
        assertEquals("Date Signed", page.getTokens().get(1).getText());
        assertEquals(0.5, page.getTokens().get(1).getLeft(), 1e-6);

        verify(textract).analyzeDocument(argThat((AnalyzeDocumentRequest r) ->
                r.featureTypes().containsAll(List.of(FeatureType.FORMS, FeatureType.TABLES))));
    }
}
