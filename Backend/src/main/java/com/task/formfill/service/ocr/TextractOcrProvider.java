package com.task.formfill.service.ocr;

import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.model.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * AWS Textract {@code AnalyzeDocument} with form and table analysis. LINE blocks and the KEY side of
 * KEY_VALUE_SET blocks become tokens. Textract geometry is already page-relative.
 */
@Service
public class TextractOcrProvider implements OcrProvider {

    private final TextractClient textract;

    public TextractOcrProvider(TextractClient textract) {
        this.textract = textract;
    }

    @Override
    public String name() {
        return "textract";
    }

    @Override
    public PageResult recognize(byte[] image, String mimeType) {
        AnalyzeDocumentRequest request = AnalyzeDocumentRequest.builder()
                .document(Document.builder().bytes(SdkBytes.fromByteArray(image)).build())
                .featureTypes(FeatureType.FORMS, FeatureType.TABLES)
                .build();

        AnalyzeDocumentResponse response = textract.analyzeDocument(request);
        return PageResult.normalized(toTokens(response.blocks()));
    }

    List<Token> toTokens(List<Block> blocks) {
        List<Token> tokens = new ArrayList<>();
        if (blocks == null) return tokens;

        Map<String, Block> byId = new HashMap<>();
        for (Block b : blocks) byId.put(b.id(), b);

        for (Block block : blocks) {
            if (block.blockType() != BlockType.LINE) continue;
            if (block.text() == null || block.text().isBlank() || block.geometry() == null) continue;
            tokens.add(token("textract-" + block.id(), block.text().trim(), block));
        }

        for (Block block : blocks) {
            if (block.blockType() != BlockType.KEY_VALUE_SET) continue;
            if (!block.entityTypes().contains(EntityType.KEY) || block.geometry() == null) continue;
            String keyText = childWords(block, byId);
            if (!keyText.isEmpty()) {
                tokens.add(token("textract-key-" + block.id(), keyText, block));
            }
        }
        return tokens;
    }

    private static Token token(String id, String text, Block block) {
        software.amazon.awssdk.services.textract.model.BoundingBox box = block.geometry().boundingBox();
        float confidence = block.confidence() == null ? 0f : block.confidence();
        return new Token(id, text, confidence, box.left(), box.top(), box.width(), box.height());
    }

    private static String childWords(Block block, Map<String, Block> byId) {
        return block.relationships().stream()
                .filter(r -> r.type() == RelationshipType.CHILD)
                .flatMap(r -> r.ids().stream())
                .map(byId::get)
                .filter(b -> b != null && b.blockType() == BlockType.WORD && b.text() != null)
                .map(Block::text)
                .collect(Collectors.joining(" "))
                .trim();
    }
}
