package com.task.formfill.service.ocr;

import net.sourceforge.tess4j.ITessAPI;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.Word;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline recognizer. A Tesseract handle is not thread-safe, so one is built per call.
 */
@Service
public class TesseractOcrProvider implements OcrProvider {

    private final String dataPath;
    private final String language;

    public TesseractOcrProvider(
            @Value("${formfill.ocr.tesseract.datapath:/usr/share/tesseract-ocr/5/tessdata}") String dataPath,
            @Value("${formfill.ocr.tesseract.language:eng}") String language
    ) {
        this.dataPath = dataPath;
        this.language = language;
    }

    @Override
    public String name() {
        return "tesseract";
    }

    @Override
    public PageResult recognize(byte[] image, String mimeType) throws Exception {
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(image));
        if (img == null) {
            throw new IllegalArgumentException("Image could not be decoded: " + mimeType);
        }

        Tesseract tesseract = new Tesseract();
        tesseract.setDatapath(dataPath);
        tesseract.setLanguage(language);
        tesseract.setVariable("preserve_interword_spaces", "1");

        List<Word> words = tesseract.getWords(img, ITessAPI.TessPageIteratorLevel.RIL_WORD);
        List<Token> tokens = new ArrayList<>();
        for (Word w : words) {
            Rectangle r = w.getBoundingBox();
            tokens.add(new Token(
                    "tesseract-" + r.x + "-" + r.y,
                    w.getText() == null ? "" : w.getText().trim(),
                    w.getConfidence(),
                    r.x, r.y, r.width, r.height));
        }
        return new PageResult(img.getWidth(), img.getHeight(), false, tokens);
    }
}
