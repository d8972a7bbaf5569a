package com.docuvision.pipeline.service.ocr;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

public interface OcrService {

    /**
     * Recognises the text of an image file.
     *
     * @throws OcrEngineException when the engine is missing or fails
     */
    String extractText(Path imageFile);

    String extractText(BufferedImage image);
}
