package com.docuvision.pipeline.service.extraction.image;

import com.docuvision.pipeline.service.extraction.ExtractionStrategy;
import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.extraction.StrategyResult;
import com.docuvision.pipeline.service.ocr.OcrEngineException;
import com.docuvision.pipeline.service.ocr.OcrService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class ImageOcrStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ImageOcrStrategy.class);

    private final OcrService ocrService;

    public ImageOcrStrategy(OcrService ocrService) {
        this.ocrService = ocrService;
    }

    @Override
    public String name() {
        return "image-ocr";
    }

    @Override
    public StrategyResult attempt(Path file) {
        log.info("Attempting OCR on image file {}", file);
        try {
            return StrategyResult.success(ocrService.extractText(file));
        } catch (OcrEngineException e) {
            return StrategyResult.failed(e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error extracting text from image {}", file, e);
            return StrategyResult.failed(FailureKind.ENGINE_FAILURE, "Failed to extract text from image: " + e.getMessage());
        }
    }
}
