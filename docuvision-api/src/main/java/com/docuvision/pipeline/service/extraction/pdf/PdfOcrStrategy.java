package com.docuvision.pipeline.service.extraction.pdf;

import com.docuvision.pipeline.service.extraction.ExtractionStrategy;
import com.docuvision.pipeline.service.extraction.StrategyResult;
import com.docuvision.pipeline.service.ocr.OcrService;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders every page and runs OCR on it. This is the last resort for scanned PDFs, so it
 * never fails: errors are logged, reported as warnings and yield empty text.
 */
@Component
public class PdfOcrStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(PdfOcrStrategy.class);

    private final OcrService ocrService;
    private final float dpi;

    public PdfOcrStrategy(OcrService ocrService,
                          @Value("${docuvision.ocr.dpi:300}") float dpi) {
        this.ocrService = ocrService;
        this.dpi = dpi;
    }

    @Override
    public String name() {
        return "pdf-ocr";
    }

    @Override
    public StrategyResult attempt(Path file) {
        try (PDDocument document = PDDocument.load(file.toFile())) {
            PDFRenderer renderer = new PDFRenderer(document);
            List<String> pages = new ArrayList<>();
            for (int index = 0; index < document.getNumberOfPages(); index++) {
                BufferedImage image = renderer.renderImageWithDPI(index, dpi, ImageType.RGB);
                pages.add(ocrService.extractText(image));
            }
            log.info("OCR processed {} pages of {}", pages.size(), file);
            return StrategyResult.success(String.join("\n", pages));
        } catch (Exception e) {
            log.error("Error running OCR on PDF {}", file, e);
            return StrategyResult.success("", List.of(name() + " failed: " + e.getMessage()));
        }
    }
}
