package com.docuvision.pipeline.service.extraction.pdf;

import com.docuvision.pipeline.service.extraction.ExtractionStrategy;
import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.extraction.StrategyResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class PdfTextLayerStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(PdfTextLayerStrategy.class);

    @Override
    public String name() {
        return "pdf-text-layer";
    }

    @Override
    public StrategyResult attempt(Path file) {
        try (PDDocument document = PDDocument.load(file.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            StringBuilder text = new StringBuilder();
            int pages = document.getNumberOfPages();
            for (int page = 1; page <= pages; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(document);
                text.append(pageText == null ? "" : pageText).append('\n');
            }
            log.debug("Read text layer of {} pages from {}", pages, file);
            return StrategyResult.success(text.toString());
        } catch (Exception e) {
            log.error("Error extracting text layer from PDF {}", file, e);
            return StrategyResult.failed(FailureKind.ENGINE_FAILURE, "Failed to read PDF text layer: " + e.getMessage());
        }
    }
}
