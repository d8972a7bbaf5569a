package com.docuvision.pipeline.service.extraction.office;

import com.docuvision.pipeline.service.extraction.ExtractionStrategy;
import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.extraction.StrategyResult;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;

@Component
public class DocxParagraphStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(DocxParagraphStrategy.class);

    @Override
    public String name() {
        return "docx-paragraphs";
    }

    @Override
    public StrategyResult attempt(Path file) {
        try (InputStream in = Files.newInputStream(file);
             XWPFDocument document = new XWPFDocument(in)) {
            String text = document.getParagraphs().stream()
                    .map(XWPFParagraph::getText)
                    .collect(Collectors.joining("\n"));
            return StrategyResult.success(text);
        } catch (Exception e) {
            log.error("Error extracting text from DOCX {}", file, e);
            return StrategyResult.failed(FailureKind.ENGINE_FAILURE, "Failed to read DOCX paragraphs: " + e.getMessage());
        }
    }
}
