package com.docuvision.pipeline.service.extraction;

import com.docuvision.pipeline.service.extraction.image.ImageOcrStrategy;
import com.docuvision.pipeline.service.extraction.office.AntiwordStrategy;
import com.docuvision.pipeline.service.extraction.office.DocxParagraphStrategy;
import com.docuvision.pipeline.service.extraction.office.LegacyXlsStrategy;
import com.docuvision.pipeline.service.extraction.office.StreamingXlsxStrategy;
import com.docuvision.pipeline.service.extraction.office.TikaTextStrategy;
import com.docuvision.pipeline.service.extraction.office.WorkbookStrategy;
import com.docuvision.pipeline.service.extraction.pdf.PdfOcrStrategy;
import com.docuvision.pipeline.service.extraction.pdf.PdfTextLayerStrategy;
import com.docuvision.pipeline.service.format.CanonicalFormat;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The ordered strategy chain for every extractable format.
 * <ul>
 *     <li>pdf: text layer, then OCR when the text layer is shorter than the minimum length</li>
 *     <li>docx: paragraphs only</li>
 *     <li>doc: Tika, then antiword</li>
 *     <li>xls: POI user model, then the legacy record-stream reader</li>
 *     <li>xlsx: POI user model, then the streaming reader</li>
 *     <li>images: OCR only</li>
 * </ul>
 */
@Component
public class ExtractionChains {

    private final Map<CanonicalFormat, ExtractionChain> chains = new EnumMap<>(CanonicalFormat.class);

    public ExtractionChains(PdfTextLayerStrategy pdfTextLayer,
                            PdfOcrStrategy pdfOcr,
                            DocxParagraphStrategy docxParagraphs,
                            TikaTextStrategy tika,
                            AntiwordStrategy antiword,
                            WorkbookStrategy workbook,
                            LegacyXlsStrategy legacyXls,
                            StreamingXlsxStrategy streamingXlsx,
                            ImageOcrStrategy imageOcr,
                            @Value("${docuvision.pdf.min-text-length:5}") int pdfMinTextLength) {
        chains.put(CanonicalFormat.PDF, new ExtractionChain("pdf", List.of(
                ChainStep.terminalOnFailure(pdfTextLayer, ChainStep.minimumLength(pdfMinTextLength)),
                ChainStep.of(pdfOcr))));
        chains.put(CanonicalFormat.DOCX, new ExtractionChain("docx", List.of(
                ChainStep.of(docxParagraphs))));
        chains.put(CanonicalFormat.DOC, new ExtractionChain("doc", List.of(
                ChainStep.of(tika),
                ChainStep.of(antiword))));
        chains.put(CanonicalFormat.XLS, new ExtractionChain("xls", List.of(
                ChainStep.of(workbook),
                ChainStep.of(legacyXls))));
        chains.put(CanonicalFormat.XLSX, new ExtractionChain("xlsx", List.of(
                ChainStep.of(workbook),
                ChainStep.of(streamingXlsx))));
        ExtractionChain image = new ExtractionChain("image", List.of(ChainStep.of(imageOcr)));
        for (CanonicalFormat format : CanonicalFormat.values()) {
            if (format.isImage()) {
                chains.put(format, image);
            }
        }
    }

    public Optional<ExtractionChain> forFormat(CanonicalFormat format) {
        return Optional.ofNullable(chains.get(format));
    }
}
