package com.docuvision.pipeline.service.extraction.image;

import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.extraction.StrategyResult;
import com.docuvision.pipeline.service.ocr.OcrEngineException;
import com.docuvision.pipeline.service.ocr.OcrService;
import com.docuvision.pipeline.service.ocr.TesseractOcrService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImageOcrStrategyTest {

    private static final Path IMAGE = Path.of("/data/scan.png");

    @Mock
    private OcrService ocrService;

    @Test
    void returnsRecognisedText() {
        when(ocrService.extractText(IMAGE)).thenReturn("Notice of award");

        StrategyResult result = new ImageOcrStrategy(ocrService).attempt(IMAGE);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.text()).isEqualTo("Notice of award");
    }

    @Test
    void engineErrorsKeepTheirKind() {
        when(ocrService.extractText(IMAGE))
                .thenThrow(new OcrEngineException(FailureKind.ENGINE_FAILURE, "Tesseract OCR failed: bad image", null));

        StrategyResult result = new ImageOcrStrategy(ocrService).attempt(IMAGE);

        assertThat(result.succeeded()).isFalse();
        assertThat(result.kind()).isEqualTo(FailureKind.ENGINE_FAILURE);
        assertThat(result.message()).contains("bad image");
    }

    @Test
    void disabledOcrIsReportedAsMissingEngine() {
        OcrService disabled = new TesseractOcrService(false, "eng", "");

        StrategyResult result = new ImageOcrStrategy(disabled).attempt(IMAGE);

        assertThat(result.kind()).isEqualTo(FailureKind.ENGINE_MISSING);
    }
}
