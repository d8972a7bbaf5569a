package com.docuvision.pipeline.service.ocr;

import com.docuvision.pipeline.service.extraction.FailureKind;
import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

@Component
public class TesseractOcrService implements OcrService {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrService.class);

    private final boolean enabled;
    private final String language;
    private final String datapath;

    public TesseractOcrService(@Value("${docuvision.ocr.enabled:true}") boolean enabled,
                               @Value("${docuvision.ocr.language:eng}") String language,
                               @Value("${docuvision.ocr.datapath:}") String datapath) {
        this.enabled = enabled;
        this.language = language;
        this.datapath = datapath;
    }

    @Override
    public String extractText(Path imageFile) {
        return recognise(imageFile.toString(), engine -> engine.doOCR(imageFile.toFile()));
    }

    @Override
    public String extractText(BufferedImage image) {
        return recognise("rendered page", engine -> engine.doOCR(image));
    }

    private String recognise(String source, Recognition recognition) {
        if (!enabled) {
            throw new OcrEngineException(FailureKind.ENGINE_MISSING, "OCR is disabled (docuvision.ocr.enabled=false)", null);
        }
        try {
            String result = recognition.run(newEngine());
            return result == null ? "" : result.trim();
        } catch (TesseractException e) {
            log.warn("Tesseract OCR failed for {}", source, e);
            throw new OcrEngineException(FailureKind.ENGINE_FAILURE, "Tesseract OCR failed: " + e.getMessage(), e);
        } catch (UnsatisfiedLinkError | NoClassDefFoundError e) {
            log.error("Tesseract is not installed or not on the library path", e);
            throw new OcrEngineException(FailureKind.ENGINE_MISSING, "Tesseract OCR is not installed or not on the library path", e);
        }
    }

    // Tesseract instances are not thread-safe; concurrent manifest ingestion gets one per call.
    private ITesseract newEngine() {
        Tesseract engine = new Tesseract();
        if (datapath != null && !datapath.isBlank()) {
            engine.setDatapath(datapath);
        }
        if (language != null && !language.isBlank()) {
            engine.setLanguage(language);
        }
        return engine;
    }

    @FunctionalInterface
    private interface Recognition {
        String run(ITesseract engine) throws TesseractException;
    }
}
