package com.docuvision.pipeline.service.extraction.office;

import com.docuvision.pipeline.service.extraction.ExtractionStrategy;
import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.extraction.StrategyResult;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Optional;

@Component
public class TikaTextStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(TikaTextStrategy.class);

    @Override
    public String name() {
        return "tika";
    }

    @Override
    public StrategyResult attempt(Path file) {
        Metadata metadata = new Metadata();
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, file.getFileName().toString());
        try (TikaInputStream stream = TikaInputStream.get(file, metadata)) {
            BodyContentHandler handler = new BodyContentHandler(-1);
            new AutoDetectParser().parse(stream, handler, metadata, new ParseContext());
            String text = Optional.ofNullable(handler.toString()).orElse("");
            log.debug("Tika detected {} for {}", metadata.get(Metadata.CONTENT_TYPE), file);
            return StrategyResult.success(text);
        } catch (Exception e) {
            log.warn("Tika failed to extract text from {}: {}", file, e.getMessage());
            return StrategyResult.failed(FailureKind.ENGINE_FAILURE, "Tika extraction failed: " + e.getMessage());
        }
    }
}
