package com.docuvision.pipeline.service.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes extracted text back to the originating record. The read-merge-write against the
 * {@link ResultSink} runs under a per-record lock so concurrent results for one record
 * cannot drop each other's fields.
 */
@Component
public class ExtractedTextPublisher {

    public static final String METADATA_KEY = "extracted_text_data";

    private static final Logger log = LoggerFactory.getLogger(ExtractedTextPublisher.class);
    private static final int LOCK_STRIPES = 64;

    private final ResultSink resultSink;
    private final UploadClient uploadClient;
    private final ObjectMapper objectMapper;
    private final TextMode textMode;
    private final String version;
    private final Path scratchDir;
    private final Clock clock;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    @Autowired
    public ExtractedTextPublisher(ResultSink resultSink,
                                  UploadClient uploadClient,
                                  ObjectMapper objectMapper,
                                  @Value("${docuvision.sink.text-mode:EMBED}") TextMode textMode,
                                  @Value("${docuvision.sink.version:1.0}") String version,
                                  @Value("${docuvision.fetch.scratch-dir:${java.io.tmpdir}}") String scratchDir) {
        this(resultSink, uploadClient, objectMapper, textMode, version, Paths.get(scratchDir), Clock.systemUTC());
    }

    ExtractedTextPublisher(ResultSink resultSink,
                           UploadClient uploadClient,
                           ObjectMapper objectMapper,
                           TextMode textMode,
                           String version,
                           Path scratchDir,
                           Clock clock) {
        this.resultSink = resultSink;
        this.uploadClient = uploadClient;
        this.objectMapper = objectMapper;
        this.textMode = textMode;
        this.version = version;
        this.scratchDir = scratchDir;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * In artifact mode an empty text is recorded without uploading a file, so the record carries
     * no {@code text_resource_id}.
     *
     * @param originalName display name of the source document, used to name the text artifact
     * @throws ResultSinkException when the record cannot be read or written, or the artifact upload fails
     */
    public void publish(String documentId, String collectionId, String originalName, String text) {
        String safeText = text == null ? "" : text;
        ReentrantLock lock = lockFor(documentId);
        lock.lock();
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("text_length", safeText.length());
            data.put("extraction_date", Instant.now(clock).toString());
            data.put("version", version);
            if (textMode == TextMode.ARTIFACT) {
                if (safeText.isEmpty()) {
                    log.info("No text extracted for {}, skipping text artifact upload", documentId);
                } else {
                    data.put("text_resource_id", uploadArtifact(collectionId, originalName, safeText));
                }
            } else {
                data.put("extracted_text", safeText);
            }

            Map<String, String> merged = new LinkedHashMap<>(resultSink.getMetadata(documentId));
            merged.put(METADATA_KEY, objectMapper.writeValueAsString(data));
            resultSink.updateMetadata(documentId, merged);
            log.info("Stored {} characters of extracted text for {} ({})", safeText.length(), documentId, textMode);
        } catch (JsonProcessingException e) {
            throw new ResultSinkException("Could not serialise extraction record for " + documentId, e);
        } finally {
            lock.unlock();
        }
    }

    private String uploadArtifact(String collectionId, String originalName, String text) {
        String artifactName = FilenameUtils.getBaseName(originalName == null ? "" : originalName);
        if (artifactName.isBlank()) {
            artifactName = "document";
        }
        artifactName = artifactName + ".txt";
        Path directory = null;
        try {
            directory = Files.createTempDirectory(scratchDir, "docuvision-text-");
            Path artifact = directory.resolve(artifactName);
            Files.writeString(artifact, text, StandardCharsets.UTF_8);
            return uploadClient.upload(artifact, collectionId, artifactName, "text/plain");
        } catch (IOException e) {
            throw new ResultSinkException("Could not write text artifact " + artifactName, e);
        } catch (UploadException e) {
            throw new ResultSinkException("Could not upload text artifact " + artifactName + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(directory, artifactName);
        }
    }

    private void deleteQuietly(Path directory, String artifactName) {
        if (directory == null) {
            return;
        }
        try {
            Files.deleteIfExists(directory.resolve(artifactName));
            Files.deleteIfExists(directory);
        } catch (IOException e) {
            log.warn("Failed to delete temporary text artifact in {}", directory, e);
        }
    }

    private ReentrantLock lockFor(String documentId) {
        return locks[Math.floorMod(documentId.hashCode(), LOCK_STRIPES)];
    }
}
