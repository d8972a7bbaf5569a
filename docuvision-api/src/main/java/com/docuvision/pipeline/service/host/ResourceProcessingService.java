package com.docuvision.pipeline.service.host;

import com.docuvision.pipeline.model.ActionResponse;
import com.docuvision.pipeline.service.DocumentRef;
import com.docuvision.pipeline.service.ExtractionService;
import com.docuvision.pipeline.service.IngestionException;
import com.docuvision.pipeline.service.extraction.ExtractionOutcome;
import com.docuvision.pipeline.service.fetch.FetchException;
import com.docuvision.pipeline.service.fetch.FetchedFile;
import com.docuvision.pipeline.service.fetch.RemoteFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Entry point for catalogue-driven processing: looks a document up, locates its bytes
 * (file store for uploads, a download for linked documents) and hands it to the
 * {@link ExtractionService}.
 */
@Service
public class ResourceProcessingService {

    private static final Logger log = LoggerFactory.getLogger(ResourceProcessingService.class);
    private static final Set<String> HANDLED_EVENTS = Set.of("created", "updated");

    private final DocumentCatalog documentCatalog;
    private final ResourceStorage resourceStorage;
    private final RemoteFetcher remoteFetcher;
    private final ExtractionService extractionService;
    private final Executor eventExecutor;

    public ResourceProcessingService(DocumentCatalog documentCatalog,
                                     ResourceStorage resourceStorage,
                                     RemoteFetcher remoteFetcher,
                                     ExtractionService extractionService,
                                     @Qualifier("resourceEventExecutor") Executor eventExecutor) {
        this.documentCatalog = documentCatalog;
        this.resourceStorage = resourceStorage;
        this.remoteFetcher = remoteFetcher;
        this.extractionService = extractionService;
        this.eventExecutor = eventExecutor;
    }

    /**
     * Processes one document synchronously.
     *
     * @throws IngestionException 404 for unknown documents, 400 when extraction or persistence failed
     */
    public ActionResponse processResource(String resourceId) {
        ExtractionOutcome outcome = runPipeline(resourceId);
        if (outcome instanceof ExtractionOutcome.Failure failure) {
            throw new IngestionException(HttpStatus.BAD_REQUEST, "Error processing resource: " + failure.message());
        }
        return new ActionResponse(true, "Text extraction completed for resource " + resourceId + ": " + outcome.describe());
    }

    /**
     * Queues processing for a catalogue lifecycle event. Returns {@code false} when the
     * event type is ignored.
     *
     * @throws IngestionException 503 when the event queue is full
     */
    public boolean submitEvent(String resourceId, String event) {
        String normalised = event == null ? "" : event.trim().toLowerCase(Locale.ROOT);
        if (!HANDLED_EVENTS.contains(normalised)) {
            log.debug("Ignoring {} event for resource {}", event, resourceId);
            return false;
        }
        try {
            eventExecutor.execute(() -> handleEvent(resourceId, normalised));
        } catch (RejectedExecutionException e) {
            throw new IngestionException(HttpStatus.SERVICE_UNAVAILABLE, "Event queue is full, retry later", e);
        }
        log.info("Queued {} event for resource {}", normalised, resourceId);
        return true;
    }

    private void handleEvent(String resourceId, String event) {
        try {
            ExtractionOutcome outcome = runPipeline(resourceId);
            log.info("Processed {} event for resource {}: {}", event, resourceId, outcome.describe());
        } catch (RuntimeException e) {
            log.error("Error processing {} event for resource {}", event, resourceId, e);
        }
    }

    private ExtractionOutcome runPipeline(String resourceId) {
        DocumentRecord record = documentCatalog.describe(resourceId);
        if (record.uploaded() || !isRemote(record.url())) {
            Path localPath = resourceStorage.resolve(record.id());
            log.info("Processing uploaded resource {} from {}", record.id(), localPath);
            if (!Files.isRegularFile(localPath)) {
                log.warn("File for resource {} not found at {}", record.id(), localPath);
            }
            return extractionService.process(new DocumentRef(localPath, record.format(), record.sourceNameOrUrl(),
                    record.id(), record.collectionId()));
        }
        log.info("Resource {} links to {}, downloading", record.id(), record.url());
        try (FetchedFile fetched = remoteFetcher.fetch(record.url(), "")) {
            return extractionService.process(new DocumentRef(fetched.tempPath(), record.format(), fetched.suggestedName(),
                    record.id(), record.collectionId()));
        } catch (FetchException e) {
            log.error("Could not download linked resource {}: {}", record.id(), e.getMessage());
            return ExtractionOutcome.failure(e.kind(), e.getMessage());
        }
    }

    private static boolean isRemote(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
