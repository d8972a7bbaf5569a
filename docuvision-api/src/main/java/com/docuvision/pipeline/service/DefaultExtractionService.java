package com.docuvision.pipeline.service;

import com.docuvision.pipeline.service.extraction.ExtractionChain;
import com.docuvision.pipeline.service.extraction.ExtractionChains;
import com.docuvision.pipeline.service.extraction.ExtractionOutcome;
import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.fetch.FetchException;
import com.docuvision.pipeline.service.fetch.FetchedFile;
import com.docuvision.pipeline.service.fetch.RemoteFetcher;
import com.docuvision.pipeline.service.format.CanonicalFormat;
import com.docuvision.pipeline.service.format.FormatResolver;
import com.docuvision.pipeline.service.manifest.ManifestFormatException;
import com.docuvision.pipeline.service.manifest.ManifestInterpreter;
import com.docuvision.pipeline.service.manifest.ManifestShape;
import com.docuvision.pipeline.service.sink.ExtractedTextPublisher;
import com.docuvision.pipeline.service.sink.ResultSinkException;
import com.docuvision.pipeline.service.sink.UploadClient;
import com.docuvision.pipeline.service.sink.UploadException;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.commons.io.FilenameUtils;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

@Service
public class DefaultExtractionService implements ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultExtractionService.class);
    private static final String MANIFEST_DOCUMENT_EXTENSION = ".pdf";

    private final FormatResolver formatResolver;
    private final ExtractionChains extractionChains;
    private final ManifestInterpreter manifestInterpreter;
    private final RemoteFetcher remoteFetcher;
    private final UploadClient uploadClient;
    private final ExtractedTextPublisher publisher;
    private final Executor manifestExecutor;
    private final Tika tika = new Tika();
    private final Counter successCounter;
    private final Counter unsupportedCounter;
    private final Counter failureCounter;
    private final Counter manifestCounter;
    private final Timer extractionTimer;
    private final MeterRegistry meterRegistry;

    public DefaultExtractionService(FormatResolver formatResolver,
                                    ExtractionChains extractionChains,
                                    ManifestInterpreter manifestInterpreter,
                                    RemoteFetcher remoteFetcher,
                                    UploadClient uploadClient,
                                    ExtractedTextPublisher publisher,
                                    @Qualifier("manifestTaskExecutor") Executor manifestExecutor,
                                    MeterRegistry meterRegistry) {
        this.formatResolver = formatResolver;
        this.extractionChains = extractionChains;
        this.manifestInterpreter = manifestInterpreter;
        this.remoteFetcher = remoteFetcher;
        this.uploadClient = uploadClient;
        this.publisher = publisher;
        this.manifestExecutor = manifestExecutor;
        this.meterRegistry = meterRegistry;
        this.successCounter = meterRegistry.counter("docuvision.extraction.outcomes", "outcome", "success");
        this.unsupportedCounter = meterRegistry.counter("docuvision.extraction.outcomes", "outcome", "unsupported");
        this.failureCounter = meterRegistry.counter("docuvision.extraction.outcomes", "outcome", "failure");
        this.manifestCounter = meterRegistry.counter("docuvision.extraction.outcomes", "outcome", "manifest");
        this.extractionTimer = meterRegistry.timer("docuvision.extraction.duration");
    }

    @Override
    public ExtractionOutcome process(DocumentRef document) {
        return processTimed(document, true);
    }

    @Override
    public List<ExtractionOutcome> ingestManifest(JsonNode manifest, String collectionId) {
        return ingestShape(manifestInterpreter.classify(manifest), collectionId);
    }

    private ExtractionOutcome processTimed(DocumentRef document, boolean expandManifests) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ExtractionOutcome outcome = processInternal(document, expandManifests);
            record(outcome);
            return outcome;
        } finally {
            sample.stop(extractionTimer);
        }
    }

    private ExtractionOutcome processInternal(DocumentRef document, boolean expandManifests) {
        CanonicalFormat format = formatResolver.resolve(document.declaredFormat(), document.sourceNameOrUrl());
        log.info("Processing {} as {} for resource {}", document.sourceNameOrUrl(), format.tag(), document.documentId());
        if (format == CanonicalFormat.UNSUPPORTED) {
            String label = document.declaredFormat().isBlank() ? document.sourceNameOrUrl() : document.declaredFormat();
            log.info("Unsupported format {} for resource {}, skipping", label, document.documentId());
            return ExtractionOutcome.unsupported(label);
        }
        if (format.isManifest()) {
            if (!expandManifests) {
                log.warn("Manifest {} was referenced from another manifest, not expanding", document.sourceNameOrUrl());
                return ExtractionOutcome.unsupported("nested json manifest");
            }
            return ingestManifestFile(document);
        }
        ExtractionChain chain = extractionChains.forFormat(format).orElse(null);
        if (chain == null) {
            return ExtractionOutcome.unsupported(format.tag());
        }

        ExtractionOutcome extracted;
        try {
            extracted = chain.extract(document.localPath());
        } catch (RuntimeException e) {
            log.error("Extraction chain {} crashed for resource {}", chain.name(), document.documentId(), e);
            return ExtractionOutcome.failure(FailureKind.ENGINE_FAILURE, chain.name() + " crashed: " + e.getMessage());
        }
        if (!(extracted instanceof ExtractionOutcome.Success success)) {
            log.error("Text extraction failed for resource {}: {}", document.documentId(), extracted.describe());
            return extracted;
        }
        success.result().warnings()
                .forEach(warning -> log.warn("Resource {}: {}", document.documentId(), warning));

        try {
            publisher.publish(document.documentId(), document.collectionId(), originalName(document), success.result().text());
        } catch (ResultSinkException e) {
            log.error("Failed to persist extracted text for resource {}", document.documentId(), e);
            return ExtractionOutcome.failure(FailureKind.PERSIST_FAILURE, e.getMessage());
        }
        log.info("Successfully processed {} for resource {}: {}", format.tag(), document.documentId(), extracted.describe());
        return extracted;
    }

    private ExtractionOutcome ingestManifestFile(DocumentRef document) {
        String content;
        try {
            content = Files.readString(document.localPath(), StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return ExtractionOutcome.failure(FailureKind.FILE_NOT_FOUND, "File not found: " + document.localPath());
        } catch (IOException e) {
            return ExtractionOutcome.failure(FailureKind.MALFORMED_MANIFEST, "Could not read manifest: " + e.getMessage());
        }
        if (content.isBlank()) {
            return ExtractionOutcome.failure(FailureKind.EMPTY_FILE, "Manifest is empty: " + document.localPath());
        }
        ManifestShape shape;
        try {
            shape = manifestInterpreter.classify(manifestInterpreter.parse(content));
        } catch (ManifestFormatException e) {
            log.error("Manifest of resource {} could not be parsed", document.documentId(), e);
            return ExtractionOutcome.failure(FailureKind.MALFORMED_MANIFEST, e.getMessage());
        }
        return new ExtractionOutcome.ManifestIngested(shape.label(), ingestShape(shape, document.collectionId()));
    }

    private List<ExtractionOutcome> ingestShape(ManifestShape shape, String collectionId) {
        List<String> urls = shape.documentUrls();
        if (urls.isEmpty()) {
            log.info("Manifest ({}) references no documents", shape.label());
            return List.of();
        }
        log.info("Manifest ({}) references {} document(s) for collection {}", shape.label(), urls.size(), collectionId);
        List<CompletableFuture<ExtractionOutcome>> tasks = new ArrayList<>(urls.size());
        for (String url : urls) {
            CompletableFuture<ExtractionOutcome> task;
            try {
                task = CompletableFuture.supplyAsync(() -> ingestRemoteDocument(url, collectionId), manifestExecutor);
            } catch (RuntimeException e) {
                log.error("Could not schedule download of {}", url, e);
                task = CompletableFuture.completedFuture(
                        ExtractionOutcome.failure(FailureKind.ENGINE_FAILURE, "Could not schedule " + url + ": " + e.getMessage()));
            }
            tasks.add(task.exceptionally(error -> ExtractionOutcome.failure(
                    FailureKind.ENGINE_FAILURE, "Processing of " + url + " failed: " + error.getMessage())));
        }
        List<ExtractionOutcome> outcomes = new ArrayList<>(tasks.size());
        for (CompletableFuture<ExtractionOutcome> task : tasks) {
            outcomes.add(task.join());
        }
        return outcomes;
    }

    private ExtractionOutcome ingestRemoteDocument(String url, String collectionId) {
        try (FetchedFile fetched = remoteFetcher.fetch(url, MANIFEST_DOCUMENT_EXTENSION)) {
            String name = fetched.suggestedName();
            String documentId = uploadClient.upload(fetched.tempPath(), collectionId, name, tika.detect(name));
            DocumentRef document = new DocumentRef(fetched.tempPath(), "", name, documentId, collectionId);
            return processTimed(document, false);
        } catch (FetchException e) {
            log.error("Failed to download {}: {}", url, e.getMessage());
            return countFailure(ExtractionOutcome.failure(e.kind(), e.getMessage()));
        } catch (UploadException e) {
            log.error("Failed to upload document from {}", url, e);
            return countFailure(ExtractionOutcome.failure(FailureKind.PERSIST_FAILURE, e.getMessage()));
        }
    }

    private ExtractionOutcome countFailure(ExtractionOutcome outcome) {
        failureCounter.increment();
        return outcome;
    }

    private void record(ExtractionOutcome outcome) {
        if (outcome instanceof ExtractionOutcome.Success) {
            successCounter.increment();
        } else if (outcome instanceof ExtractionOutcome.Unsupported) {
            unsupportedCounter.increment();
        } else if (outcome instanceof ExtractionOutcome.ManifestIngested) {
            manifestCounter.increment();
        } else {
            failureCounter.increment();
        }
    }

    private static String originalName(DocumentRef document) {
        String name = FilenameUtils.getName(FormatResolver.stripQuery(document.sourceNameOrUrl()));
        return name.isBlank() ? document.documentId() : name;
    }
}
