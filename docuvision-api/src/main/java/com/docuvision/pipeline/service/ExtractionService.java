package com.docuvision.pipeline.service;

import com.docuvision.pipeline.service.extraction.ExtractionOutcome;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public interface ExtractionService {

    /**
     * Resolves the format of the document, runs its extraction chain and persists the text
     * on success. Never throws for per-document problems; they are reported in the outcome.
     */
    ExtractionOutcome process(DocumentRef document);

    /**
     * Downloads every document referenced by the manifest into the collection and processes it.
     * One outcome per referenced URL, in manifest order.
     */
    List<ExtractionOutcome> ingestManifest(JsonNode manifest, String collectionId);
}
