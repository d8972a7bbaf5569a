package com.docuvision.pipeline.service;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One document to extract.
 *
 * @param declaredFormat  format label as recorded by the catalogue, may be blank
 * @param sourceNameOrUrl original file name or URL, used for extension detection and artifact naming
 * @param collectionId    collection that receives text artifacts and manifest documents
 */
public record DocumentRef(Path localPath,
                          String declaredFormat,
                          String sourceNameOrUrl,
                          String documentId,
                          String collectionId) {

    public DocumentRef {
        Objects.requireNonNull(localPath, "localPath");
        Objects.requireNonNull(documentId, "documentId");
        declaredFormat = declaredFormat == null ? "" : declaredFormat;
        sourceNameOrUrl = sourceNameOrUrl == null ? "" : sourceNameOrUrl;
        collectionId = collectionId == null ? "" : collectionId;
    }
}
