package com.docuvision.pipeline.service.host;

public interface DocumentCatalog {

    /**
     * @throws com.docuvision.pipeline.service.IngestionException with status 404 when the document does not exist
     */
    DocumentRecord describe(String documentId);
}
