package com.docuvision.pipeline.service.host;

/**
 * Catalogue view of one document.
 *
 * @param url         download URL, or the file name for uploaded documents
 * @param uploaded    whether the bytes live in the catalogue's own file store
 */
public record DocumentRecord(String id,
                             String collectionId,
                             String name,
                             String format,
                             String url,
                             boolean uploaded) {

    public DocumentRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Document id is required");
        }
        if (collectionId == null || collectionId.isBlank()) {
            throw new IllegalArgumentException("Document " + id + " has no collection");
        }
        name = name == null ? "" : name;
        format = format == null ? "" : format;
        url = url == null ? "" : url;
    }

    /**
     * Name used for extension-based format detection: the URL when present, else the display name.
     */
    public String sourceNameOrUrl() {
        return url.isBlank() ? name : url;
    }
}
