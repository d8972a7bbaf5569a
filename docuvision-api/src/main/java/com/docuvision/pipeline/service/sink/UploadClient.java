package com.docuvision.pipeline.service.sink;

import java.nio.file.Path;

public interface UploadClient {

    /**
     * Creates a new document in the collection from a local file.
     *
     * @return id of the created document
     * @throws UploadException when the catalogue rejects the upload or does not answer in time
     */
    String upload(Path localPath, String collectionId, String displayName, String mimeType);
}
