package com.docuvision.pipeline.service.sink;

import java.util.Map;

/**
 * Metadata store the extraction results are written into. Reads and writes are separate
 * calls, so a read-merge-write is not atomic; callers serialise writes per record.
 */
public interface ResultSink {

    Map<String, String> getMetadata(String documentId);

    void updateMetadata(String documentId, Map<String, String> merged);
}
