package com.docuvision.pipeline.service.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A downloaded document in the scratch directory. The holder owns the temp file; closing
 * deletes it, and only the first close has any effect.
 */
public final class FetchedFile implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FetchedFile.class);

    private final Path tempPath;
    private final String suggestedName;
    private final AtomicBoolean deleted = new AtomicBoolean();

    public FetchedFile(Path tempPath, String suggestedName) {
        this.tempPath = tempPath;
        this.suggestedName = suggestedName;
    }

    public Path tempPath() {
        return tempPath;
    }

    public String suggestedName() {
        return suggestedName;
    }

    @Override
    public void close() {
        if (!deleted.compareAndSet(false, true)) {
            return;
        }
        try {
            Files.deleteIfExists(tempPath);
            log.info("Temp file {} removed", tempPath);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}", tempPath, e);
        }
    }
}
