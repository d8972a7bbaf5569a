package com.docuvision.pipeline.service.host;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Maps document ids onto the catalogue's file store, which shards uploads as
 * {@code <storage>/resources/<id[0:3]>/<id[3:6]>/<id[6:]>}.
 */
@Component
public class ResourceStorage {

    private final Path resourcesRoot;

    public ResourceStorage(@Value("${docuvision.storage-path:/var/lib/ckan}") String storagePath) {
        this.resourcesRoot = Paths.get(storagePath).resolve("resources");
    }

    public Path resolve(String documentId) {
        if (documentId == null || documentId.length() < 7 || documentId.contains("/") || documentId.contains("\\")
                || documentId.contains("..")) {
            throw new IllegalArgumentException("Not a valid document id: " + documentId);
        }
        return resourcesRoot
                .resolve(documentId.substring(0, 3))
                .resolve(documentId.substring(3, 6))
                .resolve(documentId.substring(6));
    }
}
