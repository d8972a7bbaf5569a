package com.docuvision.pipeline.service.sink;

import com.docuvision.pipeline.service.host.CkanActionClient;
import com.docuvision.pipeline.service.host.CkanActionException;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;

@Component
public class CkanUploadClient implements UploadClient {

    private static final Logger log = LoggerFactory.getLogger(CkanUploadClient.class);

    private final CkanActionClient actionClient;

    public CkanUploadClient(CkanActionClient actionClient) {
        this.actionClient = actionClient;
    }

    @Override
    public String upload(Path localPath, String collectionId, String displayName, String mimeType) {
        String name = displayName == null || displayName.isBlank() ? localPath.getFileName().toString() : displayName;
        String mime = mimeType == null || mimeType.isBlank() ? MediaType.TEXT_PLAIN_VALUE : mimeType;
        String format = FilenameUtils.getExtension(name).toLowerCase(Locale.ROOT);

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("package_id", collectionId);
        builder.part("name", name);
        builder.part("format", format.isBlank() ? "bin" : format);
        builder.part("mimetype", mime);
        builder.part("upload", new FileSystemResource(localPath))
                .filename(name)
                .contentType(MediaType.parseMediaType(mime));

        log.info("Uploading file {} with mimetype {} to collection {}", name, mime, collectionId);
        try {
            JsonNode result = actionClient.callMultipart("resource_create", builder.build());
            String id = result.path("id").asText(null);
            if (id == null || id.isBlank()) {
                throw new UploadException("Upload of " + name + " succeeded without a resource id");
            }
            log.info("Successfully uploaded {} to collection {} as {}", name, collectionId, id);
            return id;
        } catch (CkanActionException e) {
            log.error("Failed to upload {}: {}", name, e.getMessage());
            throw new UploadException("Failed to upload " + name + ": " + e.getMessage(), e);
        }
    }
}
