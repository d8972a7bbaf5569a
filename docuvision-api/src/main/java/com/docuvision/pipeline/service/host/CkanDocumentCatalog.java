package com.docuvision.pipeline.service.host;

import com.docuvision.pipeline.service.IngestionException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class CkanDocumentCatalog implements DocumentCatalog {

    private final CkanActionClient actionClient;

    public CkanDocumentCatalog(CkanActionClient actionClient) {
        this.actionClient = actionClient;
    }

    @Override
    public DocumentRecord describe(String documentId) {
        JsonNode resource;
        try {
            resource = actionClient.call("resource_show", Map.of("id", documentId));
        } catch (CkanActionException e) {
            if (e.notFound()) {
                throw new IngestionException(HttpStatus.NOT_FOUND, "Resource not found: " + documentId, e);
            }
            throw new IngestionException(HttpStatus.BAD_GATEWAY, "Could not look up resource " + documentId + ": " + e.getMessage(), e);
        }
        try {
            return new DocumentRecord(
                    resource.path("id").asText(documentId),
                    resource.path("package_id").asText(""),
                    resource.path("name").asText(""),
                    resource.path("format").asText(""),
                    resource.path("url").asText(""),
                    "upload".equals(resource.path("url_type").asText("")));
        } catch (IllegalArgumentException e) {
            throw new IngestionException(HttpStatus.BAD_GATEWAY, "Catalogue returned an invalid record for " + documentId + ": " + e.getMessage(), e);
        }
    }
}
