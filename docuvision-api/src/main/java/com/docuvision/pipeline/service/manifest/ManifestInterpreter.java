package com.docuvision.pipeline.service.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

@Component
public class ManifestInterpreter {

    private static final Logger log = LoggerFactory.getLogger(ManifestInterpreter.class);

    // Mongo shell exports embed ObjectId("...") literals, which are not JSON.
    private static final Pattern OBJECT_ID = Pattern.compile("ObjectId\\(\\s*\"([0-9a-fA-F]+)\"\\s*\\)");

    private final ObjectMapper objectMapper;

    public ManifestInterpreter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String rewriteIdentifierTokens(String content) {
        if (content == null) {
            return "";
        }
        return OBJECT_ID.matcher(content).replaceAll("\"$1\"");
    }

    public JsonNode parse(String content) {
        String cleaned = rewriteIdentifierTokens(content).strip();
        log.debug("Manifest snippet: {}", cleaned.length() > 200 ? cleaned.substring(0, 200) : cleaned);
        try {
            JsonNode node = objectMapper.readTree(cleaned);
            if (node == null || node.isMissingNode()) {
                throw new ManifestFormatException("Manifest is empty", null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ManifestFormatException("Manifest is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public ManifestShape classify(JsonNode json) {
        if (json == null || !json.isObject()) {
            log.info("Manifest top-level value is not an object, nothing to ingest");
            return new ManifestShape.Unrecognized();
        }
        if (json.has("releases")) {
            List<String> urls = new ArrayList<>();
            for (JsonNode release : json.path("releases")) {
                for (JsonNode document : release.path("tender").path("documents")) {
                    JsonNode url = document.path("url");
                    if (url.isTextual() && !url.asText().isBlank()) {
                        log.info("Found tender document URL: {}", url.asText());
                        urls.add(url.asText().trim());
                    }
                }
            }
            return new ManifestShape.TedRelease(urls);
        }
        JsonNode german = json.path("links").path("pdf").path("DEU");
        if (german.isTextual() && !german.asText().isBlank()) {
            log.info("Found German PDF URL: {}", german.asText());
            return new ManifestShape.BeschaLinks(Optional.of(german.asText().trim()));
        }
        log.warn("No German (DEU) PDF URL found in manifest");
        return new ManifestShape.BeschaLinks(Optional.empty());
    }
}
