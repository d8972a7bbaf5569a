package com.docuvision.pipeline.service.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Profile("inmemory")
public class InMemoryResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(InMemoryResultSink.class);

    private final Map<String, Map<String, String>> records = new ConcurrentHashMap<>();

    @Override
    public Map<String, String> getMetadata(String documentId) {
        return new HashMap<>(records.getOrDefault(documentId, Map.of()));
    }

    @Override
    public void updateMetadata(String documentId, Map<String, String> merged) {
        records.put(documentId, Map.copyOf(merged));
        log.debug("Stored {} metadata fields for {}", merged.size(), documentId);
    }
}
