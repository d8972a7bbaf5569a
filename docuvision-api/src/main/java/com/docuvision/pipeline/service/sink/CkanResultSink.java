package com.docuvision.pipeline.service.sink;

import com.docuvision.pipeline.service.host.CkanActionClient;
import com.docuvision.pipeline.service.host.CkanActionException;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Component
@Profile("!inmemory")
public class CkanResultSink implements ResultSink {

    private static final Set<String> SYSTEM_FIELDS = Set.of(
            "created", "last_modified", "metadata_modified", "position", "revision_id", "tracking_summary");

    private final CkanActionClient actionClient;

    public CkanResultSink(CkanActionClient actionClient) {
        this.actionClient = actionClient;
    }

    @Override
    public Map<String, String> getMetadata(String documentId) {
        try {
            JsonNode resource = actionClient.call("resource_show", Map.of("id", documentId));
            Map<String, String> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> iterator = resource.fields();
            while (iterator.hasNext()) {
                Map.Entry<String, JsonNode> field = iterator.next();
                JsonNode value = field.getValue();
                if (value.isValueNode() && !value.isNull()) {
                    fields.put(field.getKey(), value.asText());
                }
            }
            return fields;
        } catch (CkanActionException e) {
            throw new ResultSinkException("Failed to read metadata of resource " + documentId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void updateMetadata(String documentId, Map<String, String> merged) {
        Map<String, Object> payload = new HashMap<>();
        merged.forEach((key, value) -> {
            if (!SYSTEM_FIELDS.contains(key)) {
                payload.put(key, value);
            }
        });
        payload.put("id", documentId);
        try {
            actionClient.call("resource_patch", payload);
        } catch (CkanActionException e) {
            throw new ResultSinkException("Failed to update metadata of resource " + documentId + ": " + e.getMessage(), e);
        }
    }
}
