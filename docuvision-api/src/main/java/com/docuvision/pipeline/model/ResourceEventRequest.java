package com.docuvision.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Lifecycle notification from the catalogue; {@code event} is {@code created} or {@code updated}.
 */
public record ResourceEventRequest(@JsonProperty("resource_id") @NotBlank(message = "Missing resource_id parameter") String resourceId,
                                   @NotBlank String event) {
}
