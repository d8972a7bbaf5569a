package com.docuvision.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record ProcessResourceRequest(@JsonProperty("resource_id") @NotBlank(message = "Missing resource_id parameter") String resourceId) {
}
