package com.docuvision.pipeline.model;

public record ActionResponse(boolean success, String message) {
}
