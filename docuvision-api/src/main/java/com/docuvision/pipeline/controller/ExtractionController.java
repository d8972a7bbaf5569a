package com.docuvision.pipeline.controller;

import com.docuvision.pipeline.model.ActionResponse;
import com.docuvision.pipeline.model.ProcessResourceRequest;
import com.docuvision.pipeline.model.ResourceEventRequest;
import com.docuvision.pipeline.service.host.ResourceProcessingService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@Validated
public class ExtractionController {

    private final ResourceProcessingService processingService;

    public ExtractionController(ResourceProcessingService processingService) {
        this.processingService = processingService;
    }

    // Extraction blocks on files, OCR and the catalogue, so it runs off the event loop.
    @PostMapping(value = "/api/3/action/docuvision_process", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ActionResponse> process(@Valid @RequestBody ProcessResourceRequest request) {
        return Mono.fromCallable(() -> processingService.processResource(request.resourceId().trim()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping(value = "/hooks/resource-events", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ActionResponse> resourceEvent(@Valid @RequestBody ResourceEventRequest request) {
        boolean queued = processingService.submitEvent(request.resourceId().trim(), request.event());
        String message = queued
                ? "Processing queued for resource " + request.resourceId()
                : "Event " + request.event() + " ignored";
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new ActionResponse(true, message));
    }
}
