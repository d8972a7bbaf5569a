package com.docuvision.pipeline.controller;

import com.docuvision.pipeline.model.ActionResponse;
import com.docuvision.pipeline.model.ProcessResourceRequest;
import com.docuvision.pipeline.service.IngestionException;
import com.docuvision.pipeline.service.host.ResourceProcessingService;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ExtractionControllerMonoTest {

    private final ResourceProcessingService processingService = mock(ResourceProcessingService.class);
    private final ExtractionController controller = new ExtractionController(processingService);

    @Test
    void processEmitsServiceResponseForTrimmedId() {
        ActionResponse response = new ActionResponse(true, "Text extraction completed for resource abc1234567");
        when(processingService.processResource("abc1234567")).thenReturn(response);

        StepVerifier.create(controller.process(new ProcessResourceRequest(" abc1234567 ")))
                .expectNext(response)
                .verifyComplete();

        verify(processingService).processResource("abc1234567");
    }

    @Test
    void processDoesNothingUntilSubscribed() {
        controller.process(new ProcessResourceRequest("abc1234567"));

        verifyNoInteractions(processingService);
    }

    @Test
    void processSignalsServiceErrors() {
        when(processingService.processResource("missing"))
                .thenThrow(new IngestionException(HttpStatus.NOT_FOUND, "Resource not found: missing"));

        StepVerifier.create(controller.process(new ProcessResourceRequest("missing")))
                .expectErrorMatches(error -> error instanceof IngestionException ingestion
                        && ingestion.status() == HttpStatus.NOT_FOUND
                        && "Resource not found: missing".equals(ingestion.getMessage()))
                .verify();
    }
}
