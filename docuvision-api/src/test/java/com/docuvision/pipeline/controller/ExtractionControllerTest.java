package com.docuvision.pipeline.controller;

import com.docuvision.pipeline.model.ActionResponse;
import com.docuvision.pipeline.service.IngestionException;
import com.docuvision.pipeline.service.host.ResourceProcessingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = ExtractionController.class)
class ExtractionControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private ResourceProcessingService processingService;

    @Test
    void processActionReturnsSuccessEnvelope() {
        when(processingService.processResource("abc1234567"))
                .thenReturn(new ActionResponse(true, "Text extraction completed for resource abc1234567"));

        webTestClient.post()
                .uri("/api/3/action/docuvision_process")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"resource_id\": \" abc1234567 \"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.message").isEqualTo("Text extraction completed for resource abc1234567");
    }

    @Test
    void missingResourceIdIsRejected() {
        webTestClient.post()
                .uri("/api/3/action/docuvision_process")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.message").isEqualTo("Missing resource_id parameter");
        verifyNoInteractions(processingService);
    }

    @Test
    void serviceErrorsAreRenderedWithTheirStatus() {
        when(processingService.processResource(anyString()))
                .thenThrow(new IngestionException(HttpStatus.NOT_FOUND, "Resource not found: nope1234"));

        webTestClient.post()
                .uri("/api/3/action/docuvision_process")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"resource_id\": \"nope1234\"}")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.message").isEqualTo("Resource not found: nope1234");
    }

    @Test
    void resourceEventsAreAcceptedAsynchronously() {
        when(processingService.submitEvent("abc1234567", "created")).thenReturn(true);

        webTestClient.post()
                .uri("/hooks/resource-events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"resource_id\": \"abc1234567\", \"event\": \"created\"}")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.message").isEqualTo("Processing queued for resource abc1234567");
        verify(processingService).submitEvent("abc1234567", "created");
    }

    @Test
    void ignoredEventsAreStillAccepted() {
        when(processingService.submitEvent("abc1234567", "deleted")).thenReturn(false);

        webTestClient.post()
                .uri("/hooks/resource-events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"resource_id\": \"abc1234567\", \"event\": \"deleted\"}")
                .exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Event deleted ignored");
    }
}
