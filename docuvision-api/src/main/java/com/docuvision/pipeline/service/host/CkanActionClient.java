package com.docuvision.pipeline.service.host;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Thin client for the catalogue's action API ({@code /api/3/action/<name>}). Every call
 * returns the {@code result} node of a {@code success: true} envelope or throws
 * {@link CkanActionException}.
 */
@Component
public class CkanActionClient {

    private static final Logger log = LoggerFactory.getLogger(CkanActionClient.class);

    private final WebClient ckanWebClient;
    private final Duration timeout;

    public CkanActionClient(@Qualifier("ckanWebClient") WebClient ckanWebClient,
                            @Value("${docuvision.ckan.timeout-seconds:100}") long timeoutSeconds) {
        this.ckanWebClient = ckanWebClient;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    public JsonNode call(String action, Map<String, ?> payload) {
        return exchange(action, ckanWebClient.post()
                .uri("/api/3/action/{action}", action)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload));
    }

    public JsonNode callMultipart(String action, MultiValueMap<String, HttpEntity<?>> parts) {
        return exchange(action, ckanWebClient.post()
                .uri("/api/3/action/{action}", action)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(parts)));
    }

    private JsonNode exchange(String action, WebClient.RequestHeadersSpec<?> request) {
        ActionReply reply;
        try {
            reply = request.exchangeToMono(response -> response.bodyToMono(JsonNode.class)
                            .defaultIfEmpty(MissingNode.getInstance())
                            .onErrorResume(error -> Mono.just(MissingNode.getInstance()))
                            .map(body -> new ActionReply(response.statusCode().value(), body)))
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                log.error("Request to CKAN action {} timed out", action);
                throw new CkanActionException(504, "CKAN action " + action + " timed out after " + timeout.toSeconds() + "s", cause);
            }
            log.error("Request to CKAN action {} failed: {}", action, cause.getMessage());
            throw new CkanActionException(502, "CKAN action " + action + " failed: " + cause.getMessage(), cause);
        }
        if (reply == null) {
            throw new CkanActionException(502, "CKAN action " + action + " returned no response");
        }
        log.debug("CKAN action {} responded with status {}", action, reply.status());
        JsonNode body = reply.body();
        boolean success = body.path("success").asBoolean(false);
        if (reply.status() < 200 || reply.status() >= 300 || !success) {
            String message = body.path("error").path("message").asText(null);
            throw new CkanActionException(reply.status(), "CKAN action " + action + " was rejected (HTTP " + reply.status() + ")"
                    + (message == null ? "" : ": " + message));
        }
        return body.path("result");
    }

    private record ActionReply(int status, JsonNode body) {}
}
