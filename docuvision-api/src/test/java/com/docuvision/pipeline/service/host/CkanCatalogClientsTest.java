package com.docuvision.pipeline.service.host;

import com.docuvision.pipeline.service.IngestionException;
import com.docuvision.pipeline.service.sink.CkanResultSink;
import com.docuvision.pipeline.service.sink.ResultSinkException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CkanCatalogClientsTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Deque<StubReply> replies = new ArrayDeque<>();
    private final List<String> actions = new ArrayList<>();
    private final List<String> bodies = new ArrayList<>();
    private final CkanActionClient actionClient = new CkanActionClient(WebClient.builder()
            .baseUrl("http://ckan.test")
            .exchangeFunction(request -> {
                actions.add(request.url().getPath());
                bodies.add(bodyOf(request));
                StubReply reply = replies.removeFirst();
                return Mono.just(ClientResponse.create(reply.status())
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(reply.body())
                        .build());
            })
            .build(), 5);

    @Test
    void describeMapsResourceShow() {
        replies.add(new StubReply(HttpStatus.OK, """
                {"success": true, "result": {"id": "abc1234567", "package_id": "pkg-1", "name": "Notice",
                 "format": "PDF", "url": "http://ckan.test/dataset/pkg-1/resource/abc1234567/download/notice.pdf",
                 "url_type": "upload"}}
                """));

        DocumentRecord record = new CkanDocumentCatalog(actionClient).describe("abc1234567");

        assertThat(record.id()).isEqualTo("abc1234567");
        assertThat(record.collectionId()).isEqualTo("pkg-1");
        assertThat(record.format()).isEqualTo("PDF");
        assertThat(record.uploaded()).isTrue();
        assertThat(record.sourceNameOrUrl()).endsWith("/notice.pdf");
        assertThat(actions).containsExactly("/api/3/action/resource_show");
    }

    @Test
    void unknownResourceIsNotFound() {
        replies.add(new StubReply(HttpStatus.NOT_FOUND, "{\"success\": false, \"error\": {\"message\": \"Not found\"}}"));

        assertThatThrownBy(() -> new CkanDocumentCatalog(actionClient).describe("missing-id"))
                .isInstanceOf(IngestionException.class)
                .satisfies(error -> assertThat(((IngestionException) error).status()).isEqualTo(HttpStatus.NOT_FOUND));
    }

    @Test
    void resultSinkPatchesMergedScalarFields() throws Exception {
        replies.add(new StubReply(HttpStatus.OK, """
                {"success": true, "result": {"id": "abc1234567", "name": "Notice", "size": 42,
                 "created": "2024-01-01T00:00:00", "tags": ["x"], "description": null}}
                """));
        replies.add(new StubReply(HttpStatus.OK, "{\"success\": true, \"result\": {}}"));
        CkanResultSink sink = new CkanResultSink(actionClient);

        Map<String, String> metadata = new LinkedHashMap<>(sink.getMetadata("abc1234567"));
        metadata.put("extracted_text_data", "{\"text_length\": 3}");
        sink.updateMetadata("abc1234567", metadata);

        assertThat(metadata).containsEntry("name", "Notice").containsEntry("size", "42").doesNotContainKeys("tags", "description");
        assertThat(actions).containsExactly("/api/3/action/resource_show", "/api/3/action/resource_patch");
        JsonNode patch = objectMapper.readTree(bodies.get(1));
        assertThat(patch.path("id").asText()).isEqualTo("abc1234567");
        assertThat(patch.path("extracted_text_data").asText()).isEqualTo("{\"text_length\": 3}");
        assertThat(patch.has("created")).isFalse();
    }

    @Test
    void rejectedPatchIsASinkFailure() {
        replies.add(new StubReply(HttpStatus.FORBIDDEN, "{\"success\": false, \"error\": {\"message\": \"Authorization denied\"}}"));

        assertThatThrownBy(() -> new CkanResultSink(actionClient).updateMetadata("abc1234567", Map.of("a", "b")))
                .isInstanceOf(ResultSinkException.class)
                .hasMessageContaining("Authorization denied");
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest mock = new MockClientHttpRequest(request.method(), URI.create("http://ckan.test"));
        request.body().insert(mock, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Map.of();
            }
        }).block();
        return Optional.ofNullable(mock.getBodyAsString().block()).orElse("");
    }

    private record StubReply(HttpStatus status, String body) {}
}
