package com.docuvision.pipeline.service.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestInterpreterTest {

    private final ManifestInterpreter interpreter = new ManifestInterpreter(new ObjectMapper());

    @Test
    void rewritesObjectIdLiterals() {
        String rewritten = interpreter.rewriteIdentifierTokens("{\"_id\": ObjectId( \"5f1A9b\" ), \"n\": 1}");

        assertThat(rewritten).isEqualTo("{\"_id\": \"5f1A9b\", \"n\": 1}");
    }

    @Test
    void parsesMongoExportAfterRewrite() {
        JsonNode json = interpreter.parse("{\"_id\": ObjectId(\"64b7f0c2e1\"), \"links\": {}}");

        assertThat(json.path("_id").asText()).isEqualTo("64b7f0c2e1");
    }

    @Test
    void malformedJsonIsRejected() {
        assertThatThrownBy(() -> interpreter.parse("{\"releases\": ["))
                .isInstanceOf(ManifestFormatException.class)
                .hasMessageStartingWith("Manifest is not valid JSON");
    }

    @Test
    void releasesTakePrecedenceOverLinks() {
        JsonNode json = interpreter.parse("""
                {
                  "releases": [
                    {"tender": {"documents": [
                      {"url": "https://ted.example/doc-1.pdf"},
                      {"title": "no url"},
                      {"url": 42},
                      {"url": "https://ted.example/doc-2"}
                    ]}},
                    {"tender": {}}
                  ],
                  "links": {"pdf": {"DEU": "https://bescha.example/ignored.pdf"}}
                }
                """);

        ManifestShape shape = interpreter.classify(json);

        assertThat(shape).isInstanceOf(ManifestShape.TedRelease.class);
        assertThat(shape.label()).isEqualTo("ted-release");
        assertThat(shape.documentUrls()).containsExactly("https://ted.example/doc-1.pdf", "https://ted.example/doc-2");
    }

    @Test
    void linksShapeUsesGermanPdf() {
        ManifestShape shape = interpreter.classify(interpreter.parse(
                "{\"links\": {\"pdf\": {\"DEU\": \"https://bescha.example/notice.pdf\", \"ENG\": \"https://bescha.example/en.pdf\"}}}"));

        assertThat(shape).isEqualTo(new ManifestShape.BeschaLinks(Optional.of("https://bescha.example/notice.pdf")));
        assertThat(shape.documentUrls()).containsExactly("https://bescha.example/notice.pdf");
    }

    @Test
    void missingGermanLinkYieldsNoDocuments() {
        ManifestShape shape = interpreter.classify(interpreter.parse("{\"links\": {\"pdf\": {\"ENG\": \"https://x/en.pdf\"}}}"));

        assertThat(shape).isInstanceOf(ManifestShape.BeschaLinks.class);
        assertThat(shape.documentUrls()).isEmpty();
    }

    @Test
    void nonObjectTopLevelIsUnrecognized() {
        ManifestShape shape = interpreter.classify(interpreter.parse("[1, 2, 3]"));

        assertThat(shape).isInstanceOf(ManifestShape.Unrecognized.class);
        assertThat(shape.documentUrls()).isEmpty();
    }
}
