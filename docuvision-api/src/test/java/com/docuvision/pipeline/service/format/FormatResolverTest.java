package com.docuvision.pipeline.service.format;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FormatResolverTest {

    private final FormatResolver resolver = new FormatResolver();

    @Test
    void extensionOverridesDeclaredFormat() {
        assertThat(resolver.resolve("pdf", "report.docx")).isEqualTo(CanonicalFormat.DOCX);
        assertThat(resolver.resolve("data", "https://example.org/files/table.XLSX?download=1#top")).isEqualTo(CanonicalFormat.XLSX);
    }

    @Test
    void declaredFormatUsedWhenExtensionUnknown() {
        assertThat(resolver.resolve("PDF", "https://example.org/download/1234")).isEqualTo(CanonicalFormat.PDF);
        assertThat(resolver.resolve(" application/pdf ", "file.bin")).isEqualTo(CanonicalFormat.PDF);
    }

    @Test
    void synonymsMapToCanonicalTags() {
        assertThat(resolver.resolve("", "scan.jpg")).isEqualTo(CanonicalFormat.JPEG);
        assertThat(resolver.resolve("tif", "")).isEqualTo(CanonicalFormat.TIFF);
        assertThat(resolver.resolve(".Json", null)).isEqualTo(CanonicalFormat.JSON);
    }

    @Test
    void unknownFormatIsUnsupported() {
        assertThat(resolver.resolve("csv", "table.csv")).isEqualTo(CanonicalFormat.UNSUPPORTED);
        assertThat(resolver.resolve(null, null)).isEqualTo(CanonicalFormat.UNSUPPORTED);
    }

    @Test
    void extensionIgnoresQueryAndDirectories() {
        assertThat(FormatResolver.extensionOf("https://host/a.b/c/file.PDF?x=y.docx")).isEqualTo("pdf");
        assertThat(FormatResolver.extensionOf("https://host/a.pdf/download")).isEmpty();
        assertThat(resolver.hasKnownExtension("tender.pdf")).isTrue();
        assertThat(resolver.hasKnownExtension("tender")).isFalse();
    }
}
