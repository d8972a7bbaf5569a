package com.docuvision.pipeline.service.format;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciles the format label declared by the catalogue with the extension found in the
 * resource name or URL. A known extension always wins over the declared label, because the
 * declared label is frequently blank or generic (e.g. {@code "data"}).
 * <p>
 * Resolution is a pure function of its two arguments; file content is never consulted.
 */
@Component
public class FormatResolver {

    private static final Logger log = LoggerFactory.getLogger(FormatResolver.class);

    private static final Map<String, CanonicalFormat> SYNONYMS = Map.ofEntries(
            Map.entry("pdf", CanonicalFormat.PDF),
            Map.entry("doc", CanonicalFormat.DOC),
            Map.entry("docx", CanonicalFormat.DOCX),
            Map.entry("xls", CanonicalFormat.XLS),
            Map.entry("xlsx", CanonicalFormat.XLSX),
            Map.entry("jpeg", CanonicalFormat.JPEG),
            Map.entry("jpg", CanonicalFormat.JPEG),
            Map.entry("png", CanonicalFormat.PNG),
            Map.entry("tiff", CanonicalFormat.TIFF),
            Map.entry("tif", CanonicalFormat.TIFF),
            Map.entry("bmp", CanonicalFormat.BMP),
            Map.entry("gif", CanonicalFormat.GIF),
            Map.entry("json", CanonicalFormat.JSON),
            Map.entry("application/pdf", CanonicalFormat.PDF),
            Map.entry("application/msword", CanonicalFormat.DOC),
            Map.entry("application/vnd.openxmlformats-officedocument.wordprocessingml.document", CanonicalFormat.DOCX),
            Map.entry("application/vnd.ms-excel", CanonicalFormat.XLS),
            Map.entry("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", CanonicalFormat.XLSX),
            Map.entry("image/jpeg", CanonicalFormat.JPEG),
            Map.entry("image/png", CanonicalFormat.PNG),
            Map.entry("image/tiff", CanonicalFormat.TIFF),
            Map.entry("image/bmp", CanonicalFormat.BMP),
            Map.entry("image/gif", CanonicalFormat.GIF),
            Map.entry("application/json", CanonicalFormat.JSON)
    );

    public CanonicalFormat resolve(String declaredFormat, String sourceNameOrUrl) {
        Optional<CanonicalFormat> declared = lookup(declaredFormat);
        Optional<CanonicalFormat> fromExtension = lookup(extensionOf(sourceNameOrUrl));

        CanonicalFormat resolved;
        if (fromExtension.isPresent()) {
            resolved = fromExtension.get();
        } else {
            resolved = declared.orElse(CanonicalFormat.UNSUPPORTED);
        }
        if (declared.isPresent() && fromExtension.isPresent() && declared.get() != fromExtension.get()) {
            log.info("Declared format '{}' overridden by extension of '{}' -> {}", declaredFormat, sourceNameOrUrl, resolved.tag());
        } else {
            log.debug("Declared format '{}', source '{}' resolved to {}", declaredFormat, sourceNameOrUrl, resolved.tag());
        }
        return resolved;
    }

    /**
     * Whether the extension of the given name maps to a known format.
     */
    public boolean hasKnownExtension(String name) {
        return lookup(extensionOf(name)).isPresent();
    }

    public static String extensionOf(String sourceNameOrUrl) {
        if (sourceNameOrUrl == null || sourceNameOrUrl.isBlank()) {
            return "";
        }
        String path = stripQuery(sourceNameOrUrl.trim());
        int slash = path.lastIndexOf('/');
        String lastSegment = slash > -1 ? path.substring(slash + 1) : path;
        return FilenameUtils.getExtension(lastSegment).toLowerCase(Locale.ROOT);
    }

    public static String stripQuery(String url) {
        int cut = url.length();
        int query = url.indexOf('?');
        if (query > -1) {
            cut = query;
        }
        int fragment = url.indexOf('#');
        if (fragment > -1 && fragment < cut) {
            cut = fragment;
        }
        return url.substring(0, cut);
    }

    private Optional<CanonicalFormat> lookup(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalised = label.trim().toLowerCase(Locale.ROOT);
        if (normalised.startsWith(".")) {
            normalised = normalised.substring(1);
        }
        int parameters = normalised.indexOf(';');
        if (parameters > -1) {
            normalised = normalised.substring(0, parameters).trim();
        }
        return Optional.ofNullable(SYNONYMS.get(normalised));
    }
}
