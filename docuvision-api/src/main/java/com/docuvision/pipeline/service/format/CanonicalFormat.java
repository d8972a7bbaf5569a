package com.docuvision.pipeline.service.format;

import java.util.Locale;

public enum CanonicalFormat {
    PDF,
    DOC,
    DOCX,
    XLS,
    XLSX,
    JPEG,
    PNG,
    TIFF,
    BMP,
    GIF,
    JSON,
    UNSUPPORTED;

    public boolean isImage() {
        return this == JPEG || this == PNG || this == TIFF || this == BMP || this == GIF;
    }

    public boolean isManifest() {
        return this == JSON;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
