package com.docuvision.pipeline.service.sink;

public enum TextMode {
    /**
     * Full text stored inside the metadata record.
     */
    EMBED,
    /**
     * Text uploaded as a separate {@code .txt} document; the record keeps its id.
     */
    ARTIFACT
}
