package com.williamcallahan.pdfrag.domain.ingestion;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal status of a single-document ingestion.
 */
public enum IngestionStatus {
    SUCCESS("success"),
    SKIPPED("skipped"),
    ERROR("error");

    private final String wireName;

    IngestionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
