package com.williamcallahan.pdfrag.service.ingestion;

/**
 * Published after the index composition changed: chunks were added, deleted or cleared.
 *
 * @param reason short description for logs
 * @param source file name involved, empty for a full clear
 */
public record IndexChangedEvent(String reason, String source) {
    public IndexChangedEvent {
        reason = reason == null ? "" : reason;
        source = source == null ? "" : source;
    }
}
