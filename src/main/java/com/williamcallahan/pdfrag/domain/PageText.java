package com.williamcallahan.pdfrag.domain;

/**
 * Extracted text of a single page.
 *
 * @param pageNumber 1-based page index
 * @param text extracted text, never null
 */
public record PageText(int pageNumber, String text) {
    public PageText {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page number must be 1-based");
        }
        text = text == null ? "" : text;
    }
}
