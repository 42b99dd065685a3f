package com.williamcallahan.pdfrag.service;

import com.williamcallahan.pdfrag.domain.PageText;
import java.nio.file.Path;
import java.util.List;

/**
 * Extracts per-page text from a stored document.
 */
public interface DocumentTextExtractor {

    /**
     * @param document file to read
     * @return pages in order, 1-based
     * @throws DocumentExtractionException when the file cannot be parsed
     */
    List<PageText> extractPages(Path document);
}
