package com.williamcallahan.pdfrag.service;

import com.williamcallahan.pdfrag.domain.PageText;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Extracts text per page from PDF documents using Apache PDFBox.
 */
@Service
public class PdfContentExtractor implements DocumentTextExtractor {
    private static final Logger log = LoggerFactory.getLogger(PdfContentExtractor.class);

    @Override
    public List<PageText> extractPages(Path pdfPath) {
        try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
            int pageCount = document.getNumberOfPages();
            List<PageText> pages = new ArrayList<>(pageCount);
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                pages.add(new PageText(pageNumber, stripper.getText(document)));
            }
            log.debug("[PDF] Extracted {} pages from {}", pageCount, pdfPath.getFileName());
            return pages;
        } catch (IOException exception) {
            throw new DocumentExtractionException("Unable to read PDF " + pdfPath.getFileName(), exception);
        }
    }
}
