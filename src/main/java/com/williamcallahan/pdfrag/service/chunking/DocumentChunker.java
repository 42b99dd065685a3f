package com.williamcallahan.pdfrag.service.chunking;

import com.williamcallahan.pdfrag.config.AppProperties;
import com.williamcallahan.pdfrag.domain.ChunkMetadata;
import com.williamcallahan.pdfrag.domain.ChunkType;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import com.williamcallahan.pdfrag.domain.PageText;
import com.williamcallahan.pdfrag.service.ContentHasher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns extracted pages into scored, typed chunks.
 *
 * <p>Each page is cleaned and split on its own so every chunk knows the page it came from. Chunks
 * shorter than the minimum length, or scoring below the quality floor, are dropped.</p>
 */
@Component
public class DocumentChunker {
    private static final Logger log = LoggerFactory.getLogger(DocumentChunker.class);
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?][\"']?(?:\\s+|\\n)");
    private static final Pattern ENDS_WITH_SENTENCE = Pattern.compile("[.!?][\"']?\\s*$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TextCleaner textCleaner;
    private final ChunkQualityScorer qualityScorer;
    private final ChunkTypeDetector typeDetector;
    private final ContentHasher contentHasher;
    private final ChunkingSettings settings;
    private final RecursiveTextSplitter splitter;

    @Autowired
    public DocumentChunker(
            TokenCounter tokenCounter,
            TextCleaner textCleaner,
            ChunkQualityScorer qualityScorer,
            ChunkTypeDetector typeDetector,
            ContentHasher contentHasher,
            AppProperties appProperties) {
        this(tokenCounter, textCleaner, qualityScorer, typeDetector, contentHasher,
                ChunkingSettings.from(appProperties.getRag()));
    }

    public DocumentChunker(
            TokenCounter tokenCounter,
            TextCleaner textCleaner,
            ChunkQualityScorer qualityScorer,
            ChunkTypeDetector typeDetector,
            ContentHasher contentHasher,
            ChunkingSettings settings) {
        this.textCleaner = Objects.requireNonNull(textCleaner, "textCleaner");
        this.qualityScorer = Objects.requireNonNull(qualityScorer, "qualityScorer");
        this.typeDetector = Objects.requireNonNull(typeDetector, "typeDetector");
        this.contentHasher = Objects.requireNonNull(contentHasher, "contentHasher");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.splitter = new RecursiveTextSplitter(tokenCounter, settings.chunkSize(), settings.chunkOverlap());
    }

    /**
     * Chunks every page of a document.
     *
     * @param source file name recorded as chunk source
     * @param filePath absolute path recorded with each chunk
     * @param pages extracted pages in order
     * @return chunks in page then position order
     */
    public List<DocumentChunk> chunk(String source, String filePath, List<PageText> pages) {
        Objects.requireNonNull(pages, "pages");
        List<DocumentChunk> chunks = new ArrayList<>();
        int dropped = 0;
        for (PageText page : pages) {
            String cleaned = textCleaner.clean(page.text());
            for (String piece : splitter.split(cleaned)) {
                DocumentChunk chunk = toChunk(source, filePath, page.pageNumber(), piece);
                if (chunk == null) {
                    dropped++;
                } else {
                    chunks.add(chunk);
                }
            }
        }
        log.debug("[CHUNK] {} produced {} chunks ({} dropped)", source, chunks.size(), dropped);
        return chunks;
    }

    /**
     * Full cleaned text of a document, used for its document-level content hash.
     */
    public String cleanedFullText(List<PageText> pages) {
        return pages.stream()
                .map(page -> textCleaner.clean(page.text()))
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining("\n\n"));
    }

    public ChunkingSettings settings() {
        return settings;
    }

    private DocumentChunk toChunk(String source, String filePath, int pageNumber, String piece) {
        String content = piece.strip();
        if (content.length() < settings.minChunkLength()) {
            return null;
        }
        String trimmed = trimToSentenceBoundary(content);
        if (trimmed.length() >= settings.minChunkLength()) {
            content = trimmed;
        }
        double quality = qualityScorer.score(content);
        if (quality < settings.qualityFloor()) {
            return null;
        }
        ChunkType type = typeDetector.detect(content);
        ChunkMetadata metadata = new ChunkMetadata(
                source,
                filePath,
                null,
                null,
                contentHasher.hashNormalizedText(content),
                type,
                quality,
                WHITESPACE.split(content).length,
                content.length(),
                pageNumber);
        return DocumentChunk.of(content, metadata);
    }

    String trimToSentenceBoundary(String text) {
        if (ENDS_WITH_SENTENCE.matcher(text).find()) {
            return text;
        }
        Matcher matcher = SENTENCE_BOUNDARY.matcher(text);
        int lastBoundary = -1;
        while (matcher.find()) {
            lastBoundary = matcher.end();
        }
        if (lastBoundary > 0 && (double) lastBoundary / text.length() >= settings.sentenceTrimRatio()) {
            return text.substring(0, lastBoundary).stripTrailing();
        }
        return text;
    }
}
