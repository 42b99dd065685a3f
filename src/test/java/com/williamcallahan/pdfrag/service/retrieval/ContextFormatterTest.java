package com.williamcallahan.pdfrag.service.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.pdfrag.domain.ChunkMetadata;
import com.williamcallahan.pdfrag.domain.ChunkType;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies context rendering groups chunks by type and falls back to a fixed sentence.
 */
class ContextFormatterTest {

    private final ContextFormatter formatter = new ContextFormatter();

    @Test
    void emptyResultsUseFixedSentence() {
        assertEquals(ContextFormatter.NO_RESULTS, formatter.format(List.of()));
        assertEquals(ContextFormatter.NO_RESULTS, formatter.format(List.of(chunk("   ", ChunkType.TEXT))));
    }

    @Test
    void groupsByTypeKeepingRankOrderWithinGroups() {
        String context = formatter.format(List.of(
                chunk("Plain note", ChunkType.TEXT),
                chunk("SAFETY", ChunkType.HEADER),
                chunk("1. Close valve\n2. Vent", ChunkType.NUMBERED_LIST),
                chunk("The pump must be primed.", ChunkType.PARAGRAPH),
                chunk("MAINTENANCE", ChunkType.HEADER)));

        assertEquals(String.join("\n\n",
                ContextFormatter.CONTEXT_HEADER,
                "SAFETY",
                "MAINTENANCE",
                "The pump must be primed.",
                "1. Close valve\n2. Vent",
                "Plain note"), context);
    }

    private static DocumentChunk chunk(String text, ChunkType type) {
        ChunkMetadata metadata = new ChunkMetadata(
                "manual.pdf", "", null, null, "hash-" + text.hashCode(), type, 0.7, 3, text.length(), 1);
        return DocumentChunk.of(text, metadata);
    }
}
