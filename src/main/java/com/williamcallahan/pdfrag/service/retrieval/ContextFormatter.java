package com.williamcallahan.pdfrag.service.retrieval;

import com.williamcallahan.pdfrag.domain.ChunkType;
import com.williamcallahan.pdfrag.domain.DocumentChunk;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Renders retrieved chunks as one context block for the prompt.
 *
 * <p>Chunks are grouped by type in {@link ChunkType} declaration order (headers, paragraphs,
 * numbered lists, bullet lists, plain text), keeping rank order inside each group.</p>
 */
@Component
public class ContextFormatter {
    public static final String CONTEXT_HEADER = "Información relevante encontrada:";
    public static final String NO_RESULTS = "No se encontró información relevante para esta pregunta.";
    private static final String BLOCK_SEPARATOR = "\n\n";

    public String format(List<DocumentChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return NO_RESULTS;
        }
        Map<ChunkType, List<String>> grouped = new EnumMap<>(ChunkType.class);
        for (DocumentChunk chunk : chunks) {
            String text = chunk.text().strip();
            if (!text.isEmpty()) {
                grouped.computeIfAbsent(chunk.metadata().chunkType(), type -> new ArrayList<>()).add(text);
            }
        }
        if (grouped.isEmpty()) {
            return NO_RESULTS;
        }
        List<String> parts = new ArrayList<>();
        parts.add(CONTEXT_HEADER);
        grouped.values().forEach(parts::addAll);
        return String.join(BLOCK_SEPARATOR, parts);
    }
}
