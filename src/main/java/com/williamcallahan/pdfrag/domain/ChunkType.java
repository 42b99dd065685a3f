package com.williamcallahan.pdfrag.domain;

import java.util.Arrays;
import java.util.Locale;

/**
 * Structural kind of a chunk, as persisted in the {@code chunk_type} payload field.
 *
 * <p>Declaration order is the order in which groups appear in formatted context.</p>
 */
public enum ChunkType {
    HEADER("header", 1.0),
    PARAGRAPH("paragraph", 0.8),
    NUMBERED_LIST("numbered_list", 0.6),
    BULLET_LIST("bullet_list", 0.6),
    TEXT("text", 0.75);

    private final String wireName;
    private final double rankingWeight;

    ChunkType(String wireName, double rankingWeight) {
        this.wireName = wireName;
        this.rankingWeight = rankingWeight;
    }

    public String wireName() {
        return wireName;
    }

    /** Content-type component used by the semantic reranker. */
    public double rankingWeight() {
        return rankingWeight;
    }

    /**
     * Resolves a persisted name; unknown or missing names map to {@link #TEXT}.
     *
     * @param wireName stored value, may be null
     * @return matching type
     */
    public static ChunkType fromWireName(String wireName) {
        if (wireName == null || wireName.isBlank()) {
            return TEXT;
        }
        String normalized = wireName.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(normalized))
                .findFirst()
                .orElse(TEXT);
    }
}
