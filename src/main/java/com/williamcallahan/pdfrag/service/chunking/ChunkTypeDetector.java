package com.williamcallahan.pdfrag.service.chunking;

import com.williamcallahan.pdfrag.domain.ChunkType;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Classifies a chunk by its dominant structure.
 *
 * <p>Tables (pipe-delimited rows) have no dedicated type and are reported as {@link ChunkType#TEXT}.</p>
 */
@Component
public class ChunkTypeDetector {
    private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\s*\\d{1,3}[.)]\\s+\\S.*");
    private static final Pattern BULLET_ITEM = Pattern.compile("^\\s*[•\\-*]\\s+\\S.*");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?][\"')\\]]?(\\s|$)");
    private static final int TABLE_PIPE_THRESHOLD = 3;
    private static final double LIST_LINE_SHARE = 0.4;
    private static final int HEADER_MAX_CHARS = 100;
    private static final int PARAGRAPH_MIN_WORDS = 12;

    public ChunkType detect(String content) {
        if (content == null || content.isBlank()) {
            return ChunkType.TEXT;
        }
        String text = content.strip();
        if (countChar(text, '|') > TABLE_PIPE_THRESHOLD) {
            return ChunkType.TEXT;
        }

        String[] lines = text.split("\n");
        int nonEmpty = 0;
        int numbered = 0;
        int bullets = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            nonEmpty++;
            if (NUMBERED_ITEM.matcher(line).matches()) {
                numbered++;
            } else if (BULLET_ITEM.matcher(line).matches()) {
                bullets++;
            }
        }

        if (numbered >= 2 && numbered >= bullets && numbered >= nonEmpty * LIST_LINE_SHARE) {
            return ChunkType.NUMBERED_LIST;
        }
        if (bullets >= 2 && bullets >= nonEmpty * LIST_LINE_SHARE) {
            return ChunkType.BULLET_LIST;
        }
        if (nonEmpty <= 2 && isHeaderLine(lines[0].strip())) {
            return ChunkType.HEADER;
        }
        if (wordCount(text) >= PARAGRAPH_MIN_WORDS && SENTENCE_END.matcher(text).find()) {
            return ChunkType.PARAGRAPH;
        }
        return ChunkType.TEXT;
    }

    static boolean isHeaderLine(String line) {
        if (line.isEmpty() || line.length() >= HEADER_MAX_CHARS) {
            return false;
        }
        if (line.startsWith("#") || line.endsWith(":")) {
            return true;
        }
        boolean hasLetter = line.chars().anyMatch(Character::isLetter);
        return hasLetter && line.equals(line.toUpperCase(Locale.ROOT)) && line.length() < 80;
    }

    private static int countChar(String text, char target) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == target) {
                count++;
            }
        }
        return count;
    }

    private static int wordCount(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
