package com.williamcallahan.pdfrag.service.chunking;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Splits text into overlapping windows measured in tokens, cutting on the coarsest boundary that
 * yields pieces small enough: paragraph, then line, then sentence, clause, word and finally
 * character.
 *
 * <p>Separators that open a line (list markers, headings) stay attached to the piece they introduce;
 * all other separators stay at the end of the piece they close. Output is deterministic.</p>
 */
public class RecursiveTextSplitter {

    static final List<String> SEPARATORS = List.of(
            "\n\n\n",
            "\n\n",
            "\n---\n",
            "\n## ",
            "\n# ",
            "\n- ",
            "\n• ",
            "\n* ",
            "\n\t",
            ".\n",
            "!\n",
            "?\n",
            "\n",
            ". ",
            "! ",
            "? ",
            "; ",
            ": ",
            ", ",
            " ",
            "");

    private static final Set<String> LINE_OPENING_SEPARATORS =
            Set.of("\n## ", "\n# ", "\n- ", "\n• ", "\n* ", "\n\t");

    private final TokenCounter tokenCounter;
    private final int chunkSize;
    private final int chunkOverlap;

    /**
     * @param tokenCounter length function
     * @param chunkSize target maximum tokens per chunk
     * @param chunkOverlap tokens carried over from the previous chunk
     */
    public RecursiveTextSplitter(TokenCounter tokenCounter, int chunkSize, int chunkOverlap) {
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be in [0, chunkSize)");
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> chunks = new ArrayList<>();
        for (String chunk : splitRecursive(text, SEPARATORS)) {
            String trimmed = chunk.strip();
            if (!trimmed.isEmpty()) {
                chunks.add(trimmed);
            }
        }
        return chunks;
    }

    private List<String> splitRecursive(String text, List<String> separators) {
        int separatorIndex = separators.size() - 1;
        for (int i = 0; i < separators.size(); i++) {
            String candidate = separators.get(i);
            if (candidate.isEmpty() || text.contains(candidate)) {
                separatorIndex = i;
                break;
            }
        }
        String separator = separators.get(separatorIndex);
        List<String> remaining = separators.subList(separatorIndex + 1, separators.size());

        List<String> output = new ArrayList<>();
        List<String> fitting = new ArrayList<>();
        for (String piece : splitKeepingSeparator(text, separator)) {
            if (tokenCounter.count(piece) < chunkSize) {
                fitting.add(piece);
                continue;
            }
            if (!fitting.isEmpty()) {
                output.addAll(merge(fitting));
                fitting.clear();
            }
            if (remaining.isEmpty()) {
                output.add(piece);
            } else {
                output.addAll(splitRecursive(piece, remaining));
            }
        }
        if (!fitting.isEmpty()) {
            output.addAll(merge(fitting));
        }
        return output;
    }

    private List<String> merge(List<String> pieces) {
        List<String> merged = new ArrayList<>();
        Deque<String> window = new ArrayDeque<>();
        Deque<Integer> windowTokens = new ArrayDeque<>();
        int total = 0;
        for (String piece : pieces) {
            int pieceTokens = tokenCounter.count(piece);
            if (total + pieceTokens > chunkSize && !window.isEmpty()) {
                merged.add(String.join("", window));
                while (total > chunkOverlap || (total + pieceTokens > chunkSize && total > 0)) {
                    window.removeFirst();
                    total -= windowTokens.removeFirst();
                }
            }
            window.addLast(piece);
            windowTokens.addLast(pieceTokens);
            total += pieceTokens;
        }
        if (!window.isEmpty()) {
            merged.add(String.join("", window));
        }
        return merged;
    }

    static List<String> splitKeepingSeparator(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            text.codePoints().forEach(codePoint -> pieces.add(new String(Character.toChars(codePoint))));
            return pieces;
        }
        boolean attachToNext = LINE_OPENING_SEPARATORS.contains(separator);
        int start = 0;
        int index = text.indexOf(separator);
        while (index >= 0) {
            if (attachToNext) {
                addIfNotEmpty(pieces, text.substring(start, index));
                start = index;
            } else {
                int end = index + separator.length();
                addIfNotEmpty(pieces, text.substring(start, end));
                start = end;
            }
            index = text.indexOf(separator, index + separator.length());
        }
        addIfNotEmpty(pieces, text.substring(start));
        return pieces;
    }

    private static void addIfNotEmpty(List<String> pieces, String piece) {
        if (!piece.isEmpty()) {
            pieces.add(piece);
        }
    }
}
