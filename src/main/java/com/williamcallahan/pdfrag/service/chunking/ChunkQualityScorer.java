package com.williamcallahan.pdfrag.service.chunking;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Heuristic chunk quality in [0, 1].
 *
 * <p>Starts from a neutral base, penalizes very short chunks and dense special characters, and
 * rewards clean sentence shape, important terms and list, definition or example structure.</p>
 */
@Component
public class ChunkQualityScorer {
    private static final double BASE_SCORE = 0.5;
    private static final Pattern IMPORTANT_TERM = Pattern.compile(
            "\\b[A-Z]{2,}[0-9]*\\b"
                    + "|\\b\\d+(?:[.,]\\d+)?\\s?(?:%|mm|cm|m|kg|g|v|w|kw|mb|gb|hz|°c|ms|s)\\b"
                    + "|\\b[A-Z][a-z]+(?:\\s[A-Z][a-z]+)+\\b");
    private static final Pattern LIST_LINE = Pattern.compile("(?m)^\\s*(?:\\d{1,3}[.)]|[•\\-*])\\s+\\S");
    private static final Pattern DEFINITION = Pattern.compile(
            "(?i)\\b(?:is defined as|refers to|means|se define como|consiste en|es un|es una)\\b|(?m)^[^\\n]{2,60}:\\s+\\S");
    private static final Pattern EXAMPLE = Pattern.compile("(?i)\\b(?:for example|for instance|e\\.g\\.|por ejemplo|ejemplo)\\b");
    private static final int MAX_TERM_REWARDS = 3;

    public double score(String content) {
        if (content == null || content.isBlank()) {
            return 0.0;
        }
        String text = content.strip();
        double score = BASE_SCORE;

        int length = text.length();
        if (length < 50) {
            score -= 0.3;
        } else if (length < 100) {
            score -= 0.15;
        } else if (length >= 200) {
            score += 0.1;
        }

        double specialDensity = specialCharacterDensity(text);
        if (specialDensity > 0.3) {
            score -= 0.3;
        } else if (specialDensity > 0.15) {
            score -= 0.15;
        }

        char first = text.charAt(0);
        if (Character.isUpperCase(first) || Character.isDigit(first) || first == '•' || first == '-' || first == '#') {
            score += 0.1;
        }
        char last = text.charAt(text.length() - 1);
        if (last == '.' || last == '!' || last == '?' || last == ':') {
            score += 0.1;
        }

        score += 0.05 * Math.min(countMatches(IMPORTANT_TERM, text), MAX_TERM_REWARDS);

        if (LIST_LINE.matcher(text).find()
                || DEFINITION.matcher(text).find()
                || EXAMPLE.matcher(text.toLowerCase(Locale.ROOT)).find()) {
            score += 0.1;
        }

        return Math.max(0.0, Math.min(1.0, score));
    }

    static double specialCharacterDensity(String text) {
        int special = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isLetterOrDigit(c) && !Character.isWhitespace(c) && ".,;:!?'\"()-".indexOf(c) < 0) {
                special++;
            }
        }
        return (double) special / text.length();
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
