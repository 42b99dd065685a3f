package com.williamcallahan.pdfrag.service.chunking;

import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Normalizes extracted page text while keeping its line structure.
 *
 * <p>List items and header-like lines stay on their own lines; only characters and spacing are
 * normalized, so the splitter can still cut on paragraph and line boundaries.</p>
 */
@Component
public class TextCleaner {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cc}\\p{Cf}&&[^\\n\\t]]");
    private static final Pattern CARRIAGE_RETURNS = Pattern.compile("\\r\\n?");
    private static final Pattern DOUBLE_QUOTES = Pattern.compile("[\\u201C\\u201D\\u201E\\u00AB\\u00BB]");
    private static final Pattern SINGLE_QUOTES = Pattern.compile("[\\u2018\\u2019\\u201A\\u2032]");
    private static final Pattern DASHES = Pattern.compile("[\\u2012\\u2013\\u2014\\u2015\\u2212]");
    private static final Pattern ELLIPSIS = Pattern.compile("\\u2026");
    private static final Pattern NON_BREAKING_SPACES = Pattern.compile("[\\u00A0\\u2007\\u202F]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]{2,}");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile(" +([,.;:!?)])");
    private static final Pattern SPACE_AFTER_OPEN_PAREN = Pattern.compile("\\( +");
    private static final Pattern TRAILING_LINE_WHITESPACE = Pattern.compile("[ \\t]+\\n");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    /**
     * Cleans one page of text.
     *
     * @param raw extracted text, may be null
     * @return cleaned text, never null
     */
    public String clean(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String text = CARRIAGE_RETURNS.matcher(raw).replaceAll("\n");
        text = CONTROL_CHARS.matcher(text).replaceAll("");
        text = NON_BREAKING_SPACES.matcher(text).replaceAll(" ");
        text = DOUBLE_QUOTES.matcher(text).replaceAll("\"");
        text = SINGLE_QUOTES.matcher(text).replaceAll("'");
        text = DASHES.matcher(text).replaceAll("-");
        text = ELLIPSIS.matcher(text).replaceAll("...");
        text = HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ");
        text = SPACE_BEFORE_PUNCTUATION.matcher(text).replaceAll("$1");
        text = SPACE_AFTER_OPEN_PAREN.matcher(text).replaceAll("(");
        text = TRAILING_LINE_WHITESPACE.matcher(text).replaceAll("\n");
        text = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.strip();
    }
}
