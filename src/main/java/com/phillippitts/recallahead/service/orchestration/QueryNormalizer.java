package com.phillippitts.recallahead.service.orchestration;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw input text into the key used for caching and duplicate detection.
 *
 * <p>Normalization trims the text, collapses every run of whitespace into a single space and
 * lowercases the result. An empty result means "no active query".
 */
public final class QueryNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private QueryNormalizer() {}

    /**
     * @param text raw text, may be null
     * @return normalized query, never null
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String stripped = text.strip();
        if (stripped.isEmpty()) {
            return "";
        }
        return WHITESPACE_RUN.matcher(stripped).replaceAll(" ").toLowerCase(Locale.ROOT);
    }
}
