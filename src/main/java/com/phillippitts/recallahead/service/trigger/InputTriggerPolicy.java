package com.phillippitts.recallahead.service.trigger;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Heuristic deciding whether typed text looks like a finished thought worth a memory search.
 *
 * <p><b>Rules:</b>
 * <ul>
 *   <li>trimmed text must have at least {@code minChars} characters, contain a Latin letter and
 *       have at least {@code minWords} words</li>
 *   <li>text ending in {@code .}, {@code !} or {@code ?} triggers, unless it contains a URL and
 *       the final character is not preceded by a space (the dot most likely belongs to the URL)</li>
 *   <li>otherwise text with at least {@code minWordsWithoutPunctuation} words triggers
 *       (chat-style messages such as "explain react hooks")</li>
 * </ul>
 */
public final class InputTriggerPolicy {

    private static final Pattern LATIN_LETTER = Pattern.compile("[a-zA-Z]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern URL = Pattern.compile("https?://|www\\.");

    private final int minChars;
    private final int minWords;
    private final int minWordsWithoutPunctuation;

    public InputTriggerPolicy(int minChars, int minWords, int minWordsWithoutPunctuation) {
        this.minChars = minChars;
        this.minWords = minWords;
        this.minWordsWithoutPunctuation = minWordsWithoutPunctuation;
    }

    /**
     * @param text raw input text, may be null
     * @return {@code true} if the text should be handed to the orchestrator
     */
    public boolean shouldTrigger(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.trim();
        if (trimmed.length() < minChars || !LATIN_LETTER.matcher(trimmed).find()) {
            return false;
        }

        long words = Arrays.stream(WHITESPACE_RUN.split(trimmed)).filter(w -> !w.isEmpty()).count();
        if (words < minWords) {
            return false;
        }

        if (endsWithSentencePunctuation(trimmed)) {
            return !looksLikeTrailingUrl(trimmed);
        }
        return words >= minWordsWithoutPunctuation;
    }

    private static boolean endsWithSentencePunctuation(String text) {
        char last = text.charAt(text.length() - 1);
        return last == '.' || last == '!' || last == '?';
    }

    private static boolean looksLikeTrailingUrl(String text) {
        if (!URL.matcher(text).find()) {
            return false;
        }
        String beforeLast = text.substring(0, text.length() - 1);
        return !beforeLast.endsWith(" ");
    }
}
