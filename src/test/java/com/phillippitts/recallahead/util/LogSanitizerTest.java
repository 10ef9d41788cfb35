package com.phillippitts.recallahead.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello", 10)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
    }

    @Test
    void previewShowsShortTextWhole() {
        assertThat(LogSanitizer.preview("react hooks")).isEqualTo("\"react hooks\"(11)");
    }

    @Test
    void previewTruncatesLongTextAndKeepsLength() {
        String text = "a".repeat(100);

        assertThat(LogSanitizer.preview(text))
                .isEqualTo("\"" + "a".repeat(LogSanitizer.DEFAULT_PREVIEW_CHARS) + "…\"(100)");
    }

    @Test
    void previewOfNull() {
        assertThat(LogSanitizer.preview(null)).isEqualTo("<none>");
    }
}
