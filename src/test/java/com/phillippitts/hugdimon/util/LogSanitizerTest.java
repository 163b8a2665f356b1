package com.phillippitts.hugdimon.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndLimits() {
        assertThat(LogSanitizer.truncate(null, 5)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("ab", 3)).isEqualTo("ab");
    }

    @Test
    void previewFlattensLineBreaks() {
        assertThat(LogSanitizer.preview("table\nfor\r\n2")).isEqualTo("table for 2");
        assertThat(LogSanitizer.preview(null)).isEmpty();
    }

    @Test
    void previewShortensLongText() {
        String longText = "x".repeat(100);

        assertThat(LogSanitizer.preview(longText))
                .hasSize(LogSanitizer.DEFAULT_PREVIEW + 3)
                .endsWith("...");
    }
}
