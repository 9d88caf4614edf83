package com.phillippitts.serverwarden.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndLimits() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abcdef", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abc", 10)).isEqualTo("abc");
    }

    @Test
    void stripNoiseRemovesControlAndReplacementCharacters() {
        assertThat(LogSanitizer.stripNoise("�\u0007SERVER STARTED\r\n")).isEqualTo("SERVER STARTED");
        assertThat(LogSanitizer.stripNoise("a\tb")).isEqualTo("a b");
        assertThat(LogSanitizer.stripNoise(null)).isEmpty();
    }

    @Test
    void previewSanitizesBeforeTruncating() {
        assertThat(LogSanitizer.preview("\u0000\u0000hello world", 5)).isEqualTo("hello");
    }
}
