package com.phillippitts.dictation.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNull() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.redactQuery(null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyStringForNonPositiveMax() {
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("a".repeat(10000), 100)).hasSize(100);
    }

    @Test
    void shouldStripQueryString() {
        assertThat(LogSanitizer.redactQuery("wss://stt.example.com/v1/listen?token=abc&sample_rate=16000"))
                .isEqualTo("wss://stt.example.com/v1/listen");
        assertThat(LogSanitizer.redactQuery("https://cdn.example.com/models/ggml-base.bin?X-Amz-Signature=deadbeef"))
                .isEqualTo("https://cdn.example.com/models/ggml-base.bin");
    }

    @Test
    void shouldKeepUrlWithoutQuery() {
        assertThat(LogSanitizer.redactQuery("https://cdn.example.com/models/ggml-base.bin"))
                .isEqualTo("https://cdn.example.com/models/ggml-base.bin");
    }

    @Test
    void shouldFallBackForUnparseableUrl() {
        assertThat(LogSanitizer.redactQuery("not a url?secret=1")).isEqualTo("not a url");
    }
}
