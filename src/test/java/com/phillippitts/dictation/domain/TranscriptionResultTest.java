package com.phillippitts.dictation.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionResultTest {

    @Test
    void shouldCreateValidTranscriptionResult() {
        Instant now = Instant.now();
        TranscriptionResult result = new TranscriptionResult("hello world", 420, now, "whisper");

        assertThat(result.text()).isEqualTo("hello world");
        assertThat(result.durationMs()).isEqualTo(420);
        assertThat(result.timestamp()).isEqualTo(now);
        assertThat(result.backendName()).isEqualTo("whisper");
    }

    @Test
    void shouldAcceptEmptyText() {
        // Silence transcribes to nothing
        TranscriptionResult result = TranscriptionResult.of("", 12, "parakeet");
        assertThat(result.text()).isEmpty();
        assertThat(result.timestamp()).isNotNull();
    }

    @Test
    void shouldRejectNullText() {
        assertThatThrownBy(() -> new TranscriptionResult(null, 1, Instant.now(), "whisper"))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("text must not be null");
    }

    @Test
    void shouldRejectNegativeDuration() {
        assertThatThrownBy(() -> TranscriptionResult.of("hi", -1, "whisper"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duration must not be negative");
    }

    @Test
    void shouldRejectNullBackendName() {
        assertThatThrownBy(() -> TranscriptionResult.of("hi", 1, null))
                .isInstanceOf(NullPointerException.class);
    }
}
