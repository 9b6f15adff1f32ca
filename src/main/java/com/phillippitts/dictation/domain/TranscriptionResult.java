package com.phillippitts.dictation.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable result of a local inference request.
 *
 * @param text        decoded text (empty for silence)
 * @param durationMs  wall-clock time spent in the request
 * @param timestamp   when the request completed
 * @param backendName backend that produced the text (e.g., "whisper", "parakeet")
 */
public record TranscriptionResult(
        String text,
        long durationMs,
        Instant timestamp,
        String backendName
) {

    /**
     * Compact constructor with validation.
     *
     * <p>Note: Empty text is valid (silence produces no transcription).
     */
    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (durationMs < 0) {
            throw new IllegalArgumentException("Duration must not be negative, got: " + durationMs);
        }
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(backendName, "Backend name must not be null");
    }

    public static TranscriptionResult of(String text, long durationMs, String backendName) {
        return new TranscriptionResult(text, durationMs, Instant.now(), backendName);
    }
}
