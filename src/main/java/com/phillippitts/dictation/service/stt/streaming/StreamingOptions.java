package com.phillippitts.dictation.service.stt.streaming;

import com.phillippitts.dictation.service.audio.AudioFormat;

import java.util.List;

/**
 * Per-dictation parameters of a streaming session.
 *
 * @param sampleRate PCM sample rate in Hz
 * @param language   BCP-47 language code, or {@code null}/"auto" for detection
 * @param keyterms   bias terms for the recogniser (may be empty)
 */
public record StreamingOptions(int sampleRate, String language, List<String> keyterms) {

    public StreamingOptions {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        keyterms = keyterms == null ? List.of() : List.copyOf(keyterms);
    }

    public static StreamingOptions defaults() {
        return new StreamingOptions(AudioFormat.REQUIRED_SAMPLE_RATE, null, List.of());
    }

    public static StreamingOptions forLanguage(String language) {
        return new StreamingOptions(AudioFormat.REQUIRED_SAMPLE_RATE, language, List.of());
    }

    /**
     * @return explicit language code, or null when the language should be detected
     */
    public String explicitLanguage() {
        if (language == null || language.isBlank() || "auto".equalsIgnoreCase(language)) {
            return null;
        }
        return language;
    }
}
