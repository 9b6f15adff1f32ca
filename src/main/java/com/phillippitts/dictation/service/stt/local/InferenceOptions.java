package com.phillippitts.dictation.service.stt.local;

/**
 * Per-request parameters of a local transcription.
 *
 * @param language language code for this request, or null/"auto" for detection
 * @param prompt   initial prompt biasing the decoder (may be null; ignored by backends without one)
 */
public record InferenceOptions(String language, String prompt) {

    public static InferenceOptions defaults() {
        return new InferenceOptions(null, null);
    }

    /**
     * @return language to send, defaulting to automatic detection
     */
    public String languageOrAuto() {
        return language == null || language.isBlank() ? "auto" : language;
    }
}
