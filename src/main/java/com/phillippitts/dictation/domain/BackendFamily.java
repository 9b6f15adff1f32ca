package com.phillippitts.dictation.domain;

import java.util.Locale;

/**
 * Local inference backend families. The id doubles as the cache sub-directory name.
 */
public enum BackendFamily {

    /** Batch HTTP server (whisper.cpp server). */
    WHISPER("whisper"),

    /** Streaming socket server (sherpa-onnx transducer). */
    PARAKEET("parakeet");

    private final String id;

    BackendFamily(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a family from its id, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown ids
     */
    public static BackendFamily fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (BackendFamily family : values()) {
                if (family.id.equals(normalized)) {
                    return family;
                }
            }
        }
        throw new IllegalArgumentException("Unknown backend: " + id);
    }
}
