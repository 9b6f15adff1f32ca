package com.phillippitts.dictation.config.stt;

/**
 * Settings shared by every supervised local inference server.
 *
 * @see WhisperServerConfig
 * @see ParakeetServerConfig
 */
public interface InferenceServerSettings {

    /** Standard (CPU) server binary. */
    String binaryPath();

    /** Optional GPU-accelerated binary tried first; blank when not available. */
    String gpuBinaryPath();

    int portRangeStart();

    int portRangeEnd();

    int startupTimeoutSeconds();

    int healthIntervalSeconds();

    int requestTimeoutSeconds();

    /** Window in which an exit of the GPU binary triggers the CPU fallback. */
    int gpuEarlyExitSeconds();

    /** Thread count passed to the binary; 0 leaves the binary's default. */
    int threads();

    /** Whether a synthetic silent request is sent right after startup. */
    boolean warmupEnabled();

    /** Cap on captured stderr kept for diagnostics. */
    int maxStderrBytes();

    default boolean hasGpuBinary() {
        return gpuBinaryPath() != null && !gpuBinaryPath().isBlank();
    }
}
