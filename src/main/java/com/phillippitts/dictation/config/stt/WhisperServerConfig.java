package com.phillippitts.dictation.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the whisper.cpp HTTP server.
 * Binds to properties prefixed with "stt.whisper-server".
 *
 * <p>Example application.properties:
 * <pre>
 * stt.whisper-server.binary-path=tools/whisper.cpp/whisper-server
 * stt.whisper-server.gpu-binary-path=tools/whisper.cpp/whisper-server-cuda
 * stt.whisper-server.port-range-start=8178
 * stt.whisper-server.port-range-end=8199
 * stt.whisper-server.language=auto
 * </pre>
 *
 * @param binaryPath            path to the CPU server binary
 * @param gpuBinaryPath         optional GPU server binary, tried first
 * @param portRangeStart        first port probed
 * @param portRangeEnd          last port probed (inclusive)
 * @param startupTimeoutSeconds time allowed until the health endpoint answers
 * @param healthIntervalSeconds interval of the background health check
 * @param healthTimeoutSeconds  timeout of a single health request
 * @param requestTimeoutSeconds timeout of one inference request
 * @param gpuEarlyExitSeconds   window in which a GPU binary exit triggers CPU fallback
 * @param threads               --threads value (0 = server default)
 * @param language              default language passed at startup
 * @param warmupEnabled         send a silent request right after startup
 * @param maxStderrBytes        cap on captured stderr
 */
@ConfigurationProperties(prefix = "stt.whisper-server")
@Validated
public record WhisperServerConfig(
        @NotBlank(message = "Whisper server binary path must not be blank")
        @DefaultValue("tools/whisper.cpp/whisper-server")
        String binaryPath,

        @DefaultValue("")
        String gpuBinaryPath,

        @Positive(message = "Port range start must be positive")
        @DefaultValue("8178")
        int portRangeStart,

        @Positive(message = "Port range end must be positive")
        @DefaultValue("8199")
        int portRangeEnd,

        @Positive(message = "Startup timeout must be positive")
        @DefaultValue("30")
        int startupTimeoutSeconds,

        @Positive(message = "Health interval must be positive")
        @DefaultValue("5")
        int healthIntervalSeconds,

        @Positive(message = "Health timeout must be positive")
        @DefaultValue("2")
        int healthTimeoutSeconds,

        @Positive(message = "Request timeout must be positive")
        @DefaultValue("300")
        int requestTimeoutSeconds,

        @Positive(message = "GPU early exit window must be positive")
        @DefaultValue("10")
        int gpuEarlyExitSeconds,

        @PositiveOrZero(message = "Thread count must not be negative")
        @DefaultValue("0")
        int threads,

        @NotBlank(message = "Language code must not be blank")
        @DefaultValue("auto")
        String language,

        @DefaultValue("true")
        boolean warmupEnabled,

        @Positive(message = "Max stderr bytes must be positive")
        @DefaultValue("65536")
        int maxStderrBytes
) implements InferenceServerSettings {

    /**
     * Standard values, matching the property defaults.
     */
    public static WhisperServerConfig defaults() {
        return new WhisperServerConfig("tools/whisper.cpp/whisper-server", "", 8178, 8199, 30, 5, 2,
                300, 10, 0, "auto", true, 65536);
    }
}
