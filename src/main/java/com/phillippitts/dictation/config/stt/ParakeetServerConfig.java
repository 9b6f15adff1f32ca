package com.phillippitts.dictation.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the sherpa-onnx WebSocket transducer server.
 * Binds to properties prefixed with "stt.parakeet-server".
 *
 * <p>Readiness is detected from the server's "Listening on:" log line; health is process liveness.
 *
 * @param binaryPath            path to the server binary
 * @param gpuBinaryPath         optional GPU server binary, tried first
 * @param portRangeStart        first port probed
 * @param portRangeEnd          last port probed (inclusive)
 * @param startupTimeoutSeconds time allowed until the readiness marker appears
 * @param healthIntervalSeconds interval of the background liveness check
 * @param requestTimeoutSeconds timeout of one transcription
 * @param gpuEarlyExitSeconds   window in which a GPU binary exit triggers CPU fallback
 * @param threads               --num-threads value (0 = server default)
 * @param warmupEnabled         send a silent request right after startup
 * @param maxStderrBytes        cap on captured stderr
 */
@ConfigurationProperties(prefix = "stt.parakeet-server")
@Validated
public record ParakeetServerConfig(
        @NotBlank(message = "Parakeet server binary path must not be blank")
        @DefaultValue("tools/sherpa-onnx/sherpa-onnx-offline-websocket-server")
        String binaryPath,

        @DefaultValue("")
        String gpuBinaryPath,

        @Positive(message = "Port range start must be positive")
        @DefaultValue("6006")
        int portRangeStart,

        @Positive(message = "Port range end must be positive")
        @DefaultValue("6029")
        int portRangeEnd,

        @Positive(message = "Startup timeout must be positive")
        @DefaultValue("60")
        int startupTimeoutSeconds,

        @Positive(message = "Health interval must be positive")
        @DefaultValue("5")
        int healthIntervalSeconds,

        @Positive(message = "Request timeout must be positive")
        @DefaultValue("300")
        int requestTimeoutSeconds,

        @Positive(message = "GPU early exit window must be positive")
        @DefaultValue("10")
        int gpuEarlyExitSeconds,

        @PositiveOrZero(message = "Thread count must not be negative")
        @DefaultValue("2")
        int threads,

        @DefaultValue("true")
        boolean warmupEnabled,

        @Positive(message = "Max stderr bytes must be positive")
        @DefaultValue("65536")
        int maxStderrBytes
) implements InferenceServerSettings {

    public static ParakeetServerConfig defaults() {
        return new ParakeetServerConfig("tools/sherpa-onnx/sherpa-onnx-offline-websocket-server", "",
                6006, 6029, 60, 5, 300, 10, 2, true, 65536);
    }
}
