package com.phillippitts.dictation.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link TranscriptionException} with process diagnostics.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw TranscriptionExceptionBuilder.create("Server exited before becoming ready")
 *         .backend("whisper")
 *         .errorCode(ErrorCode.PROCESS_LIFECYCLE)
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("binaryPath", binPath)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class TranscriptionExceptionBuilder {

    private final String message;
    private String backendName;
    private ErrorCode errorCode = ErrorCode.PROCESS_LIFECYCLE;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private TranscriptionExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static TranscriptionExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new TranscriptionExceptionBuilder(message);
    }

    public TranscriptionExceptionBuilder backend(String backendName) {
        this.backendName = backendName;
        return this;
    }

    public TranscriptionExceptionBuilder errorCode(ErrorCode errorCode) {
        if (errorCode != null) {
            this.errorCode = errorCode;
        }
        return this;
    }

    public TranscriptionExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public TranscriptionExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public TranscriptionExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public TranscriptionExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (backend: {backend})
     * </pre>
     *
     * @return constructed TranscriptionException
     */
    public TranscriptionException build() {
        String detailedMessage = buildDetailedMessage();
        String backend = backendName != null ? backendName : "unknown";

        if (cause != null) {
            return new TranscriptionException(detailedMessage, backend, errorCode, cause);
        }
        return new TranscriptionException(detailedMessage, backend, errorCode);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
