package com.phillippitts.dictation.exception;

import java.util.Objects;

/**
 * Thrown when a model artifact download fails after the retry budget is spent,
 * or immediately for non-retryable failures.
 */
public class DownloadException extends DictationBackendException {

    private final DownloadFailure failure;
    private final int statusCode;

    public DownloadException(String message, DownloadFailure failure) {
        this(message, failure, -1, null);
    }

    public DownloadException(String message, DownloadFailure failure, Throwable cause) {
        this(message, failure, -1, cause);
    }

    public DownloadException(String message, DownloadFailure failure, int statusCode, Throwable cause) {
        super(message, codeFor(failure), cause);
        this.failure = Objects.requireNonNull(failure, "failure");
        this.statusCode = statusCode;
    }

    private static ErrorCode codeFor(DownloadFailure failure) {
        return switch (Objects.requireNonNull(failure, "failure")) {
            case HTTP_STATUS, TOO_MANY_REDIRECTS -> ErrorCode.HTTP_STATUS;
            case FILE_TOO_SMALL -> ErrorCode.CORRUPTION;
            case IO -> ErrorCode.RESOURCE_EXHAUSTED;
            default -> ErrorCode.TRANSIENT;
        };
    }

    public DownloadFailure getFailure() {
        return failure;
    }

    /**
     * @return HTTP status code for {@link DownloadFailure#HTTP_STATUS}, otherwise -1
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return failure.isRetryable();
    }
}
