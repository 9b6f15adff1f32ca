package com.phillippitts.dictation.exception;

/**
 * Classification of a failed download attempt. Only transport-level kinds are retryable.
 */
public enum DownloadFailure {
    CONNECTION_RESET(true),
    CONNECTION_REFUSED(true),
    TIMEOUT(true),
    DNS(true),
    PREMATURE_CLOSE(true),
    INCOMPLETE(true),
    NETWORK(false),
    HTTP_STATUS(false),
    TOO_MANY_REDIRECTS(false),
    FILE_TOO_SMALL(false),
    IO(false);

    private final boolean retryable;

    DownloadFailure(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
