package com.phillippitts.dictation.exception;

import java.util.Objects;

/**
 * Base exception for all dictation backend errors.
 * All domain exceptions extend this class so callers can branch on {@link #getErrorCode()}.
 */
public class DictationBackendException extends RuntimeException {

    private final ErrorCode errorCode;

    public DictationBackendException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public DictationBackendException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return true when the failure was caused by an explicit cancellation
     */
    public boolean isCancellation() {
        return errorCode == ErrorCode.CANCELLED;
    }
}
