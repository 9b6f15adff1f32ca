package com.phillippitts.dictation.exception;

/**
 * Thrown when a {@link com.phillippitts.dictation.service.cancel.CancellationToken} is cancelled
 * while an operation is waiting on it. Always carries {@link ErrorCode#CANCELLED}.
 */
public class OperationCancelledException extends DictationBackendException {

    public OperationCancelledException(String message) {
        super(message, ErrorCode.CANCELLED);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, ErrorCode.CANCELLED, cause);
    }
}
