package com.phillippitts.dictation.exception;

/**
 * Thrown (or delivered to a streaming listener) when the remote real-time session fails.
 */
public class StreamingException extends DictationBackendException {

    public StreamingException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }

    public StreamingException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, errorCode, cause);
    }
}
