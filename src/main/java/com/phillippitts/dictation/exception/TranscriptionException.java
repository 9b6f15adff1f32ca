package com.phillippitts.dictation.exception;

/**
 * Thrown when a local inference server fails to start, serve or stop.
 * This may occur due to an early process exit, a startup timeout or an HTTP/socket failure.
 */
public class TranscriptionException extends DictationBackendException {

    private final String backendName;

    public TranscriptionException(String message) {
        super(message, ErrorCode.PROCESS_LIFECYCLE);
        this.backendName = "unknown";
    }

    public TranscriptionException(String message, String backendName) {
        this(message, backendName, ErrorCode.PROCESS_LIFECYCLE);
    }

    public TranscriptionException(String message, String backendName, ErrorCode errorCode) {
        super(message + " (backend: " + backendName + ")", errorCode);
        this.backendName = backendName;
    }

    public TranscriptionException(String message, String backendName, ErrorCode errorCode, Throwable cause) {
        super(message + " (backend: " + backendName + ")", errorCode, cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
