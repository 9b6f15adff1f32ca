package com.phillippitts.dictation.exception;

/**
 * Machine-readable failure classes carried by every {@link DictationBackendException}.
 *
 * <p>The UI layer maps these to user-facing fallbacks; the control API maps them to HTTP statuses.
 */
public enum ErrorCode {

    /** Network blip, timeout or premature close. Retrying the same operation may succeed. */
    TRANSIENT,

    /** Credential rejected by the remote endpoint. */
    AUTHENTICATION,

    /** Disk space, port range or another finite resource ran out. */
    RESOURCE_EXHAUSTED,

    /** Artifact on disk is truncated, unreadable or missing required files. */
    CORRUPTION,

    /** Child process failed to start, exited early or could not be stopped. */
    PROCESS_LIFECYCLE,

    /** Caller cancelled the operation. Never retried. */
    CANCELLED,

    /** Remote peer sent something the client could not interpret. */
    PROTOCOL,

    /** Component is not in a state that can serve the request. */
    NOT_READY,

    /** Remote server answered with a non-success HTTP status. Never retried. */
    HTTP_STATUS,

    /** Required configuration or artifact is missing, or the model cache cannot be changed. */
    CONFIGURATION
}
