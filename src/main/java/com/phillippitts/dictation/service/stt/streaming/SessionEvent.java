package com.phillippitts.dictation.service.stt.streaming;

/**
 * Inputs to the streaming session state machine.
 *
 * @see SessionTransitions
 */
enum SessionEvent {
    /** A warm socket is being opened. */
    WARMUP_STARTED,
    /** The warm socket reported open. */
    WARM_OPENED,
    /** The warm socket failed, closed, or was discarded. */
    WARM_LOST,
    /** The warm socket was adopted for dictation. */
    WARM_ADOPTED,
    /** A fresh socket is being opened for dictation; audio is buffered until it opens. */
    COLD_CONNECT_STARTED,
    /** The dictation socket reported open. */
    ACTIVE_OPENED,
    /** The dictation socket failed to open or closed unexpectedly. */
    ACTIVE_LOST,
    /** CloseStream was sent; waiting for the server to close. */
    CLOSE_REQUESTED,
    /** The dictation ended (server close, termination timeout, or abort). */
    CLOSED,
    /** The session is being torn down for good. */
    SHUTDOWN
}
