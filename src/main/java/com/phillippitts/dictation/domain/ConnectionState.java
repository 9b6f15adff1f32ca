package com.phillippitts.dictation.domain;

/**
 * Lifecycle of a remote streaming session.
 *
 * <p>A session owns at most one active socket and at most one warm (pre-connected, unused) socket.
 * {@link #COLD} also covers the window in which a cold connect is opening and incoming audio is
 * buffered.
 */
public enum ConnectionState {
    COLD,
    WARMING,
    WARM_IDLE,
    ACTIVE,
    CLOSING,
    CLOSED
}
