package com.phillippitts.dictation.service.stt.streaming;

import com.phillippitts.dictation.domain.ConnectionState;

import static com.phillippitts.dictation.domain.ConnectionState.ACTIVE;
import static com.phillippitts.dictation.domain.ConnectionState.CLOSED;
import static com.phillippitts.dictation.domain.ConnectionState.CLOSING;
import static com.phillippitts.dictation.domain.ConnectionState.COLD;
import static com.phillippitts.dictation.domain.ConnectionState.WARMING;
import static com.phillippitts.dictation.domain.ConnectionState.WARM_IDLE;

/**
 * Pure transition function of the streaming session. Side effects (opening sockets, timers) are
 * performed by {@link StreamingSession} after a transition succeeds.
 *
 * <pre>
 * COLD|CLOSED --WARMUP_STARTED--> WARMING --WARM_OPENED--> WARM_IDLE --WARM_ADOPTED--> ACTIVE
 * WARMING|WARM_IDLE --WARM_LOST--> COLD
 * COLD|CLOSED|WARMING|ACTIVE --COLD_CONNECT_STARTED--> COLD --ACTIVE_OPENED--> ACTIVE
 * COLD|ACTIVE --ACTIVE_LOST--> COLD
 * ACTIVE --CLOSE_REQUESTED--> CLOSING --CLOSED--> CLOSED
 * any --SHUTDOWN--> CLOSED
 * </pre>
 */
final class SessionTransitions {

    private SessionTransitions() {}

    /**
     * @return the state after applying the event
     * @throws IllegalStateException if the event is not valid in the current state
     */
    static ConnectionState next(ConnectionState current, SessionEvent event) {
        ConnectionState next = switch (event) {
            case WARMUP_STARTED -> (current == COLD || current == CLOSED) ? WARMING : null;
            case WARM_OPENED -> current == WARMING ? WARM_IDLE : null;
            case WARM_LOST -> (current == WARMING || current == WARM_IDLE) ? COLD : null;
            case WARM_ADOPTED -> current == WARM_IDLE ? ACTIVE : null;
            case COLD_CONNECT_STARTED ->
                    (current == COLD || current == CLOSED || current == WARMING || current == ACTIVE) ? COLD : null;
            case ACTIVE_OPENED -> current == COLD ? ACTIVE : null;
            case ACTIVE_LOST -> (current == COLD || current == ACTIVE) ? COLD : null;
            case CLOSE_REQUESTED -> current == ACTIVE ? CLOSING : null;
            case CLOSED -> (current == CLOSING || current == COLD || current == ACTIVE) ? CLOSED : null;
            case SHUTDOWN -> CLOSED;
        };
        if (next == null) {
            throw new IllegalStateException("Invalid session transition: " + current + " --" + event + "-->");
        }
        return next;
    }

    /**
     * @return true if the event is valid in the current state
     */
    static boolean isAllowed(ConnectionState current, SessionEvent event) {
        try {
            next(current, event);
            return true;
        } catch (IllegalStateException e) {
            return false;
        }
    }
}
