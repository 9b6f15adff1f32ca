package com.phillippitts.dictation.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a supervised local inference process.
 *
 * <pre>
 * STOPPED -> STARTING -> READY &lt;-> DEGRADED
 * STARTING | READY | DEGRADED -> STOPPED   (stop, startup failure)
 * READY | DEGRADED -> CRASHED              (unexpected exit)
 * CRASHED -> STARTING | STOPPED
 * </pre>
 */
public enum ServerProcessState {
    STOPPED,
    STARTING,
    READY,
    DEGRADED,
    CRASHED;

    /**
     * @return true when requests may be dispatched to the process
     */
    public boolean isServing() {
        return this == READY || this == DEGRADED;
    }

    public boolean canTransitionTo(ServerProcessState next) {
        return allowedTargets().contains(next);
    }

    private Set<ServerProcessState> allowedTargets() {
        return switch (this) {
            case STOPPED -> EnumSet.of(STARTING, STOPPED);
            case STARTING -> EnumSet.of(READY, STOPPED);
            case READY -> EnumSet.of(DEGRADED, STOPPED, CRASHED);
            case DEGRADED -> EnumSet.of(READY, STOPPED, CRASHED);
            case CRASHED -> EnumSet.of(STARTING, STOPPED);
        };
    }
}
