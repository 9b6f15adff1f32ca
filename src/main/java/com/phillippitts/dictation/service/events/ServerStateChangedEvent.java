package com.phillippitts.dictation.service.events;

import com.phillippitts.dictation.domain.ServerProcessState;

import java.time.Instant;

/**
 * Published on every state transition of a supervised local inference server.
 *
 * @param backend  backend id (whisper, parakeet)
 * @param previous state before the transition
 * @param current  state after the transition
 * @param reason   short technical reason (never transcript text)
 * @param at       time of the transition
 */
public record ServerStateChangedEvent(
        String backend,
        ServerProcessState previous,
        ServerProcessState current,
        String reason,
        Instant at
) {
    public ServerStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
