package com.phillippitts.dictation.service.events;

import java.time.Instant;

/**
 * Published when a GPU server binary exited during early startup and the standard binary was
 * started in its place.
 */
public record GpuFallbackEvent(
        String backend,
        String gpuBinaryPath,
        String reason,
        Instant at
) {
    public GpuFallbackEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
