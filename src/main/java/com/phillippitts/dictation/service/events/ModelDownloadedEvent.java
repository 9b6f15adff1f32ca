package com.phillippitts.dictation.service.events;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published when a model finished downloading and passed installation checks.
 *
 * @param backend    backend id the model belongs to
 * @param modelId    catalog id
 * @param path       installed model path (file or directory)
 * @param bytes      downloaded bytes
 * @param durationMs wall time of the download and installation
 * @param at         completion time
 */
public record ModelDownloadedEvent(
        String backend,
        String modelId,
        Path path,
        long bytes,
        long durationMs,
        Instant at
) {
    public ModelDownloadedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
