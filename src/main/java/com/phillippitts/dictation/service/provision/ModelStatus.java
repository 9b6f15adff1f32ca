package com.phillippitts.dictation.service.provision;

/**
 * Download state of one catalog model.
 *
 * @param backend           backend id
 * @param modelId           catalog id
 * @param downloaded        installed and complete
 * @param downloading       a download is in flight
 * @param sizeBytes         bytes on disk (0 when not installed)
 * @param expectedSizeBytes catalog size
 * @param path              installed path, or null
 */
public record ModelStatus(
        String backend,
        String modelId,
        boolean downloaded,
        boolean downloading,
        long sizeBytes,
        long expectedSizeBytes,
        String path
) {
}
