package com.phillippitts.dictation.service.provision;

/**
 * Per-call download settings.
 *
 * @param expectedSizeBytes size used for progress when the server sends no length (0 = unknown)
 * @param requiredFreeBytes free space demanded before the first request (0 = no preflight)
 * @param progressListener  progress sink, never null
 */
public record DownloadOptions(long expectedSizeBytes, long requiredFreeBytes,
                              DownloadProgressListener progressListener) {

    public DownloadOptions {
        if (expectedSizeBytes < 0 || requiredFreeBytes < 0) {
            throw new IllegalArgumentException("sizes must not be negative");
        }
        if (progressListener == null) {
            progressListener = DownloadProgressListener.NONE;
        }
    }

    public static DownloadOptions defaults() {
        return new DownloadOptions(0, 0, DownloadProgressListener.NONE);
    }
}
