package com.phillippitts.dictation.service.provision;

/**
 * Receives download progress. Updates are throttled; the final update is always delivered.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    DownloadProgressListener NONE = (downloaded, total) -> { };

    /**
     * @param downloadedBytes bytes on disk so far, including a resumed prefix
     * @param totalBytes      total size, or 0 when unknown
     */
    void onProgress(long downloadedBytes, long totalBytes);
}
