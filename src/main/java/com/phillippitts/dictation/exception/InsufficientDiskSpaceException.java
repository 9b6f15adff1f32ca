package com.phillippitts.dictation.exception;

import java.nio.file.Path;

/**
 * Thrown by the disk space preflight before any network request is issued.
 */
public class InsufficientDiskSpaceException extends DictationBackendException {

    private final Path directory;
    private final long requiredBytes;
    private final long availableBytes;

    public InsufficientDiskSpaceException(Path directory, long requiredBytes, long availableBytes) {
        super(String.format("Insufficient disk space in %s: need %d MB, have %d MB (short by %d MB)",
                        directory, toMb(requiredBytes), toMb(availableBytes),
                        toMb(requiredBytes - availableBytes)),
                ErrorCode.RESOURCE_EXHAUSTED);
        this.directory = directory;
        this.requiredBytes = requiredBytes;
        this.availableBytes = availableBytes;
    }

    private static long toMb(long bytes) {
        return Math.max(0, bytes) / (1024 * 1024);
    }

    public Path getDirectory() {
        return directory;
    }

    public long getRequiredBytes() {
        return requiredBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }

    public long getShortfallBytes() {
        return Math.max(0, requiredBytes - availableBytes);
    }
}
