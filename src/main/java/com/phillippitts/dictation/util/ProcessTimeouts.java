package com.phillippitts.dictation.util;

import java.time.Duration;

/**
 * Standard timeout values for child process and reader thread management.
 *
 * @see com.phillippitts.dictation.service.stt.local.AbstractInferenceServer
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Time a server gets to exit after {@link Process#destroy()} (SIGTERM) before it is force-killed.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Time allowed for the OS to reap a process after {@link Process#destroyForcibly()} (SIGKILL).
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for stream reader threads during cleanup (best-effort; they are daemon threads).
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for short-lived helper processes such as archive extraction.
     */
    public static final Duration HELPER_PROCESS_TIMEOUT = Duration.ofMinutes(10);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
