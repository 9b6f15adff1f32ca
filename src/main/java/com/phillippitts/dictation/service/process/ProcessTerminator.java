package com.phillippitts.dictation.service.process;

import com.phillippitts.dictation.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Stops child processes: graceful destroy, bounded wait, then force-kill.
 */
public final class ProcessTerminator {

    private static final Logger LOG = LogManager.getLogger(ProcessTerminator.class);

    private ProcessTerminator() {
        // Utility class - prevent instantiation
    }

    /**
     * Terminates the process. Never throws; always returns once the process is gone or the
     * forceful wait has elapsed.
     *
     * @return true if the process is no longer alive
     */
    public static boolean terminate(Process process) {
        return terminate(process, ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT);
    }

    public static boolean terminate(Process process, Duration gracePeriod) {
        if (process == null || !process.isAlive()) {
            return true;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                LOG.warn("Process did not exit within {}ms; killing it", gracePeriod.toMillis());
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
            process.destroyForcibly();
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        }
        return !process.isAlive();
    }

    /**
     * Joins a reader thread for a bounded time.
     */
    public static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
