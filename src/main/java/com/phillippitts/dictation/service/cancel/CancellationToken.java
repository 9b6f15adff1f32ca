package com.phillippitts.dictation.service.cancel;

import com.phillippitts.dictation.exception.OperationCancelledException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation handle passed explicitly into long-running operations.
 *
 * <p>Operations observe cancellation at their suspension points: {@link #throwIfCancelled(String)}
 * between chunks, {@link #sleep(Duration)} during backoff, and {@link #onCancel(Runnable)} to abort
 * a blocking read (for example by disconnecting the underlying connection).
 *
 * <p><b>Thread Safety:</b> all methods may be called from any thread. Cancellation is one-way.
 */
public final class CancellationToken {

    private static final Logger LOG = LogManager.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * Requests cancellation and runs registered callbacks once. Later calls are no-ops.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        cancelledLatch.countDown();
        for (Runnable callback : callbacks) {
            runCallback(callback);
        }
        callbacks.clear();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @param operation description used in the exception message
     * @throws OperationCancelledException if cancellation was requested
     */
    public void throwIfCancelled(String operation) {
        if (isCancelled()) {
            throw new OperationCancelledException(operation + " cancelled");
        }
    }

    /**
     * Registers a callback that runs on cancellation, or immediately if already cancelled.
     *
     * @param callback action to run (exceptions are logged, not propagated)
     * @return registration that removes the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        callbacks.add(callback);
        if (isCancelled() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Sleeps for the given duration, waking early on cancellation.
     *
     * @param duration time to wait
     * @throws OperationCancelledException if cancelled before or during the wait, or if the
     *                                     waiting thread is interrupted
     */
    public void sleep(Duration duration) {
        throwIfCancelled("Wait");
        try {
            if (cancelledLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new OperationCancelledException("Wait cancelled");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Wait interrupted", e);
        }
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("Cancellation callback failed: {}", e.toString());
        }
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
