package com.phillippitts.dictation.service.retry;

import com.phillippitts.dictation.exception.DictationBackendException;
import com.phillippitts.dictation.service.cancel.CancellationToken;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retry combinator parameterised by a classifier, an exponential backoff and a retry budget.
 *
 * <p>Shared by the model downloader (synchronous {@link #execute}) and the streaming session's
 * re-warm scheduler (which only asks {@link #allowsRetry(int)} and {@link #delayFor(int)} and
 * schedules on its own event loop).
 *
 * <p>Backoff: {@code min(initialDelay * 2^retryIndex, maxDelay)}. Cancellations are never retried,
 * whatever the classifier says.
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final Predicate<Throwable> retryable;

    private RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay,
                        Predicate<Throwable> retryable) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        this.retryable = Objects.requireNonNull(retryable, "retryable");
    }

    public static RetryPolicy of(int maxRetries, Duration initialDelay, Duration maxDelay,
                                 Predicate<Throwable> retryable) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, retryable);
    }

    public int maxRetries() {
        return maxRetries;
    }

    /**
     * @param retryIndex zero-based index of the retry about to happen
     * @return true while the retry budget is not exhausted
     */
    public boolean allowsRetry(int retryIndex) {
        return retryIndex < maxRetries;
    }

    /**
     * @param retryIndex zero-based index of the retry about to happen
     * @return delay before that retry, capped at the maximum delay
     */
    public Duration delayFor(int retryIndex) {
        int shift = Math.min(Math.max(retryIndex, 0), 30);
        long millis = initialDelay.toMillis() * (1L << shift);
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }

    /**
     * Decides whether a failure is worth another attempt.
     */
    public boolean shouldRetry(Throwable failure, int retryIndex) {
        if (!allowsRetry(retryIndex) || isCancellation(failure)) {
            return false;
        }
        return retryable.test(failure);
    }

    /**
     * Runs the operation until it succeeds, fails with a non-retryable error, or the budget is spent.
     * Backoff waits observe the cancellation token.
     *
     * @param operation work to run; receives the zero-based attempt number
     * @param token     cancellation token checked before each attempt and during backoff
     * @param listener  notified before each retry (may be null)
     * @return the operation's result
     */
    public <T> T execute(Attempt<T> operation, CancellationToken token, RetryListener listener) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(token, "token");
        int attempt = 0;
        while (true) {
            token.throwIfCancelled("Operation");
            try {
                return operation.run(attempt);
            } catch (RuntimeException e) {
                if (!shouldRetry(e, attempt)) {
                    throw e;
                }
                Duration delay = delayFor(attempt);
                if (listener != null) {
                    listener.onRetry(attempt + 1, delay, e);
                }
                token.sleep(delay);
                attempt++;
            }
        }
    }

    private static boolean isCancellation(Throwable failure) {
        return failure instanceof DictationBackendException dbe && dbe.isCancellation();
    }

    /**
     * One attempt of a retried operation.
     */
    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attempt);
    }

    /**
     * Observer for scheduled retries, used for logging and metrics.
     */
    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int retryNumber, Duration delay, Throwable cause);
    }
}
