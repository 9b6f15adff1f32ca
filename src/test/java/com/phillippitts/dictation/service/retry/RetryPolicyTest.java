package com.phillippitts.dictation.service.retry;

import com.phillippitts.dictation.exception.DownloadException;
import com.phillippitts.dictation.exception.DownloadFailure;
import com.phillippitts.dictation.exception.OperationCancelledException;
import com.phillippitts.dictation.service.cancel.CancellationToken;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private static final RetryPolicy DOWNLOADS = RetryPolicy.of(3, Duration.ofMillis(1000), Duration.ofMillis(30_000),
            t -> t instanceof DownloadException de && de.isRetryable());

    @Test
    void backoffDoublesAndCaps() {
        assertThat(DOWNLOADS.delayFor(0)).isEqualTo(Duration.ofMillis(1000));
        assertThat(DOWNLOADS.delayFor(1)).isEqualTo(Duration.ofMillis(2000));
        assertThat(DOWNLOADS.delayFor(4)).isEqualTo(Duration.ofMillis(16_000));
        assertThat(DOWNLOADS.delayFor(5)).isEqualTo(Duration.ofMillis(30_000));
        assertThat(DOWNLOADS.delayFor(62)).isEqualTo(Duration.ofMillis(30_000));
    }

    @Test
    void budgetLimitsRetries() {
        assertThat(DOWNLOADS.allowsRetry(2)).isTrue();
        assertThat(DOWNLOADS.allowsRetry(3)).isFalse();
    }

    @Test
    void classifierDecides() {
        assertThat(DOWNLOADS.shouldRetry(new DownloadException("reset", DownloadFailure.CONNECTION_RESET, 0, null), 0))
                .isTrue();
        assertThat(DOWNLOADS.shouldRetry(new DownloadException("503", DownloadFailure.HTTP_STATUS, 503, null), 0))
                .isFalse();
        assertThat(DOWNLOADS.shouldRetry(new DownloadException("404", DownloadFailure.HTTP_STATUS, 404, null), 0))
                .isFalse();
        assertThat(DOWNLOADS.shouldRetry(new IllegalStateException("boom"), 0)).isFalse();
    }

    @Test
    void cancellationIsNeverRetried() {
        RetryPolicy everything = RetryPolicy.of(5, Duration.ofMillis(1), Duration.ofMillis(1), t -> true);
        assertThat(everything.shouldRetry(new OperationCancelledException("stop"), 0)).isFalse();
    }

    @Test
    void executeRetriesUntilSuccess() {
        RetryPolicy policy = RetryPolicy.of(3, Duration.ofMillis(1), Duration.ofMillis(5), t -> true);
        AtomicInteger calls = new AtomicInteger();
        List<Integer> retries = new CopyOnWriteArrayList<>();

        String result = policy.execute(attempt -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("flaky " + attempt);
            }
            return "ok";
        }, new CancellationToken(), (n, delay, cause) -> retries.add(n));

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(retries).containsExactly(1, 2);
    }

    @Test
    void executeRethrowsAfterBudgetSpent() {
        RetryPolicy policy = RetryPolicy.of(2, Duration.ofMillis(1), Duration.ofMillis(5), t -> true);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(attempt -> {
            calls.incrementAndGet();
            throw new IllegalStateException("always");
        }, new CancellationToken(), null)).hasMessage("always");
        assertThat(calls).hasValue(3);
    }

    @Test
    void cancelledTokenStopsBeforeFirstAttempt() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> DOWNLOADS.execute(attempt -> calls.incrementAndGet(), token, null))
                .isInstanceOf(OperationCancelledException.class);
        assertThat(calls).hasValue(0);
    }
}
