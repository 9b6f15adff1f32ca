package com.phillippitts.dictation.service.stt.streaming;

import com.phillippitts.dictation.domain.Credential;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds the current streaming credential.
 *
 * <p>The issue timestamp is set when a token value is first seen and is kept when the same value is
 * stored again, so re-caching a token never extends its lifetime.
 *
 * <p>Confined to the owning session's event loop; not thread-safe.
 */
final class CredentialCache {

    private final Clock clock;
    private final Duration expiresIn;
    private final Duration refreshBuffer;
    private Credential current;

    CredentialCache(Clock clock, Duration expiresIn, Duration refreshBuffer) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.expiresIn = expiresIn;
        this.refreshBuffer = refreshBuffer;
    }

    /**
     * Stores a token.
     *
     * @return true if the value differs from the cached one (and the age was reset)
     */
    boolean update(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        if (current != null && current.token().equals(token)) {
            return false;
        }
        current = new Credential(token, clock.instant(), expiresIn);
        return true;
    }

    Optional<String> validToken() {
        if (current == null || !current.isValidAt(clock.instant(), refreshBuffer)) {
            return Optional.empty();
        }
        return Optional.of(current.token());
    }

    boolean isValid() {
        return validToken().isPresent();
    }

    /**
     * @return delay until a proactive refresh is due (zero if overdue), or empty without a credential
     */
    Optional<Duration> refreshDelay() {
        if (current == null) {
            return Optional.empty();
        }
        Instant due = current.refreshAt(refreshBuffer);
        Duration delay = Duration.between(clock.instant(), due);
        return Optional.of(delay.isNegative() ? Duration.ZERO : delay);
    }

    void invalidate() {
        current = null;
    }
}
