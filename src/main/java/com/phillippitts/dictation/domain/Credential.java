package com.phillippitts.dictation.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Opaque bearer token for the remote streaming endpoint.
 *
 * @param token     token value (never logged)
 * @param issuedAt  when this token value was first seen
 * @param expiresIn server-side validity window
 */
public record Credential(String token, Instant issuedAt, Duration expiresIn) {

    public Credential {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token must not be blank");
        }
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(expiresIn, "expiresIn");
    }

    /**
     * A token is usable while its age is below the expiry window minus the refresh buffer.
     */
    public boolean isValidAt(Instant now, Duration refreshBuffer) {
        Duration age = Duration.between(issuedAt, now);
        return age.compareTo(expiresIn.minus(refreshBuffer)) < 0;
    }

    /**
     * Instant at which a proactive refresh should run: two refresh buffers before expiry.
     */
    public Instant refreshAt(Duration refreshBuffer) {
        return issuedAt.plus(expiresIn).minus(refreshBuffer.multipliedBy(2));
    }

    @Override
    public String toString() {
        return "Credential[issuedAt=" + issuedAt + ", expiresIn=" + expiresIn + "]";
    }
}
