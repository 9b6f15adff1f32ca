package com.phillippitts.dictation.service.stt.streaming;

import com.phillippitts.dictation.domain.ConnectionState;

/**
 * Snapshot of a streaming session for status endpoints and health checks.
 *
 * @param state           current connection state
 * @param sessionId       server session id from the last Metadata message (may be null)
 * @param warmConnection  whether a warm socket is open
 * @param credentialValid whether the cached credential can be reused
 * @param rewarmAttempts  re-warm attempts since the last caller-initiated warmup
 */
public record StreamingStatus(
        ConnectionState state,
        String sessionId,
        boolean warmConnection,
        boolean credentialValid,
        int rewarmAttempts
) {}
