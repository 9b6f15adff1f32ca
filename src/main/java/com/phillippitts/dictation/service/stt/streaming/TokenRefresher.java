package com.phillippitts.dictation.service.stt.streaming;

import java.util.concurrent.CompletableFuture;

/**
 * Issues short-lived bearer tokens for the streaming endpoint. Implemented by the authentication
 * layer of the host application.
 */
@FunctionalInterface
public interface TokenRefresher {

    /**
     * @return future completed with a fresh token, or exceptionally with a
     *         {@link com.phillippitts.dictation.exception.StreamingException} carrying
     *         {@link com.phillippitts.dictation.exception.ErrorCode#AUTHENTICATION}
     */
    CompletableFuture<String> refreshToken();
}
