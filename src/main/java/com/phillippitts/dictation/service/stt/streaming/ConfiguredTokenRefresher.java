package com.phillippitts.dictation.service.stt.streaming;

import com.phillippitts.dictation.config.stt.StreamingProperties;
import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.exception.StreamingException;

import java.util.concurrent.CompletableFuture;

/**
 * {@link TokenRefresher} serving the static credential from {@code stt.streaming.api-token}.
 * Registered only when the host application does not provide its own refresher.
 */
public class ConfiguredTokenRefresher implements TokenRefresher {

    private final StreamingProperties properties;

    public ConfiguredTokenRefresher(StreamingProperties properties) {
        this.properties = properties;
    }

    @Override
    public CompletableFuture<String> refreshToken() {
        String token = properties.getApiToken();
        if (token == null || token.isBlank()) {
            return CompletableFuture.failedFuture(new StreamingException(
                    "No streaming credential configured (stt.streaming.api-token)", ErrorCode.AUTHENTICATION));
        }
        return CompletableFuture.completedFuture(token.trim());
    }
}
