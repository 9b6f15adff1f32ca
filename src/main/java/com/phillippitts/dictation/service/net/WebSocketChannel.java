package com.phillippitts.dictation.service.net;

import java.util.concurrent.CompletableFuture;

/**
 * An open client WebSocket. Sends are queued in call order; callers need not wait for one send
 * to complete before issuing the next.
 */
public interface WebSocketChannel {

    /** Normal closure status code. */
    int NORMAL_CLOSURE = 1000;

    CompletableFuture<Void> sendText(String text);

    CompletableFuture<Void> sendBinary(byte[] data);

    /**
     * Starts a graceful close handshake. The listener's {@code onClose} fires when the peer answers.
     */
    void close(int statusCode, String reason);

    /**
     * Drops the connection immediately without a close handshake. No further callbacks are delivered.
     */
    void abort();

    boolean isOpen();
}
