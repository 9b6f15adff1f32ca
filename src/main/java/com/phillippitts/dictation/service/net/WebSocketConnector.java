package com.phillippitts.dictation.service.net;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Opens client WebSockets. Abstracted so sessions and socket-protocol servers can be tested with
 * in-memory fakes.
 *
 * <p>Production code uses {@link JdkWebSocketConnector}.
 */
public interface WebSocketConnector {

    /**
     * Opens a socket.
     *
     * @param uri      endpoint
     * @param headers  handshake headers (e.g. Authorization)
     * @param timeout  upper bound on the connect and handshake
     * @param listener receives messages once the socket is open
     * @return future completed with the open channel, or exceptionally with a
     *         {@link com.phillippitts.dictation.exception.StreamingException}
     */
    CompletableFuture<WebSocketChannel> connect(URI uri, Map<String, String> headers, Duration timeout,
                                                WebSocketListener listener);
}
