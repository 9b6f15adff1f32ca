package com.phillippitts.dictation.service.net;

import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.exception.StreamingException;
import com.phillippitts.dictation.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.net.http.WebSocket;
import java.net.http.WebSocketHandshakeException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link WebSocketConnector} backed by the JDK {@link java.net.http.WebSocket} client.
 *
 * <p>Handshake failures are translated into {@link StreamingException}s: HTTP 401/403 become
 * {@link ErrorCode#AUTHENTICATION}, 5xx and network failures {@link ErrorCode#TRANSIENT}, anything
 * else {@link ErrorCode#PROTOCOL}.
 */
@Component
public class JdkWebSocketConnector implements WebSocketConnector {

    private static final Logger LOG = LogManager.getLogger(JdkWebSocketConnector.class);

    private final HttpClient httpClient;

    public JdkWebSocketConnector() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(30)).build());
    }

    JdkWebSocketConnector(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public CompletableFuture<WebSocketChannel> connect(URI uri, Map<String, String> headers, Duration timeout,
                                                       WebSocketListener listener) {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");
        JdkChannel channel = new JdkChannel(listener);
        WebSocket.Builder builder = httpClient.newWebSocketBuilder().connectTimeout(timeout);
        if (headers != null) {
            headers.forEach(builder::header);
        }

        CompletableFuture<WebSocketChannel> result = new CompletableFuture<>();
        builder.buildAsync(uri, channel).whenComplete((ws, err) -> {
            if (err != null) {
                result.completeExceptionally(mapFailure(uri, unwrap(err)));
                return;
            }
            channel.attach(ws);
            if (!result.complete(channel)) {
                // Caller already gave up on this socket
                ws.abort();
            }
        });
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(() ->
                result.completeExceptionally(new StreamingException(
                        "WebSocket connect timed out after " + timeout.toMillis() + "ms", ErrorCode.TRANSIENT)));
        return result;
    }

    static StreamingException mapFailure(URI uri, Throwable error) {
        String target = LogSanitizer.redactQuery(uri.toString());
        if (error instanceof StreamingException se) {
            return se;
        }
        if (error instanceof WebSocketHandshakeException hse) {
            int status = hse.getResponse() != null ? hse.getResponse().statusCode() : -1;
            ErrorCode code;
            if (status == 401 || status == 403) {
                code = ErrorCode.AUTHENTICATION;
            } else if (status >= 500) {
                code = ErrorCode.TRANSIENT;
            } else {
                code = ErrorCode.PROTOCOL;
            }
            return new StreamingException("WebSocket handshake rejected by " + target + " (status " + status + ")",
                    code, error);
        }
        if (error instanceof HttpTimeoutException) {
            return new StreamingException("WebSocket connect to " + target + " timed out", ErrorCode.TRANSIENT, error);
        }
        LOG.debug("WebSocket connect to {} failed: {}", target, error.toString());
        return new StreamingException("WebSocket connect to " + target + " failed: " + error.getMessage(),
                ErrorCode.TRANSIENT, error);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Adapts the JDK listener contract (partial messages, explicit demand) to {@link WebSocketListener}
     * and serialises outgoing frames, which the JDK client does not allow to overlap.
     */
    static final class JdkChannel implements WebSocket.Listener, WebSocketChannel {

        private final WebSocketListener listener;
        private final StringBuilder textBuffer = new StringBuilder();
        private volatile WebSocket webSocket;
        private volatile boolean aborted = false;
        private CompletableFuture<Void> sendChain = CompletableFuture.completedFuture(null);

        JdkChannel(WebSocketListener listener) {
            this.listener = listener;
        }

        void attach(WebSocket ws) {
            this.webSocket = ws;
        }

        @Override
        public void onOpen(WebSocket ws) {
            this.webSocket = ws;
            ws.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String text = textBuffer.toString();
                textBuffer.setLength(0);
                if (!aborted) {
                    listener.onText(this, text);
                }
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            if (!aborted) {
                listener.onClose(this, statusCode, reason);
            }
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            if (!aborted) {
                listener.onError(this, error);
            }
        }

        @Override
        public CompletableFuture<Void> sendText(String text) {
            return enqueue(() -> webSocket.sendText(text, true));
        }

        @Override
        public CompletableFuture<Void> sendBinary(byte[] data) {
            return enqueue(() -> webSocket.sendBinary(ByteBuffer.wrap(data), true));
        }

        @Override
        public void close(int statusCode, String reason) {
            enqueue(() -> webSocket.sendClose(statusCode, reason == null ? "" : reason));
        }

        @Override
        public void abort() {
            aborted = true;
            WebSocket ws = webSocket;
            if (ws != null) {
                ws.abort();
            }
        }

        @Override
        public boolean isOpen() {
            WebSocket ws = webSocket;
            return ws != null && !aborted && !ws.isOutputClosed() && !ws.isInputClosed();
        }

        private synchronized CompletableFuture<Void> enqueue(Supplier<CompletableFuture<WebSocket>> send) {
            if (!isOpen()) {
                return CompletableFuture.failedFuture(
                        new StreamingException("WebSocket is not open", ErrorCode.TRANSIENT));
            }
            sendChain = sendChain
                    .exceptionally(previousFailure -> null)
                    .thenCompose(ignored -> send.get())
                    .thenApply(ws -> null);
            return sendChain;
        }
    }
}
