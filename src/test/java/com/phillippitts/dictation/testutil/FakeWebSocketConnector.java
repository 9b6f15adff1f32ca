package com.phillippitts.dictation.testutil;

import com.phillippitts.dictation.service.net.WebSocketChannel;
import com.phillippitts.dictation.service.net.WebSocketConnector;
import com.phillippitts.dictation.service.net.WebSocketListener;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory {@link WebSocketConnector}. Every connect attempt yields a {@link FakeChannel} that
 * records what the client sent and lets the test play the server side.
 *
 * <p>By default sockets open immediately. With {@link #holdConnections()} each connect stays
 * pending until {@link #openPending()} or {@link #failPending(Throwable)}.
 */
public class FakeWebSocketConnector implements WebSocketConnector {

    private final List<FakeChannel> channels = new CopyOnWriteArrayList<>();
    private final List<Pending> pending = new CopyOnWriteArrayList<>();
    private final List<URI> uris = new CopyOnWriteArrayList<>();
    private final List<Map<String, String>> headers = new CopyOnWriteArrayList<>();
    private volatile boolean hold = false;
    private volatile Throwable failure;
    private volatile Consumer<FakeChannel> onOpen = ch -> {};

    public void holdConnections() {
        this.hold = true;
    }

    /**
     * Makes every subsequent connect fail with the given error.
     */
    public void failWith(Throwable failure) {
        this.failure = failure;
    }

    /**
     * Installs a server-side script run for every channel as soon as it opens.
     */
    public void onOpen(Consumer<FakeChannel> script) {
        this.onOpen = script;
    }

    @Override
    public CompletableFuture<WebSocketChannel> connect(URI uri, Map<String, String> headers, Duration timeout,
                                                       WebSocketListener listener) {
        uris.add(uri);
        this.headers.add(Map.copyOf(headers));
        Throwable error = failure;
        if (error != null) {
            return CompletableFuture.failedFuture(error);
        }
        FakeChannel channel = new FakeChannel(listener);
        if (hold) {
            CompletableFuture<WebSocketChannel> future = new CompletableFuture<>();
            pending.add(new Pending(channel, future));
            return future;
        }
        return CompletableFuture.completedFuture(open(channel));
    }

    private FakeChannel open(FakeChannel channel) {
        channels.add(channel);
        onOpen.accept(channel);
        return channel;
    }

    /**
     * Opens every pending connection, in request order.
     */
    public void openPending() {
        List<Pending> toOpen = new ArrayList<>(pending);
        pending.removeAll(toOpen);
        toOpen.forEach(p -> p.future().complete(open(p.channel())));
    }

    public void failPending(Throwable error) {
        List<Pending> toFail = new ArrayList<>(pending);
        pending.removeAll(toFail);
        toFail.forEach(p -> p.future().completeExceptionally(error));
    }

    public int connectCount() {
        return uris.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    public List<FakeChannel> channels() {
        return channels;
    }

    public FakeChannel channel(int index) {
        return channels.get(index);
    }

    public URI lastUri() {
        return uris.get(uris.size() - 1);
    }

    public Map<String, String> lastHeaders() {
        return headers.get(headers.size() - 1);
    }

    private record Pending(FakeChannel channel, CompletableFuture<WebSocketChannel> future) {}

    /**
     * Open socket whose server side is driven by the test.
     */
    public static final class FakeChannel implements WebSocketChannel {

        private final WebSocketListener listener;
        private final List<byte[]> binary = new CopyOnWriteArrayList<>();
        private final List<String> text = new CopyOnWriteArrayList<>();
        private volatile boolean open = true;
        private volatile boolean aborted = false;
        private volatile Consumer<String> textHandler = t -> {};
        private volatile Consumer<byte[]> binaryHandler = b -> {};

        FakeChannel(WebSocketListener listener) {
            this.listener = listener;
        }

        /**
         * Installs a server-side reaction to client text messages.
         */
        public void onClientText(Consumer<String> handler) {
            this.textHandler = handler;
        }

        /**
         * Installs a server-side reaction to client binary messages.
         */
        public void onClientBinary(Consumer<byte[]> handler) {
            this.binaryHandler = handler;
        }

        @Override
        public CompletableFuture<Void> sendText(String message) {
            if (!open) {
                return CompletableFuture.failedFuture(new IllegalStateException("closed"));
            }
            text.add(message);
            textHandler.accept(message);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public CompletableFuture<Void> sendBinary(byte[] data) {
            if (!open) {
                return CompletableFuture.failedFuture(new IllegalStateException("closed"));
            }
            binary.add(data.clone());
            binaryHandler.accept(data);
            return CompletableFuture.completedFuture(null);
        }

        @Override
        public void close(int statusCode, String reason) {
            if (open) {
                open = false;
                listener.onClose(this, statusCode, reason);
            }
        }

        @Override
        public void abort() {
            open = false;
            aborted = true;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        public boolean wasAborted() {
            return aborted;
        }

        public List<byte[]> binaryFrames() {
            return binary;
        }

        public List<String> textFrames() {
            return text;
        }

        public void serverText(String message) {
            listener.onText(this, message);
        }

        public void serverClose(int statusCode, String reason) {
            open = false;
            listener.onClose(this, statusCode, reason);
        }

        public void serverError(Throwable error) {
            open = false;
            listener.onError(this, error);
        }
    }
}
