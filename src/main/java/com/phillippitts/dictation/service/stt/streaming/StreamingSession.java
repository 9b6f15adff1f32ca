package com.phillippitts.dictation.service.stt.streaming;

import com.phillippitts.dictation.config.stt.StreamingProperties;
import com.phillippitts.dictation.domain.ConnectionState;
import com.phillippitts.dictation.exception.DictationBackendException;
import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.exception.StreamingException;
import com.phillippitts.dictation.service.audio.AudioFormat;
import com.phillippitts.dictation.service.audio.PcmChunkBuffer;
import com.phillippitts.dictation.service.metrics.BackendMetrics;
import com.phillippitts.dictation.service.net.WebSocketChannel;
import com.phillippitts.dictation.service.net.WebSocketConnector;
import com.phillippitts.dictation.service.net.WebSocketListener;
import com.phillippitts.dictation.service.retry.RetryPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Long-lived connection to the remote real-time speech recognition endpoint.
 *
 * <p>The session keeps at most one warm socket (opened ahead of need, fed with silence) and at most
 * one active socket (carrying dictation audio). A warm socket is adopted by {@link #connect} without
 * a handshake; without one, a fresh socket is opened and audio captured meanwhile is buffered and
 * flushed in order once it opens.
 *
 * <p><b>Threading:</b> every public call, socket callback and timer runs on one single-thread
 * scheduler (the event loop), so session state needs no locking. Public methods never block, except
 * {@link #shutdown()}.
 *
 * <p><b>Liveness:</b> an adopted warm socket may be a zombie the server already dropped. If no
 * {@code Results} message arrives within the liveness timeout, the socket is torn down and a new one
 * is opened, replaying every chunk sent since adoption.
 *
 * @see SessionTransitions
 */
@Component
public class StreamingSession {

    private static final Logger LOG = LogManager.getLogger(StreamingSession.class);

    private static final String LOOP_THREAD_NAME = "stt-streaming-loop";
    private static final long MIN_REFRESH_RETRY_MS = 1000L;

    private final StreamingProperties properties;
    private final WebSocketConnector connector;
    private final TokenRefresher tokenRefresher;
    private final BackendMetrics metrics;
    private final ScheduledExecutorService loop;
    private final CredentialCache credentials;
    private final RetryPolicy rewarmPolicy;
    private final PcmChunkBuffer coldStartBuffer;
    private final PcmChunkBuffer replayBuffer;

    // Event-loop confined state
    private ConnectionState state = ConnectionState.COLD;
    private SocketHandler warmHandler;
    private SocketHandler activeHandler;
    private StreamingOptions warmOptions = StreamingOptions.defaults();
    private StreamingOptions activeOptions = StreamingOptions.defaults();
    private CompletableFuture<Void> warmupFuture;
    private CompletableFuture<Void> connectFuture;
    private CompletableFuture<String> closeFuture;
    private ScheduledFuture<?> warmKeepalive;
    private ScheduledFuture<?> activeKeepalive;
    private ScheduledFuture<?> livenessTimer;
    private ScheduledFuture<?> refreshTimer;
    private ScheduledFuture<?> rewarmTimer;
    private ScheduledFuture<?> terminationTimer;
    private final List<String> finalSegments = new ArrayList<>();
    private boolean livenessArmed = false;
    private boolean audioFlowing = false;
    private boolean shutdown = false;
    private int rewarmAttempts = 0;
    private long generation = 0;
    private String sessionId;

    private volatile StreamingStatus status;
    private volatile StreamingListener listener = StreamingListener.NOOP;

    @Autowired
    public StreamingSession(StreamingProperties properties, WebSocketConnector connector,
                            TokenRefresher tokenRefresher, BackendMetrics metrics) {
        this(properties, connector, tokenRefresher, metrics,
                Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, LOOP_THREAD_NAME);
                    t.setDaemon(true);
                    return t;
                }),
                Clock.systemUTC());
    }

    StreamingSession(StreamingProperties properties, WebSocketConnector connector, TokenRefresher tokenRefresher,
                     BackendMetrics metrics, ScheduledExecutorService loop, Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.tokenRefresher = Objects.requireNonNull(tokenRefresher, "tokenRefresher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.credentials = new CredentialCache(clock,
                Duration.ofSeconds(properties.getTokenExpirySeconds()),
                Duration.ofSeconds(properties.getRefreshBufferSeconds()));
        this.rewarmPolicy = RetryPolicy.of(properties.getMaxRewarmAttempts(),
                Duration.ofMillis(properties.getRewarmBaseDelayMs()),
                Duration.ofMillis(properties.getRewarmMaxDelayMs()),
                t -> true);
        int bufferBytes = AudioFormat.bytesFor(Duration.ofSeconds(properties.getColdStartBufferSeconds()),
                AudioFormat.REQUIRED_SAMPLE_RATE);
        this.coldStartBuffer = new PcmChunkBuffer("cold-start", bufferBytes);
        this.replayBuffer = new PcmChunkBuffer("liveness-replay", bufferBytes);
        refreshStatus();
    }

    public void setListener(StreamingListener listener) {
        this.listener = listener == null ? StreamingListener.NOOP : listener;
    }

    /**
     * Opens a warm socket ahead of need. Completes when the socket is open.
     *
     * <p>Coalesced: while warming, the in-flight outcome is returned; while warm, completes
     * immediately. A no-op while a dictation is active or closing.
     *
     * @param token   fresh credential, or null to use the cache or the {@link TokenRefresher}
     * @param options parameters the warm socket is opened with; {@link #connect} only adopts it
     *                when called with equal options
     */
    public CompletableFuture<Void> warmup(String token, StreamingOptions options) {
        Objects.requireNonNull(options, "options");
        return onLoop(() -> doWarmup(token, options, true));
    }

    /**
     * Starts a dictation: adopts the warm socket or opens a new one. Concurrent calls share one
     * in-flight future.
     */
    public CompletableFuture<Void> connect(StreamingOptions options) {
        Objects.requireNonNull(options, "options");
        return onLoop(() -> doConnect(options));
    }

    /**
     * Forwards PCM audio. Buffered while the socket opens; dropped when no dictation is in progress.
     * The array is copied, so callers may reuse it.
     */
    public void sendAudio(byte[] pcm) {
        if (pcm == null || pcm.length == 0) {
            return;
        }
        byte[] chunk = pcm.clone();
        execute(() -> doSendAudio(chunk));
    }

    /**
     * Asks the server to flush the utterance in progress as a final result.
     */
    public void finalizeUtterance() {
        execute(() -> {
            SocketHandler handler = activeHandler;
            if (handler != null && handler.channel != null && handler.channel.isOpen()) {
                send(handler.channel, StreamingMessageParser.FINALIZE, "Finalize");
            }
        });
    }

    /**
     * Ends the dictation.
     *
     * @param closeGracefully send CloseStream and wait (bounded) for the server's last results;
     *                        otherwise drop the socket at once
     * @return accumulated final transcript; never completes exceptionally
     */
    public CompletableFuture<String> disconnect(boolean closeGracefully) {
        return onLoop(() -> doDisconnect(closeGracefully))
                .handle((text, err) -> {
                    if (err != null) {
                        LOG.warn("Disconnect did not complete cleanly: {}", err.getMessage());
                        return "";
                    }
                    return text;
                });
    }

    public StreamingStatus getStatus() {
        return status;
    }

    /**
     * Tears down both sockets, cancels every timer, forgets the credential and stops the event loop.
     */
    public void shutdown() {
        CompletableFuture<Void> done = onLoop(() -> {
            doShutdown();
            return CompletableFuture.completedFuture(null);
        });
        try {
            done.get(properties.getTerminationTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("Streaming session shutdown incomplete: {}", e.toString());
        } finally {
            loop.shutdownNow();
        }
    }

    // ---------------------------------------------------------------- warmup

    private CompletableFuture<Void> doWarmup(String token, StreamingOptions options, boolean callerInitiated) {
        if (shutdown) {
            return CompletableFuture.failedFuture(shutDownException());
        }
        if (callerInitiated) {
            rewarmAttempts = 0;
            cancel(rewarmTimer);
            rewarmTimer = null;
        }
        if (token != null) {
            credentials.update(token);
        }
        if (state == ConnectionState.WARMING && warmupFuture != null) {
            return warmupFuture;
        }
        if (state == ConnectionState.WARM_IDLE) {
            return CompletableFuture.completedFuture(null);
        }
        if (!SessionTransitions.isAllowed(state, SessionEvent.WARMUP_STARTED) || activeHandler != null) {
            LOG.debug("Warmup skipped in state {}", state);
            return CompletableFuture.completedFuture(null);
        }

        transition(SessionEvent.WARMUP_STARTED);
        warmOptions = options;
        SocketHandler handler = new SocketHandler();
        warmHandler = handler;
        CompletableFuture<Void> result = new CompletableFuture<>();
        warmupFuture = result;
        LOG.debug("Opening warm streaming socket (rewarm={}, attempt={})", !callerInitiated, rewarmAttempts);

        openSocket(handler, options).whenCompleteAsync(
                (channel, err) -> onWarmSocketResult(handler, result, channel, err, callerInitiated), loop);
        return result;
    }

    private void onWarmSocketResult(SocketHandler handler, CompletableFuture<Void> result,
                                    WebSocketChannel channel, Throwable err, boolean callerInitiated) {
        if (handler != warmHandler) {
            if (channel != null) {
                channel.abort();
            }
            return;
        }
        warmupFuture = null;
        if (err != null) {
            StreamingException failure = toStreamingException(err, "Warmup failed");
            warmHandler = null;
            transition(SessionEvent.WARM_LOST);
            LOG.warn("Warm streaming socket failed to open: {} ({})", failure.getMessage(), failure.getErrorCode());
            result.completeExceptionally(failure);
            if (!callerInitiated) {
                scheduleRewarm();
            }
            return;
        }
        handler.channel = channel;
        transition(SessionEvent.WARM_OPENED);
        byte[] silence = AudioFormat.silence(Duration.ofMillis(properties.getSilenceFrameMs()),
                warmOptions.sampleRate());
        send(channel, silence);
        long interval = properties.getKeepaliveIntervalMs();
        warmKeepalive = loop.scheduleAtFixedRate(() -> {
            if (handler == warmHandler && handler.channel.isOpen()) {
                send(handler.channel, silence);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        scheduleRefresh();
        LOG.info("Warm streaming socket ready");
        result.complete(null);
    }

    private void onWarmLost(SocketHandler handler, String reason) {
        boolean wasReady = state == ConnectionState.WARM_IDLE;
        stopWarmTimers();
        warmHandler = null;
        if (handler.channel != null) {
            handler.channel.abort();
        }
        if (warmupFuture != null) {
            warmupFuture.completeExceptionally(new StreamingException(
                    "Warm socket lost while opening: " + reason, ErrorCode.TRANSIENT));
            warmupFuture = null;
        }
        transition(SessionEvent.WARM_LOST);
        LOG.warn("Warm streaming socket lost: {}", reason);
        if (wasReady) {
            scheduleRewarm();
        }
    }

    private void discardWarm(String reason) {
        SocketHandler handler = warmHandler;
        stopWarmTimers();
        warmHandler = null;
        if (handler != null && handler.channel != null) {
            handler.channel.abort();
        }
        if (warmupFuture != null) {
            warmupFuture.completeExceptionally(new StreamingException(
                    "Warmup cancelled: " + reason, ErrorCode.CANCELLED));
            warmupFuture = null;
        }
        transition(SessionEvent.WARM_LOST);
        LOG.debug("Warm streaming socket discarded: {}", reason);
    }

    private void stopWarmTimers() {
        cancel(warmKeepalive);
        warmKeepalive = null;
        cancel(refreshTimer);
        refreshTimer = null;
    }

    private void scheduleRewarm() {
        if (shutdown) {
            return;
        }
        if (!rewarmPolicy.allowsRetry(rewarmAttempts)) {
            LOG.warn("Giving up on pre-warming after {} re-warm attempts; next dictation cold-starts",
                    rewarmAttempts);
            refreshStatus();
            return;
        }
        Duration delay = rewarmPolicy.delayFor(rewarmAttempts);
        rewarmAttempts++;
        metrics.incrementRewarm();
        StreamingOptions options = warmOptions;
        LOG.info("Re-warming streaming socket in {}ms (attempt {}/{})",
                delay.toMillis(), rewarmAttempts, rewarmPolicy.maxRetries());
        rewarmTimer = loop.schedule(() -> {
            rewarmTimer = null;
            if (state == ConnectionState.COLD || state == ConnectionState.CLOSED) {
                doWarmup(null, options, false);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        refreshStatus();
    }

    private void scheduleRefresh() {
        cancel(refreshTimer);
        refreshTimer = null;
        Optional<Duration> delay = credentials.refreshDelay();
        if (delay.isEmpty()) {
            return;
        }
        refreshTimer = loop.schedule(this::refreshCredential, delay.get().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void refreshCredential() {
        refreshTimer = null;
        if (state != ConnectionState.WARM_IDLE) {
            return;
        }
        requestToken().whenCompleteAsync((token, err) -> {
            if (state != ConnectionState.WARM_IDLE || shutdown) {
                return;
            }
            if (err != null) {
                LOG.warn("Proactive credential refresh failed: {}", unwrap(err).getMessage());
                refreshTimer = loop.schedule(this::refreshCredential, refreshRetryDelayMs(), TimeUnit.MILLISECONDS);
                return;
            }
            if (!credentials.update(token)) {
                LOG.debug("Credential refresh returned the cached token; retrying later");
                refreshTimer = loop.schedule(this::refreshCredential, refreshRetryDelayMs(), TimeUnit.MILLISECONDS);
                return;
            }
            LOG.info("Credential refreshed; rotating warm streaming socket");
            StreamingOptions options = warmOptions;
            discardWarm("credential rotated");
            doWarmup(null, options, false);
        }, loop);
    }

    private long refreshRetryDelayMs() {
        return Math.max(MIN_REFRESH_RETRY_MS, properties.getRefreshBufferSeconds() * 1000L / 2);
    }

    // ---------------------------------------------------------------- connect

    private CompletableFuture<Void> doConnect(StreamingOptions options) {
        if (shutdown) {
            return CompletableFuture.failedFuture(shutDownException());
        }
        if (connectFuture != null) {
            return connectFuture;
        }
        if (state == ConnectionState.CLOSING && closeFuture != null) {
            return closeFuture.handle((text, err) -> null)
                    .thenCompose(ignored -> onLoop(() -> doConnect(options)));
        }
        if (state == ConnectionState.ACTIVE) {
            return CompletableFuture.completedFuture(null);
        }

        cancel(rewarmTimer);
        rewarmTimer = null;
        finalSegments.clear();
        audioFlowing = false;
        livenessArmed = false;
        replayBuffer.clear();

        if (state == ConnectionState.WARM_IDLE && warmHandler != null && warmHandler.channel != null
                && warmHandler.channel.isOpen() && options.equals(warmOptions)) {
            adoptWarm();
            return CompletableFuture.completedFuture(null);
        }
        if (state == ConnectionState.WARM_IDLE || state == ConnectionState.WARMING) {
            discardWarm(state == ConnectionState.WARMING ? "connect while warming" : "warm socket unusable");
        }
        return coldConnect(options, false);
    }

    private void adoptWarm() {
        SocketHandler handler = warmHandler;
        stopWarmTimers();
        warmHandler = null;
        activeHandler = handler;
        activeOptions = warmOptions;
        transition(SessionEvent.WARM_ADOPTED);
        startActiveKeepalive(handler);
        livenessArmed = true;
        long gen = generation;
        livenessTimer = loop.schedule(() -> onLivenessTimeout(handler, gen),
                properties.getLivenessTimeoutMs(), TimeUnit.MILLISECONDS);
        LOG.info("Adopted warm streaming socket");
    }

    private CompletableFuture<Void> coldConnect(StreamingOptions options, boolean replacement) {
        transition(SessionEvent.COLD_CONNECT_STARTED);
        activeOptions = options;
        SocketHandler handler = new SocketHandler();
        activeHandler = handler;
        CompletableFuture<Void> result = new CompletableFuture<>();
        connectFuture = result;
        long gen = generation;
        LOG.info("Opening {} streaming socket", replacement ? "replacement" : "cold");
        openSocket(handler, options).whenCompleteAsync(
                (channel, err) -> onActiveSocketResult(handler, gen, result, channel, err), loop);
        return result;
    }

    private void onActiveSocketResult(SocketHandler handler, long gen, CompletableFuture<Void> result,
                                      WebSocketChannel channel, Throwable err) {
        if (handler != activeHandler || gen != generation) {
            if (channel != null) {
                channel.abort();
            }
            result.completeExceptionally(new StreamingException(
                    "Connect superseded by disconnect", ErrorCode.CANCELLED));
            return;
        }
        connectFuture = null;
        if (err != null) {
            StreamingException failure = toStreamingException(err, "Streaming connect failed");
            activeHandler = null;
            transition(SessionEvent.ACTIVE_LOST);
            LOG.warn("Streaming socket failed to open: {} ({})", failure.getMessage(), failure.getErrorCode());
            notifyError(failure);
            result.completeExceptionally(failure);
            return;
        }
        handler.channel = channel;
        transition(SessionEvent.ACTIVE_OPENED);
        List<byte[]> buffered = coldStartBuffer.drain();
        for (byte[] chunk : buffered) {
            send(channel, chunk);
        }
        if (!buffered.isEmpty()) {
            audioFlowing = true;
            LOG.debug("Flushed {} buffered audio chunks", buffered.size());
        } else {
            startActiveKeepalive(handler);
        }
        result.complete(null);
    }

    private void startActiveKeepalive(SocketHandler handler) {
        cancel(activeKeepalive);
        long interval = properties.getKeepaliveIntervalMs();
        activeKeepalive = loop.scheduleAtFixedRate(() -> {
            if (!audioFlowing && handler == activeHandler && handler.channel.isOpen()) {
                send(handler.channel, StreamingMessageParser.KEEP_ALIVE, "KeepAlive");
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void onLivenessTimeout(SocketHandler handler, long gen) {
        livenessTimer = null;
        if (gen != generation || handler != activeHandler || !livenessArmed) {
            return;
        }
        livenessArmed = false;
        List<byte[]> replay = replayBuffer.drain();
        LOG.warn("No transcript within {}ms of adopting warm socket; reconnecting and replaying {} chunks",
                properties.getLivenessTimeoutMs(), replay.size());
        metrics.incrementStreamingReconnect("liveness");
        cancel(activeKeepalive);
        activeKeepalive = null;
        activeHandler = null;
        if (handler.channel != null) {
            handler.channel.abort();
        }
        transition(SessionEvent.ACTIVE_LOST);
        coldStartBuffer.clear();
        replay.forEach(coldStartBuffer::offer);
        coldConnect(activeOptions, true).whenComplete((ignored, err) -> {
            if (err != null) {
                LOG.warn("Replacement streaming socket failed: {}", unwrap(err).getMessage());
            }
        });
    }

    // ---------------------------------------------------------------- audio

    private void doSendAudio(byte[] chunk) {
        SocketHandler handler = activeHandler;
        if (handler == null) {
            LOG.trace("Dropping {}B of audio; no dictation in progress", chunk.length);
            return;
        }
        if (state == ConnectionState.ACTIVE && handler.channel != null) {
            send(handler.channel, chunk);
            if (livenessArmed) {
                replayBuffer.offer(chunk);
            }
            if (!audioFlowing) {
                audioFlowing = true;
                cancel(activeKeepalive);
                activeKeepalive = null;
            }
        } else if (state == ConnectionState.COLD) {
            coldStartBuffer.offer(chunk);
        }
    }

    // ---------------------------------------------------------------- disconnect

    private CompletableFuture<String> doDisconnect(boolean closeGracefully) {
        generation++;
        cancel(livenessTimer);
        livenessTimer = null;
        livenessArmed = false;
        replayBuffer.clear();
        if (state == ConnectionState.CLOSING && closeFuture != null) {
            return closeFuture;
        }
        SocketHandler handler = activeHandler;
        if (state != ConnectionState.ACTIVE || handler == null || handler.channel == null) {
            if (handler != null) {
                activeHandler = null;
                if (connectFuture != null) {
                    connectFuture.completeExceptionally(new StreamingException(
                            "Connect cancelled by disconnect", ErrorCode.CANCELLED));
                    connectFuture = null;
                }
                transition(SessionEvent.CLOSED);
            }
            coldStartBuffer.clear();
            return CompletableFuture.completedFuture(accumulatedTranscript());
        }

        cancel(activeKeepalive);
        activeKeepalive = null;
        transition(SessionEvent.CLOSE_REQUESTED);
        CompletableFuture<String> result = new CompletableFuture<>();
        closeFuture = result;
        if (closeGracefully && handler.channel.isOpen()) {
            send(handler.channel, StreamingMessageParser.CLOSE_STREAM, "CloseStream");
            terminationTimer = loop.schedule(() -> {
                if (closeFuture == result) {
                    LOG.warn("Server did not close the stream within {}ms", properties.getTerminationTimeoutMs());
                    completeClose("termination timeout");
                }
            }, properties.getTerminationTimeoutMs(), TimeUnit.MILLISECONDS);
        } else {
            completeClose("abort");
        }
        return result;
    }

    private void completeClose(String reason) {
        cancel(terminationTimer);
        terminationTimer = null;
        SocketHandler handler = activeHandler;
        activeHandler = null;
        if (handler != null && handler.channel != null) {
            handler.channel.abort();
        }
        coldStartBuffer.clear();
        audioFlowing = false;
        transition(SessionEvent.CLOSED);
        String transcript = accumulatedTranscript();
        LOG.info("Streaming dictation closed ({}); transcript length={}", reason, transcript.length());
        CompletableFuture<String> pending = closeFuture;
        closeFuture = null;
        if (pending != null) {
            pending.complete(transcript);
        }
    }

    private String accumulatedTranscript() {
        return String.join(" ", finalSegments).trim();
    }

    // ---------------------------------------------------------------- socket events

    private void handleText(SocketHandler handler, String text) {
        boolean active = handler == activeHandler;
        if (!active && handler != warmHandler) {
            return;
        }
        Optional<ServerMessage> parsed = StreamingMessageParser.parse(text);
        if (parsed.isEmpty()) {
            return;
        }
        ServerMessage message = parsed.get();
        switch (message.type()) {
            case METADATA:
                sessionId = message.requestId();
                LOG.debug("Streaming session id={}", sessionId);
                refreshStatus();
                break;
            case RESULTS:
                if (active) {
                    onResults(message);
                }
                break;
            case ERROR:
                onServerError(message.description());
                break;
            case SPEECH_STARTED:
            case UTTERANCE_END:
                LOG.debug("Streaming event {}", message.type());
                break;
            default:
                LOG.trace("Ignoring streaming message of unknown type");
        }
    }

    private void onResults(ServerMessage message) {
        if (livenessArmed) {
            livenessArmed = false;
            cancel(livenessTimer);
            livenessTimer = null;
            replayBuffer.clear();
        }
        String text = message.transcript() == null ? "" : message.transcript().trim();
        if (text.isEmpty()) {
            return;
        }
        StreamingListener current = listener;
        try {
            if (message.isFinal()) {
                finalSegments.add(text);
                current.onFinalTranscript(accumulatedTranscript());
            } else {
                current.onPartialTranscript(text);
            }
        } catch (RuntimeException e) {
            LOG.warn("Streaming listener failed: {}", e.toString());
        }
    }

    private void onServerError(String description) {
        boolean auth = StreamingMessageParser.isAuthenticationError(description);
        if (auth) {
            credentials.invalidate();
            refreshStatus();
        }
        ErrorCode code = auth ? ErrorCode.AUTHENTICATION : ErrorCode.PROTOCOL;
        LOG.warn("Streaming server reported error ({}): {}", code, description);
        notifyError(new StreamingException(description, code));
    }

    private void handleClose(SocketHandler handler, int statusCode, String reason) {
        if (handler == warmHandler) {
            onWarmLost(handler, "closed (code=" + statusCode + ")");
        } else if (handler == activeHandler) {
            if (state == ConnectionState.CLOSING) {
                completeClose("server closed");
            } else {
                onActiveLost(handler, new StreamingException(
                        "Streaming socket closed unexpectedly (code=" + statusCode + ", reason=" + reason + ")",
                        ErrorCode.TRANSIENT));
            }
        }
    }

    private void handleSocketError(SocketHandler handler, Throwable error) {
        if (handler == warmHandler) {
            onWarmLost(handler, "error: " + error.getMessage());
        } else if (handler == activeHandler) {
            if (state == ConnectionState.CLOSING) {
                completeClose("socket error");
            } else {
                onActiveLost(handler, toStreamingException(error, "Streaming socket failed"));
            }
        }
    }

    private void onActiveLost(SocketHandler handler, StreamingException failure) {
        cancel(activeKeepalive);
        activeKeepalive = null;
        cancel(livenessTimer);
        livenessTimer = null;
        livenessArmed = false;
        activeHandler = null;
        if (handler.channel != null) {
            handler.channel.abort();
        }
        transition(SessionEvent.ACTIVE_LOST);
        LOG.warn("Active streaming socket lost: {}", failure.getMessage());
        if (connectFuture != null) {
            connectFuture.completeExceptionally(failure);
            connectFuture = null;
        }
        notifyError(failure);
    }

    // ---------------------------------------------------------------- shutdown

    private void doShutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        generation++;
        cancel(warmKeepalive);
        cancel(activeKeepalive);
        cancel(livenessTimer);
        cancel(refreshTimer);
        cancel(rewarmTimer);
        cancel(terminationTimer);
        for (SocketHandler handler : new SocketHandler[]{warmHandler, activeHandler}) {
            if (handler != null && handler.channel != null) {
                handler.channel.abort();
            }
        }
        warmHandler = null;
        activeHandler = null;
        StreamingException closed = shutDownException();
        if (warmupFuture != null) {
            warmupFuture.completeExceptionally(closed);
        }
        if (connectFuture != null) {
            connectFuture.completeExceptionally(closed);
        }
        if (closeFuture != null) {
            closeFuture.complete(accumulatedTranscript());
        }
        warmupFuture = null;
        connectFuture = null;
        closeFuture = null;
        coldStartBuffer.clear();
        replayBuffer.clear();
        credentials.invalidate();
        transition(SessionEvent.SHUTDOWN);
        LOG.info("Streaming session shut down");
    }

    // ---------------------------------------------------------------- helpers

    private CompletableFuture<WebSocketChannel> openSocket(SocketHandler handler, StreamingOptions options) {
        Duration timeout = Duration.ofMillis(properties.getConnectTimeoutMs());
        URI uri = StreamingUrlBuilder.build(properties.getEndpoint(), options);
        return obtainToken()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .thenCompose(token -> connector.connect(uri, Map.of("Authorization", "Bearer " + token),
                        timeout, handler));
    }

    private CompletableFuture<String> obtainToken() {
        Optional<String> cached = credentials.validToken();
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        return requestToken().thenApplyAsync(token -> {
            credentials.update(token);
            refreshStatus();
            return token;
        }, loop);
    }

    private CompletableFuture<String> requestToken() {
        try {
            CompletableFuture<String> future = tokenRefresher.refreshToken();
            return future == null
                    ? CompletableFuture.failedFuture(new StreamingException(
                            "Token refresher returned no result", ErrorCode.AUTHENTICATION))
                    : future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private StreamingException toStreamingException(Throwable error, String context) {
        Throwable cause = unwrap(error);
        StreamingException result;
        if (cause instanceof StreamingException se) {
            result = se;
        } else if (cause instanceof DictationBackendException dbe) {
            result = new StreamingException(context + ": " + dbe.getMessage(), dbe.getErrorCode(), dbe);
        } else if (cause instanceof TimeoutException) {
            result = new StreamingException(context + ": timed out", ErrorCode.TRANSIENT, cause);
        } else {
            result = new StreamingException(context + ": " + cause.getMessage(), ErrorCode.TRANSIENT, cause);
        }
        if (result.getErrorCode() == ErrorCode.AUTHENTICATION) {
            credentials.invalidate();
            metrics.incrementStreamingReconnect("auth");
            refreshStatus();
        }
        return result;
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void notifyError(StreamingException error) {
        try {
            listener.onError(error);
        } catch (RuntimeException e) {
            LOG.warn("Streaming listener failed: {}", e.toString());
        }
    }

    private void send(WebSocketChannel channel, byte[] data) {
        channel.sendBinary(data).whenComplete((ignored, err) -> {
            if (err != null) {
                LOG.debug("Audio frame not sent: {}", unwrap(err).getMessage());
            }
        });
    }

    private void send(WebSocketChannel channel, String json, String label) {
        channel.sendText(json).whenComplete((ignored, err) -> {
            if (err != null) {
                LOG.debug("{} not sent: {}", label, unwrap(err).getMessage());
            }
        });
    }

    private void transition(SessionEvent event) {
        ConnectionState next = SessionTransitions.next(state, event);
        if (next != state) {
            LOG.debug("Streaming session {} --{}--> {}", state, event, next);
        }
        state = next;
        refreshStatus();
    }

    private void refreshStatus() {
        SocketHandler warm = warmHandler;
        boolean warmOpen = warm != null && warm.channel != null && warm.channel.isOpen();
        status = new StreamingStatus(state, sessionId, warmOpen, credentials.isValid(), rewarmAttempts);
    }

    private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> action) {
        try {
            return CompletableFuture.supplyAsync(action, loop).thenCompose(Function.identity());
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(shutDownException());
        }
    }

    private void execute(Runnable task) {
        try {
            loop.execute(task);
        } catch (RejectedExecutionException e) {
            LOG.debug("Streaming session is shut down; event dropped");
        }
    }

    private static StreamingException shutDownException() {
        return new StreamingException("Streaming session is shut down", ErrorCode.NOT_READY);
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    /**
     * Listener bound to one socket. Callbacks are moved onto the event loop; events from a socket
     * the session no longer tracks are ignored by identity.
     */
    private final class SocketHandler implements WebSocketListener {

        private WebSocketChannel channel;

        @Override
        public void onText(WebSocketChannel ch, String text) {
            execute(() -> handleText(this, text));
        }

        @Override
        public void onClose(WebSocketChannel ch, int statusCode, String reason) {
            execute(() -> handleClose(this, statusCode, reason));
        }

        @Override
        public void onError(WebSocketChannel ch, Throwable error) {
            execute(() -> handleSocketError(this, error));
        }
    }
}
