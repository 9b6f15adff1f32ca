package com.phillippitts.dictation.service.stt.local;

import com.phillippitts.dictation.config.ThreadPoolConfig;
import com.phillippitts.dictation.config.stt.InferenceServerSettings;
import com.phillippitts.dictation.domain.ServerProcessState;
import com.phillippitts.dictation.domain.TranscriptionResult;
import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.exception.ModelNotFoundException;
import com.phillippitts.dictation.exception.TranscriptionException;
import com.phillippitts.dictation.exception.TranscriptionExceptionBuilder;
import com.phillippitts.dictation.service.audio.AudioFormat;
import com.phillippitts.dictation.service.events.GpuFallbackEvent;
import com.phillippitts.dictation.service.events.ServerStateChangedEvent;
import com.phillippitts.dictation.service.metrics.BackendMetrics;
import com.phillippitts.dictation.service.process.ProcessFactory;
import com.phillippitts.dictation.service.process.ProcessTerminator;
import com.phillippitts.dictation.service.process.StreamGobbler;
import com.phillippitts.dictation.util.ProcessTimeouts;
import com.phillippitts.dictation.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Supervises one locally spawned inference server process.
 *
 * <p>This class implements the Template Method pattern: it owns port allocation, spawning,
 * readiness polling, GPU fallback, health checking and shutdown, while subclasses supply the
 * command line, the readiness and health probes, and the request protocol.
 *
 * <p><b>Thread Safety:</b> state is guarded by {@link #lock}, which is never held across process
 * or network I/O. Startup and health checks run on the shared scheduler; state change events are
 * published after the lock is released.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>{@link #start} is coalesced: concurrent calls for the same model share one future, a call
 *       for another model waits for the current startup and then restarts</li>
 *   <li>Requests are served in {@code READY} and {@code DEGRADED} only</li>
 *   <li>An exit after {@code READY} moves the server to {@code CRASHED}; the next {@link #start}
 *       spawns a new process</li>
 *   <li>{@link #stop} always completes, killing the process if it ignores the graceful request</li>
 * </ol>
 *
 * @see com.phillippitts.dictation.service.stt.local.whisper.WhisperServerManager
 * @see com.phillippitts.dictation.service.stt.local.parakeet.ParakeetServerManager
 */
public abstract class AbstractInferenceServer {

    private static final Logger LOG = LogManager.getLogger(AbstractInferenceServer.class);

    /** Interval of readiness polling during startup. */
    static final Duration READINESS_POLL_INTERVAL = Duration.ofMillis(100);

    /** Characters of stderr quoted in startup failure messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 200;

    /**
     * Lock guarding the process state. Must not be held across I/O.
     */
    protected final Object lock = new Object();

    private final String backend;
    private final InferenceServerSettings settings;
    private final ProcessFactory processFactory;
    private final ScheduledExecutorService scheduler;
    private final ApplicationEventPublisher publisher;
    private final BackendMetrics metrics;

    // Guarded by lock
    private ServerProcessState state = ServerProcessState.STOPPED;
    private ServerHandle running;
    private CompletableFuture<Void> startFuture;
    private Path startingModel;
    private ServerStartOptions startingOptions;
    private ScheduledFuture<?> healthTask;
    private long epoch = 0;
    private final List<ServerStateChangedEvent> outbox = new ArrayList<>();

    protected AbstractInferenceServer(String backend, InferenceServerSettings settings, ProcessFactory processFactory,
                                      ScheduledExecutorService scheduler, ApplicationEventPublisher publisher,
                                      BackendMetrics metrics) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public final String getBackendName() {
        return backend;
    }

    // ---------------------------------------------------------------- template hooks

    /**
     * Builds the server command line.
     *
     * @param binary    resolved binary path
     * @param modelPath model file or directory
     * @param port      allocated loopback port
     * @param options   start options
     */
    protected abstract List<String> buildCommand(Path binary, Path modelPath, int port, ServerStartOptions options);

    /**
     * Readiness probe, polled every {@link #READINESS_POLL_INTERVAL} during startup.
     */
    protected abstract boolean isReady(ServerHandle server);

    /**
     * Background health probe. Called only while the process is alive.
     */
    protected abstract boolean checkHealth(ServerHandle server);

    /**
     * Sends one request to the server.
     *
     * @param pcm 16 kHz 16-bit mono PCM
     * @return decoded text (may be empty)
     * @throws TranscriptionException on protocol or transport failure
     */
    protected abstract String doTranscribe(ServerHandle server, byte[] pcm, InferenceOptions options);

    /**
     * Observes every stdout/stderr line during the lifetime of the process. Used by servers that
     * announce readiness on their console.
     *
     * @return true if the line marks the server as ready
     */
    protected boolean isReadyLine(String line) {
        return false;
    }

    /**
     * Synthetic request sent once startup has completed so the first real request does not pay for lazy
     * initialisation. Failures are logged and ignored.
     */
    protected void warmUp(ServerHandle server) {
        doTranscribe(server, AudioFormat.silence(Duration.ofSeconds(1), AudioFormat.REQUIRED_SAMPLE_RATE),
                InferenceOptions.defaults());
    }

    // ---------------------------------------------------------------- public API

    /**
     * Starts (or reuses) the server for the given model.
     *
     * @return future completed once the server is ready, or exceptionally with a
     *         {@link TranscriptionException} / {@link ModelNotFoundException}
     */
    public CompletableFuture<Void> start(Path modelPath, ServerStartOptions options) {
        Objects.requireNonNull(modelPath, "modelPath");
        ServerStartOptions opts = options == null ? ServerStartOptions.defaults() : options;
        synchronized (lock) {
            if (startFuture != null && !startFuture.isDone()) {
                if (modelPath.equals(startingModel) && opts.equals(startingOptions)) {
                    return startFuture;
                }
                LOG.info("{} server start for another model requested during startup; restarting afterwards",
                        backend);
                return startFuture.handle((ignored, err) -> null)
                        .thenCompose(ignored -> start(modelPath, opts));
            }
            if (state.isServing() && running != null
                    && running.modelPath().equals(modelPath) && running.options().equals(opts)) {
                return CompletableFuture.completedFuture(null);
            }
            long myEpoch = ++epoch;
            CompletableFuture<Void> future = new CompletableFuture<>();
            startFuture = future;
            startingModel = modelPath;
            startingOptions = opts;
            try {
                scheduler.execute(ThreadPoolConfig.mdcPropagatingDecorator()
                        .decorate(() -> runStartup(myEpoch, modelPath, opts, future)));
            } catch (RejectedExecutionException e) {
                startFuture = null;
                future.completeExceptionally(error("Server executor is shut down")
                        .errorCode(ErrorCode.NOT_READY).cause(e).build());
            }
            return future;
        }
    }

    /**
     * Runs one transcription against the running server.
     *
     * @throws TranscriptionException with {@link ErrorCode#NOT_READY} unless the server is
     *         {@code READY} or {@code DEGRADED}
     */
    public TranscriptionResult transcribe(byte[] pcm, InferenceOptions options) {
        Objects.requireNonNull(pcm, "pcm");
        ServerHandle server;
        synchronized (lock) {
            if (!state.isServing() || running == null) {
                throw error("Server not ready (state=" + state + ")").errorCode(ErrorCode.NOT_READY).build();
            }
            server = running;
        }
        long startNanos = System.nanoTime();
        try {
            String text = doTranscribe(server, pcm, options == null ? InferenceOptions.defaults() : options);
            long elapsed = System.nanoTime() - startNanos;
            metrics.recordTranscriptionLatency(backend, elapsed);
            LOG.debug("{} transcription done in {}ms, length={}", backend, TimeUtils.nanosToMillis(elapsed),
                    text.length());
            return TranscriptionResult.of(text, TimeUtils.nanosToMillis(elapsed), backend);
        } catch (TranscriptionException e) {
            metrics.incrementTranscriptionFailure(backend, e.getErrorCode().name());
            throw e;
        }
    }

    /**
     * Stops the server. Cancels an in-flight startup. Always completes.
     */
    public void stop() {
        ServerHandle server;
        synchronized (lock) {
            epoch++;
            startFuture = null;
            cancelHealthCheck();
            server = running;
            running = null;
            if (state != ServerProcessState.STOPPED) {
                transition(ServerProcessState.STOPPED, "stop requested");
            }
        }
        flushEvents();
        if (server != null) {
            terminate(server);
            LOG.info("{} server on port {} stopped", backend, server.port());
        }
    }

    public ServerProcessState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isServing() {
        synchronized (lock) {
            return state.isServing();
        }
    }

    public ServerStatus getStatus() {
        synchronized (lock) {
            ServerHandle server = running;
            return new ServerStatus(backend, isBinaryAvailable(), state,
                    server == null ? -1 : server.port(),
                    server == null ? null : server.modelPath().toString(),
                    server != null && server.gpu());
        }
    }

    public boolean isBinaryAvailable() {
        return Files.isExecutable(Path.of(settings.binaryPath()));
    }

    protected final InferenceServerSettings settings() {
        return settings;
    }

    // ---------------------------------------------------------------- startup

    private void runStartup(long myEpoch, Path modelPath, ServerStartOptions options,
                            CompletableFuture<Void> future) {
        ServerHandle server;
        try {
            server = startBlocking(myEpoch, modelPath, options);
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
            return;
        }
        future.complete(null);
        if (settings.warmupEnabled()) {
            warmUpQuietly(server);
        }
    }

    private void warmUpQuietly(ServerHandle server) {
        long warmStart = System.nanoTime();
        try {
            warmUp(server);
            LOG.debug("{} warm-up inference done in {}ms", backend, TimeUtils.elapsedMillis(warmStart));
        } catch (RuntimeException e) {
            LOG.warn("{} warm-up inference failed (ignored): {}", backend, e.getMessage());
        }
    }

    private ServerHandle startBlocking(long myEpoch, Path modelPath, ServerStartOptions options) {
        if (!Files.exists(modelPath)) {
            throw new ModelNotFoundException(modelPath.toString());
        }

        ServerHandle previous;
        synchronized (lock) {
            checkCurrent(myEpoch);
            cancelHealthCheck();
            previous = running;
            running = null;
            if (previous != null || state == ServerProcessState.CRASHED) {
                transition(ServerProcessState.STOPPED, previous != null ? "restarting with new model" : "restart");
            }
            transition(ServerProcessState.STARTING, "starting " + modelPath.getFileName());
        }
        flushEvents();
        if (previous != null) {
            terminate(previous);
        }

        ServerHandle server;
        try {
            server = launchWithFallback(myEpoch, modelPath, options);
        } catch (RuntimeException e) {
            synchronized (lock) {
                if (epoch == myEpoch && state == ServerProcessState.STARTING) {
                    transition(ServerProcessState.STOPPED, "startup failed");
                }
            }
            flushEvents();
            throw e;
        }

        boolean superseded;
        synchronized (lock) {
            superseded = epoch != myEpoch;
            if (!superseded) {
                running = server;
                transition(ServerProcessState.READY, "listening on port " + server.port());
                long interval = settings.healthIntervalSeconds();
                healthTask = scheduler.scheduleWithFixedDelay(ThreadPoolConfig.mdcPropagatingDecorator()
                                .decorate(() -> runHealthCheck(myEpoch, server)),
                        interval, interval, TimeUnit.SECONDS);
            }
        }
        if (superseded) {
            terminate(server);
            throw error("Startup superseded").errorCode(ErrorCode.CANCELLED).build();
        }
        flushEvents();
        server.process().onExit().thenRun(() -> onProcessExit(myEpoch, server));
        LOG.info("{} server ready on port {} ({}, model={})", backend, server.port(),
                server.gpu() ? "gpu" : "cpu", modelPath.getFileName());
        return server;
    }

    private ServerHandle launchWithFallback(long myEpoch, Path modelPath, ServerStartOptions options) {
        if (!settings.hasGpuBinary()) {
            return launch(myEpoch, Path.of(settings.binaryPath()), modelPath, options, false, new LaunchAttempt());
        }
        LaunchAttempt gpuAttempt = new LaunchAttempt();
        try {
            return launch(myEpoch, Path.of(settings.gpuBinaryPath()), modelPath, options, true, gpuAttempt);
        } catch (TranscriptionException e) {
            boolean earlyExit = gpuAttempt.exitedAfterMs >= 0
                    && gpuAttempt.exitedAfterMs < TimeUnit.SECONDS.toMillis(settings.gpuEarlyExitSeconds());
            if (!earlyExit || e.isCancellation()) {
                throw e;
            }
            LOG.warn("{} GPU server exited after {}ms; falling back to CPU binary", backend,
                    gpuAttempt.exitedAfterMs);
            metrics.incrementGpuFallback(backend);
            publisher.publishEvent(new GpuFallbackEvent(backend, settings.gpuBinaryPath(), e.getMessage(),
                    Instant.now()));
            return launch(myEpoch, Path.of(settings.binaryPath()), modelPath, options, false, new LaunchAttempt());
        }
    }

    private ServerHandle launch(long myEpoch, Path binary, Path modelPath, ServerStartOptions options,
                                boolean gpu, LaunchAttempt attempt) {
        int port = PortAllocator.findFreePort(settings.portRangeStart(), settings.portRangeEnd(), backend);
        List<String> command = buildCommand(binary.toAbsolutePath(), modelPath.toAbsolutePath(), port, options);
        long startNanos = System.nanoTime();
        Process process;
        try {
            process = processFactory.start(command, binary.toAbsolutePath().getParent());
        } catch (IOException e) {
            attempt.exitedAfterMs = TimeUtils.elapsedMillis(startNanos);
            throw error("Failed to spawn server binary")
                    .cause(e)
                    .metadata("binaryPath", binary)
                    .build();
        }
        LOG.info("Spawned {} server (pid={}, port={}, gpu={})", backend, safePid(process), port, gpu);

        AtomicBoolean readyMarker = new AtomicBoolean(false);
        StreamGobbler out = new StreamGobbler(process.getInputStream(), backend + "-server-out",
                settings.maxStderrBytes(), line -> observeLine(line, readyMarker));
        StreamGobbler err = new StreamGobbler(process.getErrorStream(), backend + "-server-err",
                settings.maxStderrBytes(), line -> observeLine(line, readyMarker));
        Thread outThread = out.start();
        Thread errThread = err.start();
        ServerHandle server = new ServerHandle(process, port, modelPath, options, gpu, out, err, readyMarker);

        long deadline = startNanos + TimeUnit.SECONDS.toNanos(settings.startupTimeoutSeconds());
        while (true) {
            if (!process.isAlive()) {
                attempt.exitedAfterMs = TimeUtils.elapsedMillis(startNanos);
                ProcessTerminator.joinQuietly(errThread, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                ProcessTerminator.joinQuietly(outThread, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                int exitCode = process.exitValue();
                String stderr = err.snippet(ERROR_SNIPPET_MAX_CHARS).trim();
                String message = stderr.isEmpty()
                        ? "Server exited with code " + exitCode + " before becoming ready"
                        : "Server exited before becoming ready: " + stderr;
                throw error(message)
                        .exitCode(exitCode)
                        .durationMs(attempt.exitedAfterMs)
                        .metadata("binaryPath", binary)
                        .build();
            }
            if (!isCurrent(myEpoch)) {
                ProcessTerminator.terminate(process);
                throw error("Startup cancelled").errorCode(ErrorCode.CANCELLED).build();
            }
            if (probeReady(server)) {
                return server;
            }
            if (System.nanoTime() - deadline > 0) {
                ProcessTerminator.terminate(process);
                throw error("Server not ready after " + settings.startupTimeoutSeconds() + "s")
                        .durationMs(TimeUtils.elapsedMillis(startNanos))
                        .metadata("binaryPath", binary)
                        .metadata("stderr", err.snippet(ERROR_SNIPPET_MAX_CHARS).trim())
                        .build();
            }
            try {
                Thread.sleep(READINESS_POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ProcessTerminator.terminate(process);
                throw error("Interrupted during startup").errorCode(ErrorCode.CANCELLED).cause(e).build();
            }
        }
    }

    private void observeLine(String line, AtomicBoolean readyMarker) {
        LOG.trace("[{}-server] {}", backend, line);
        if (!readyMarker.get() && isReadyLine(line)) {
            readyMarker.set(true);
        }
    }

    private boolean probeReady(ServerHandle server) {
        try {
            return isReady(server);
        } catch (RuntimeException e) {
            LOG.trace("{} readiness probe failed: {}", backend, e.toString());
            return false;
        }
    }

    // ---------------------------------------------------------------- supervision

    private void runHealthCheck(long myEpoch, ServerHandle server) {
        if (!isCurrent(myEpoch)) {
            return;
        }
        if (!server.process().isAlive()) {
            onProcessExit(myEpoch, server);
            return;
        }
        boolean healthy;
        try {
            healthy = checkHealth(server);
        } catch (RuntimeException e) {
            LOG.debug("{} health check error: {}", backend, e.toString());
            healthy = false;
        }
        synchronized (lock) {
            if (epoch != myEpoch || running != server) {
                return;
            }
            if (healthy && state == ServerProcessState.DEGRADED) {
                transition(ServerProcessState.READY, "health check recovered");
            } else if (!healthy && state == ServerProcessState.READY) {
                transition(ServerProcessState.DEGRADED, "health check failed");
            }
        }
        flushEvents();
    }

    private void onProcessExit(long myEpoch, ServerHandle server) {
        synchronized (lock) {
            if (epoch != myEpoch || running != server) {
                return;
            }
            cancelHealthCheck();
            running = null;
            String reason = "process exited with code " + safeExitCode(server.process());
            String stderr = server.stderr().snippet(ERROR_SNIPPET_MAX_CHARS).trim();
            transition(ServerProcessState.CRASHED, stderr.isEmpty() ? reason : reason + ": " + stderr);
        }
        flushEvents();
    }

    // ---------------------------------------------------------------- helpers

    /** Caller holds lock. */
    private void transition(ServerProcessState next, String reason) {
        ServerProcessState previous = state;
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException(backend + " server cannot move from " + previous + " to " + next);
        }
        state = next;
        outbox.add(new ServerStateChangedEvent(backend, previous, next, reason, Instant.now()));
    }

    private void flushEvents() {
        List<ServerStateChangedEvent> pending;
        synchronized (lock) {
            if (outbox.isEmpty()) {
                return;
            }
            pending = new ArrayList<>(outbox);
            outbox.clear();
        }
        pending.forEach(publisher::publishEvent);
    }

    /** Caller holds lock. */
    private void cancelHealthCheck() {
        if (healthTask != null) {
            healthTask.cancel(false);
            healthTask = null;
        }
    }

    private boolean isCurrent(long myEpoch) {
        synchronized (lock) {
            return epoch == myEpoch;
        }
    }

    /** Caller holds lock. */
    private void checkCurrent(long myEpoch) {
        if (epoch != myEpoch) {
            throw error("Startup superseded").errorCode(ErrorCode.CANCELLED).build();
        }
    }

    private void terminate(ServerHandle server) {
        ProcessTerminator.terminate(server.process());
    }

    /**
     * Starts an exception builder carrying this server's backend name.
     */
    protected final TranscriptionExceptionBuilder error(String message) {
        return TranscriptionExceptionBuilder.create(message).backend(backend);
    }

    private static String safePid(Process process) {
        try {
            return String.valueOf(process.pid());
        } catch (UnsupportedOperationException e) {
            return "n/a";
        }
    }

    private static String safeExitCode(Process process) {
        try {
            return String.valueOf(process.exitValue());
        } catch (IllegalThreadStateException e) {
            return "unknown";
        }
    }

    private static final class LaunchAttempt {
        private long exitedAfterMs = -1;
    }

    /**
     * A spawned server process and what it was started with.
     *
     * @param process     child process
     * @param port        loopback port the server listens on
     * @param modelPath   loaded model
     * @param options     start options
     * @param gpu         whether this is the GPU binary
     * @param stdout      stdout reader
     * @param stderr      stderr reader (diagnostics)
     * @param readyMarker set once {@link #isReadyLine} matched a console line
     */
    protected record ServerHandle(
            Process process,
            int port,
            Path modelPath,
            ServerStartOptions options,
            boolean gpu,
            StreamGobbler stdout,
            StreamGobbler stderr,
            AtomicBoolean readyMarker
    ) {
        public boolean readyMarkerSeen() {
            return readyMarker.get();
        }
    }
}
