package com.phillippitts.dictation.service.stt.local.parakeet;

import com.phillippitts.dictation.config.stt.ParakeetServerConfig;
import com.phillippitts.dictation.domain.BackendFamily;
import com.phillippitts.dictation.exception.DictationBackendException;
import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.service.audio.AudioFormat;
import com.phillippitts.dictation.service.audio.PcmConverter;
import com.phillippitts.dictation.service.metrics.BackendMetrics;
import com.phillippitts.dictation.service.net.WebSocketChannel;
import com.phillippitts.dictation.service.net.WebSocketConnector;
import com.phillippitts.dictation.service.net.WebSocketListener;
import com.phillippitts.dictation.service.process.ProcessFactory;
import com.phillippitts.dictation.service.stt.local.AbstractInferenceServer;
import com.phillippitts.dictation.service.stt.local.InferenceOptions;
import com.phillippitts.dictation.service.stt.local.ServerStartOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Supervises a sherpa-onnx offline WebSocket server running a Parakeet transducer model.
 *
 * <p>CLI contract (model directory holds the four files):
 * <pre>
 * ${binary} --tokens=${dir}/tokens.txt --encoder=${dir}/encoder.int8.onnx
 *           --decoder=${dir}/decoder.int8.onnx --joiner=${dir}/joiner.int8.onnx
 *           --port=${port} --num-threads=${n}
 * </pre>
 *
 * <p>The server announces readiness with a {@code Listening on:} console line. Each request uses
 * a fresh socket: send the audio message, answer the result with {@code Done}, read the result
 * when the server closes.
 */
@Component
public class ParakeetServerManager extends AbstractInferenceServer {

    private static final Logger LOG = LogManager.getLogger(ParakeetServerManager.class);

    static final String READY_MARKER = "Listening on:";

    private final ParakeetServerConfig config;
    private final WebSocketConnector connector;

    @Autowired
    public ParakeetServerManager(ParakeetServerConfig config,
                                 ProcessFactory processFactory,
                                 WebSocketConnector connector,
                                 @Qualifier("serverScheduler") ThreadPoolTaskScheduler serverScheduler,
                                 ApplicationEventPublisher publisher,
                                 BackendMetrics metrics) {
        this(config, processFactory, connector, serverScheduler.getScheduledExecutor(), publisher, metrics);
    }

    ParakeetServerManager(ParakeetServerConfig config,
                          ProcessFactory processFactory,
                          WebSocketConnector connector,
                          ScheduledExecutorService scheduler,
                          ApplicationEventPublisher publisher,
                          BackendMetrics metrics) {
        super(BackendFamily.PARAKEET.id(), config, processFactory, scheduler, publisher, metrics);
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
    }

    @Override
    protected List<String> buildCommand(Path binary, Path modelDir, int port, ServerStartOptions options) {
        int threads = options.threads() > 0 ? options.threads() : config.threads();
        List<String> cmd = new ArrayList<>();
        cmd.add(binary.toString());
        cmd.add("--tokens=" + modelDir.resolve("tokens.txt"));
        cmd.add("--encoder=" + modelDir.resolve("encoder.int8.onnx"));
        cmd.add("--decoder=" + modelDir.resolve("decoder.int8.onnx"));
        cmd.add("--joiner=" + modelDir.resolve("joiner.int8.onnx"));
        cmd.add("--port=" + port);
        cmd.add("--num-threads=" + Math.max(1, threads));
        return cmd;
    }

    @Override
    protected boolean isReadyLine(String line) {
        return line.contains(READY_MARKER);
    }

    @Override
    protected boolean isReady(ServerHandle server) {
        return server.readyMarkerSeen();
    }

    @Override
    protected boolean checkHealth(ServerHandle server) {
        return server.process().isAlive();
    }

    @Override
    protected String doTranscribe(ServerHandle server, byte[] pcm, InferenceOptions options) {
        byte[] message = ParakeetMessageCodec.encode(AudioFormat.REQUIRED_SAMPLE_RATE,
                PcmConverter.pcm16ToFloat32(pcm));
        Duration timeout = Duration.ofSeconds(config.requestTimeoutSeconds());
        URI uri = URI.create("ws://127.0.0.1:" + server.port());

        CompletableFuture<String> response = new CompletableFuture<>();
        StringBuilder received = new StringBuilder();
        WebSocketListener listener = new WebSocketListener() {
            @Override
            public void onText(WebSocketChannel channel, String text) {
                synchronized (received) {
                    received.append(text);
                }
                channel.sendText(ParakeetMessageCodec.DONE);
            }

            @Override
            public void onClose(WebSocketChannel channel, int statusCode, String reason) {
                synchronized (received) {
                    response.complete(received.toString());
                }
            }

            @Override
            public void onError(WebSocketChannel channel, Throwable error) {
                response.completeExceptionally(error);
            }
        };

        long deadline = System.nanoTime() + timeout.toNanos();
        WebSocketChannel channel = null;
        try {
            channel = connector.connect(uri, Map.of(), timeout, listener)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            channel.sendBinary(message);
            long remaining = Math.max(0, deadline - System.nanoTime());
            String raw = response.get(remaining, TimeUnit.NANOSECONDS);
            String text = ParakeetMessageCodec.decodeText(raw);
            LOG.debug("Parakeet server returned {} chars for {}B of audio", text.length(), pcm.length);
            return text;
        } catch (TimeoutException e) {
            throw error("Transcription timed out after " + timeout.toSeconds() + "s")
                    .errorCode(ErrorCode.TRANSIENT)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw error("Interrupted while waiting for transcription")
                    .errorCode(ErrorCode.CANCELLED)
                    .cause(e)
                    .build();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ErrorCode code = cause instanceof DictationBackendException dbe ? dbe.getErrorCode() : ErrorCode.TRANSIENT;
            throw error("Transcription failed: " + cause.getMessage())
                    .errorCode(code)
                    .cause(cause)
                    .build();
        } finally {
            if (channel != null && channel.isOpen()) {
                channel.abort();
            }
        }
    }
}
