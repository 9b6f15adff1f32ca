package com.phillippitts.dictation.service.stt.local.whisper;

import com.phillippitts.dictation.config.stt.WhisperServerConfig;
import com.phillippitts.dictation.domain.BackendFamily;
import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.service.audio.AudioFormat;
import com.phillippitts.dictation.service.audio.WavWriter;
import com.phillippitts.dictation.service.metrics.BackendMetrics;
import com.phillippitts.dictation.service.process.ProcessFactory;
import com.phillippitts.dictation.service.stt.local.AbstractInferenceServer;
import com.phillippitts.dictation.service.stt.local.InferenceOptions;
import com.phillippitts.dictation.service.stt.local.ServerStartOptions;
import com.phillippitts.dictation.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Supervises a whisper.cpp HTTP server ({@code whisper-server}).
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} --model ${model} --host 127.0.0.1 --port ${port} [--threads ${n}] --language ${lang}
 * </pre>
 *
 * <p>Any HTTP answer on {@code /} counts as ready/healthy. Requests are
 * {@code POST /inference} multipart uploads of a 16 kHz mono WAV with {@code language},
 * optional {@code prompt} and {@code response_format=json}.
 */
@Component
public class WhisperServerManager extends AbstractInferenceServer {

    private static final Logger LOG = LogManager.getLogger(WhisperServerManager.class);

    private final WhisperServerConfig config;
    private final InferenceHttpClient httpClient;

    @Autowired
    public WhisperServerManager(WhisperServerConfig config,
                                ProcessFactory processFactory,
                                InferenceHttpClient httpClient,
                                @Qualifier("serverScheduler") ThreadPoolTaskScheduler serverScheduler,
                                ApplicationEventPublisher publisher,
                                BackendMetrics metrics) {
        this(config, processFactory, httpClient, serverScheduler.getScheduledExecutor(), publisher, metrics);
    }

    WhisperServerManager(WhisperServerConfig config,
                         ProcessFactory processFactory,
                         InferenceHttpClient httpClient,
                         ScheduledExecutorService scheduler,
                         ApplicationEventPublisher publisher,
                         BackendMetrics metrics) {
        super(BackendFamily.WHISPER.id(), config, processFactory, scheduler, publisher, metrics);
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    protected List<String> buildCommand(Path binary, Path modelPath, int port, ServerStartOptions options) {
        List<String> cmd = new ArrayList<>();
        cmd.add(binary.toString());
        cmd.add("--model");
        cmd.add(modelPath.toString());
        cmd.add("--host");
        cmd.add("127.0.0.1");
        cmd.add("--port");
        cmd.add(String.valueOf(port));

        int threads = options.threads() > 0 ? options.threads() : config.threads();
        if (threads > 0) {
            cmd.add("--threads");
            cmd.add(String.valueOf(threads));
        }
        // whisper.cpp defaults to English without --language; "auto" enables detection
        String language = options.language() != null && !options.language().isBlank()
                ? options.language() : config.language();
        cmd.add("--language");
        cmd.add(language);
        return cmd;
    }

    @Override
    protected boolean isReady(ServerHandle server) {
        return ping(server);
    }

    @Override
    protected boolean checkHealth(ServerHandle server) {
        return ping(server);
    }

    private boolean ping(ServerHandle server) {
        try {
            httpClient.get(baseUri(server).resolve("/"), Duration.ofSeconds(config.healthTimeoutSeconds()));
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    protected String doTranscribe(ServerHandle server, byte[] pcm, InferenceOptions options) {
        byte[] wav = WavWriter.toWav(pcm, AudioFormat.REQUIRED_SAMPLE_RATE);
        MultipartBody.Builder body = MultipartBody.builder()
                .file("file", "audio.wav", "audio/wav", wav)
                .field("language", options.languageOrAuto());
        if (options.prompt() != null && !options.prompt().isBlank()) {
            body.field("prompt", options.prompt());
        }
        body.field("response_format", "json");

        URI uri = baseUri(server).resolve("/inference");
        InferenceHttpClient.HttpResult result;
        try {
            result = httpClient.postMultipart(uri, body.build(), Duration.ofSeconds(config.requestTimeoutSeconds()));
        } catch (IOException e) {
            throw error("Inference request failed: " + e.getMessage())
                    .errorCode(ErrorCode.TRANSIENT)
                    .cause(e)
                    .build();
        }
        if (!result.isSuccess()) {
            throw error("Server returned status " + result.statusCode())
                    .errorCode(ErrorCode.HTTP_STATUS)
                    .metadata("body", LogSanitizer.truncate(result.body(), 200))
                    .build();
        }
        if (!WhisperJsonParser.isJsonObject(result.body())) {
            throw error("Failed to parse server response")
                    .errorCode(ErrorCode.PROTOCOL)
                    .metadata("body", LogSanitizer.truncate(result.body(), 200))
                    .build();
        }
        String text = WhisperJsonParser.extractText(result.body());
        LOG.debug("Whisper server returned {} chars for {}B of audio", text.length(), pcm.length);
        return text;
    }

    private static URI baseUri(ServerHandle server) {
        return URI.create("http://127.0.0.1:" + server.port());
    }
}
