package com.phillippitts.dictation.context;

import com.phillippitts.dictation.config.provision.ProvisioningProperties;
import com.phillippitts.dictation.domain.BackendFamily;
import com.phillippitts.dictation.exception.DictationBackendException;
import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.exception.ModelNotFoundException;
import com.phillippitts.dictation.service.cancel.CancellationToken;
import com.phillippitts.dictation.service.provision.DownloadProgressListener;
import com.phillippitts.dictation.service.provision.ModelDescriptor;
import com.phillippitts.dictation.service.provision.ModelProvisioner;
import com.phillippitts.dictation.service.stt.local.AbstractInferenceServer;
import com.phillippitts.dictation.service.stt.local.ServerStartOptions;
import com.phillippitts.dictation.service.stt.local.ServerStatus;
import com.phillippitts.dictation.service.stt.local.parakeet.ParakeetServerManager;
import com.phillippitts.dictation.service.stt.local.whisper.WhisperServerManager;
import com.phillippitts.dictation.service.stt.streaming.StreamingSession;
import com.phillippitts.dictation.service.stt.streaming.StreamingStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Owns the backend components for the lifetime of the application: the streaming session, the two
 * local inference servers and the model provisioner.
 *
 * <p>Lifecycle: stale downloads are swept once the context is constructed; on shutdown both
 * servers are stopped before the streaming session's loop is shut down.
 */
@Component
public class SttBackendContext {

    private static final Logger LOG = LogManager.getLogger(SttBackendContext.class);

    private final StreamingSession streamingSession;
    private final WhisperServerManager whisper;
    private final ParakeetServerManager parakeet;
    private final ModelProvisioner provisioner;
    private final ThreadPoolTaskExecutor provisionExecutor;
    private final ProvisioningProperties provisioningProperties;

    public SttBackendContext(StreamingSession streamingSession,
                             WhisperServerManager whisper,
                             ParakeetServerManager parakeet,
                             ModelProvisioner provisioner,
                             @Qualifier("provisionExecutor") ThreadPoolTaskExecutor provisionExecutor,
                             ProvisioningProperties provisioningProperties) {
        this.streamingSession = Objects.requireNonNull(streamingSession, "streamingSession");
        this.whisper = Objects.requireNonNull(whisper, "whisper");
        this.parakeet = Objects.requireNonNull(parakeet, "parakeet");
        this.provisioner = Objects.requireNonNull(provisioner, "provisioner");
        this.provisionExecutor = Objects.requireNonNull(provisionExecutor, "provisionExecutor");
        this.provisioningProperties = Objects.requireNonNull(provisioningProperties, "provisioningProperties");
    }

    @PostConstruct
    void initialize() {
        if (provisioningProperties.isSweepOnStartup()) {
            int removed = provisioner.sweepStaleDownloads();
            if (removed > 0) {
                LOG.info("Removed {} stale download artifacts", removed);
            }
        }
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down dictation backends");
        provisioner.cancelAllDownloads();
        whisper.stop();
        parakeet.stop();
        streamingSession.shutdown();
    }

    public StreamingSession streaming() {
        return streamingSession;
    }

    public ModelProvisioner provisioner() {
        return provisioner;
    }

    public AbstractInferenceServer server(BackendFamily backend) {
        return switch (backend) {
            case WHISPER -> whisper;
            case PARAKEET -> parakeet;
        };
    }

    /**
     * Starts a backend's server with an installed catalog model.
     *
     * @throws ModelNotFoundException when the model is unknown or not downloaded yet
     */
    public CompletableFuture<Void> startServer(BackendFamily backend, String modelId, ServerStartOptions options) {
        ModelDescriptor model = provisioner.catalog().require(backend, modelId);
        if (!provisioner.isInstalled(model)) {
            throw new ModelNotFoundException(model.installedPath(provisioner.getCacheRoot()).toString());
        }
        return server(backend).start(model.installedPath(provisioner.getCacheRoot()), options);
    }

    public void stopServer(BackendFamily backend) {
        server(backend).stop();
    }

    /**
     * Starts provisioning on the provisioning executor. Progress is logged; the returned future
     * completes with the installed path.
     */
    public CompletableFuture<Path> downloadModel(BackendFamily backend, String modelId) {
        provisioner.catalog().require(backend, modelId);
        CancellationToken token = new CancellationToken();
        ProgressLogger progress = new ProgressLogger(backend.id() + "/" + modelId);
        try {
            return CompletableFuture.supplyAsync(
                            () -> provisioner.ensureModel(backend, modelId, progress, token), provisionExecutor)
                    .whenComplete((path, error) -> {
                        if (error != null) {
                            Throwable cause = error.getCause() != null ? error.getCause() : error;
                            LOG.warn("Provisioning of {}/{} did not complete: {}", backend.id(), modelId,
                                    cause.getMessage());
                        }
                    });
        } catch (TaskRejectedException e) {
            throw new DictationBackendException("Too many downloads queued", ErrorCode.RESOURCE_EXHAUSTED, e);
        }
    }

    public BackendStatus status() {
        return new BackendStatus(streamingSession.getStatus(), List.of(whisper.getStatus(), parakeet.getStatus()));
    }

    /**
     * Combined snapshot served by the status endpoint.
     */
    public record BackendStatus(StreamingStatus streaming, List<ServerStatus> servers) {}

    /** Logs progress in 10% steps. */
    private static final class ProgressLogger implements DownloadProgressListener {
        private final String name;
        private int lastDecile = -1;

        ProgressLogger(String name) {
            this.name = name;
        }

        @Override
        public void onProgress(long downloadedBytes, long totalBytes) {
            if (totalBytes <= 0) {
                return;
            }
            int decile = (int) Math.min(10, downloadedBytes * 10 / totalBytes);
            if (decile != lastDecile) {
                lastDecile = decile;
                LOG.info("Downloading {}: {}%", name, decile * 10);
            }
        }
    }
}
