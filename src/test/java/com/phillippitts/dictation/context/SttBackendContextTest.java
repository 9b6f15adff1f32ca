package com.phillippitts.dictation.context;

import com.phillippitts.dictation.config.ThreadPoolConfig;
import com.phillippitts.dictation.config.ThreadPoolProperties;
import com.phillippitts.dictation.config.provision.ProvisioningProperties;
import com.phillippitts.dictation.domain.BackendFamily;
import com.phillippitts.dictation.domain.ConnectionState;
import com.phillippitts.dictation.domain.ServerProcessState;
import com.phillippitts.dictation.exception.DictationBackendException;
import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.exception.ModelNotFoundException;
import com.phillippitts.dictation.service.provision.ModelCatalog;
import com.phillippitts.dictation.service.provision.ModelDescriptor;
import com.phillippitts.dictation.service.provision.ModelProvisioner;
import com.phillippitts.dictation.service.stt.local.ServerStartOptions;
import com.phillippitts.dictation.service.stt.local.ServerStatus;
import com.phillippitts.dictation.service.stt.local.parakeet.ParakeetServerManager;
import com.phillippitts.dictation.service.stt.local.whisper.WhisperServerManager;
import com.phillippitts.dictation.service.stt.streaming.StreamingSession;
import com.phillippitts.dictation.service.stt.streaming.StreamingStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SttBackendContextTest {

    private static final Path CACHE_ROOT = Paths.get("/tmp/dictation-models");
    private static final ModelDescriptor BASE = new ModelDescriptor("base", BackendFamily.WHISPER,
            URI.create("https://example.com/ggml-base.bin"), "ggml-base.bin", 147_951_465L, false, null, List.of());

    private StreamingSession streaming;
    private WhisperServerManager whisper;
    private ParakeetServerManager parakeet;
    private ModelProvisioner provisioner;
    private ModelCatalog catalog;
    private ThreadPoolTaskExecutor executor;
    private ProvisioningProperties properties;

    @BeforeEach
    void setUp() {
        streaming = mock(StreamingSession.class);
        whisper = mock(WhisperServerManager.class);
        parakeet = mock(ParakeetServerManager.class);
        provisioner = mock(ModelProvisioner.class);
        catalog = mock(ModelCatalog.class);
        when(provisioner.catalog()).thenReturn(catalog);
        when(provisioner.getCacheRoot()).thenReturn(CACHE_ROOT);
        when(catalog.require(BackendFamily.WHISPER, "base")).thenReturn(BASE);
        when(catalog.require(BackendFamily.WHISPER, "missing"))
                .thenThrow(new ModelNotFoundException("whisper/missing"));
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).provisionExecutor();
        properties = new ProvisioningProperties();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private SttBackendContext context(ThreadPoolTaskExecutor taskExecutor) {
        return new SttBackendContext(streaming, whisper, parakeet, provisioner, taskExecutor, properties);
    }

    @Test
    void initializeSweepsStaleDownloadsWhenEnabled() {
        when(provisioner.sweepStaleDownloads()).thenReturn(2);

        context(executor).initialize();

        verify(provisioner).sweepStaleDownloads();
    }

    @Test
    void initializeSkipsSweepWhenDisabled() {
        properties.setSweepOnStartup(false);

        context(executor).initialize();

        verify(provisioner, never()).sweepStaleDownloads();
    }

    @Test
    void shutdownCancelsDownloadsThenStopsServersThenStreaming() {
        context(executor).shutdown();

        InOrder order = inOrder(provisioner, whisper, parakeet, streaming);
        order.verify(provisioner).cancelAllDownloads();
        order.verify(whisper).stop();
        order.verify(parakeet).stop();
        order.verify(streaming).shutdown();
    }

    @Test
    void serverLookupByBackend() {
        SttBackendContext context = context(executor);

        assertThat(context.server(BackendFamily.WHISPER)).isSameAs(whisper);
        assertThat(context.server(BackendFamily.PARAKEET)).isSameAs(parakeet);
        assertThat(context.streaming()).isSameAs(streaming);
        assertThat(context.provisioner()).isSameAs(provisioner);
    }

    @Test
    void startServerRejectsModelThatIsNotInstalled() {
        when(provisioner.isInstalled(BASE)).thenReturn(false);

        assertThatThrownBy(() -> context(executor)
                .startServer(BackendFamily.WHISPER, "base", ServerStartOptions.defaults()))
                .isInstanceOf(ModelNotFoundException.class)
                .hasMessageContaining("ggml-base.bin");
        verify(whisper, never()).start(any(), any());
    }

    @Test
    void startServerPassesInstalledPathToServer() {
        when(provisioner.isInstalled(BASE)).thenReturn(true);
        when(whisper.start(any(), any())).thenReturn(CompletableFuture.completedFuture(null));
        ServerStartOptions options = ServerStartOptions.defaults();

        context(executor).startServer(BackendFamily.WHISPER, "base", options);

        verify(whisper).start(CACHE_ROOT.resolve("whisper").resolve("base").resolve("ggml-base.bin"), options);
    }

    @Test
    void downloadModelRunsOnProvisionExecutor() throws Exception {
        Path installed = CACHE_ROOT.resolve("whisper/base/ggml-base.bin");
        when(provisioner.ensureModel(eq(BackendFamily.WHISPER), eq("base"), any(), any())).thenAnswer(invocation -> {
            assertThat(Thread.currentThread().getName()).startsWith("provision-");
            return installed;
        });

        Path result = context(executor).downloadModel(BackendFamily.WHISPER, "base").get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo(installed);
    }

    @Test
    void downloadModelRejectsUnknownModelImmediately() {
        assertThatThrownBy(() -> context(executor).downloadModel(BackendFamily.WHISPER, "missing"))
                .isInstanceOf(ModelNotFoundException.class);
        verify(provisioner, never()).ensureModel(any(), any(), any(), any());
    }

    @Test
    void downloadModelReportsFullQueueAsResourceExhausted() {
        ThreadPoolTaskExecutor saturated = mock(ThreadPoolTaskExecutor.class);
        doThrow(new TaskRejectedException("queue full")).when(saturated).execute(any(Runnable.class));

        DictationBackendException ex = catchThrowableOfType(
                () -> context(saturated).downloadModel(BackendFamily.WHISPER, "base"),
                DictationBackendException.class);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.RESOURCE_EXHAUSTED);
    }

    @Test
    void statusCombinesStreamingAndServers() {
        StreamingStatus streamingStatus = new StreamingStatus(ConnectionState.COLD, null, false, false, 0);
        ServerStatus whisperStatus = new ServerStatus("whisper", true, ServerProcessState.READY, 8178, "m", false);
        ServerStatus parakeetStatus = new ServerStatus("parakeet", false, ServerProcessState.STOPPED, -1, null, false);
        when(streaming.getStatus()).thenReturn(streamingStatus);
        when(whisper.getStatus()).thenReturn(whisperStatus);
        when(parakeet.getStatus()).thenReturn(parakeetStatus);

        SttBackendContext.BackendStatus status = context(executor).status();

        assertThat(status.streaming()).isEqualTo(streamingStatus);
        assertThat(status.servers()).containsExactly(whisperStatus, parakeetStatus);
    }
}
