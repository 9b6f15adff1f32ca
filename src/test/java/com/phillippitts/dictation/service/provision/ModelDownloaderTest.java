package com.phillippitts.dictation.service.provision;

import com.phillippitts.dictation.config.provision.ProvisioningProperties;
import com.phillippitts.dictation.exception.DownloadException;
import com.phillippitts.dictation.exception.DownloadFailure;
import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.exception.InsufficientDiskSpaceException;
import com.phillippitts.dictation.exception.OperationCancelledException;
import com.phillippitts.dictation.service.cancel.CancellationToken;
import com.phillippitts.dictation.service.metrics.BackendMetrics;
import com.phillippitts.dictation.testutil.ScriptedHttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class ModelDownloaderTest {

    @TempDir
    Path dir;

    private SimpleMeterRegistry registry;
    private ProvisioningProperties properties;
    private ScriptedHttpServer server;
    private byte[] content;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new ProvisioningProperties();
        properties.setMaxRetries(2);
        properties.setInitialBackoffMs(10);
        properties.setMaxBackoffMs(50);
        properties.setConnectTimeoutMs(2000);
        properties.setStallTimeoutMs(2000);
        properties.setMaxRedirects(2);
        properties.setProgressThrottleMs(0);
        content = new byte[200_000];
        new Random(42).nextBytes(content);
    }

    @AfterEach
    void tearDown() throws IOException {
        if (server != null) {
            server.close();
        }
    }

    private ModelDownloader downloader() {
        return downloader(Long.MAX_VALUE);
    }

    private ModelDownloader downloader(long freeBytes) {
        return new ModelDownloader(properties, new DiskSpaceChecker(d -> freeBytes), new BackendMetrics(registry));
    }

    private double outcomeCount(String outcome) {
        var counter = registry.find("dictation.backend.download.outcome").tag("outcome", outcome).counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void downloadsIntoDestinationAndRemovesTempFile() throws IOException {
        server = ScriptedHttpServer.start(ScriptedHttpServer.body(content));
        Path dest = dir.resolve("models/whisper/base/ggml-base.bin");

        Path result = downloader().download(server.uri("/ggml-base.bin"), dest,
                DownloadOptions.defaults(), new CancellationToken());

        assertThat(result).isEqualTo(dest);
        assertThat(Files.readAllBytes(dest)).isEqualTo(content);
        assertThat(ModelDownloader.tempPathFor(dest)).doesNotExist();
        assertThat(server.requests().get(0).header("User-Agent")).isEqualTo(properties.getUserAgent());
        assertThat(outcomeCount("success")).isEqualTo(1.0);
    }

    @Test
    void resumesExistingTempFileWithRangeRequest() throws IOException {
        server = ScriptedHttpServer.start(ScriptedHttpServer.rangeAware(content));
        Path dest = dir.resolve("model.bin");
        Files.write(ModelDownloader.tempPathFor(dest), Arrays.copyOf(content, 50_000));

        downloader().download(server.uri("/model.bin"), dest, DownloadOptions.defaults(), new CancellationToken());

        assertThat(server.requests().get(0).header("Range")).isEqualTo("bytes=50000-");
        assertThat(Files.readAllBytes(dest)).isEqualTo(content);
    }

    @Test
    void restartsFromZeroWhenServerIgnoresRange() throws IOException {
        server = ScriptedHttpServer.start(ScriptedHttpServer.body(content));
        Path dest = dir.resolve("model.bin");
        byte[] garbage = new byte[30_000];
        Arrays.fill(garbage, (byte) 7);
        Files.write(ModelDownloader.tempPathFor(dest), garbage);

        downloader().download(server.uri("/model.bin"), dest, DownloadOptions.defaults(), new CancellationToken());

        assertThat(server.requests().get(0).header("Range")).isEqualTo("bytes=30000-");
        assertThat(Files.readAllBytes(dest)).isEqualTo(content);
    }

    @Test
    void truncatedTransferIsRetriedAndResumed() throws IOException {
        int cut = 80_000;
        server = ScriptedHttpServer.start((request, out) -> {
            long offset = ScriptedHttpServer.rangeStart(request.header("Range"));
            if (offset == 0) {
                ScriptedHttpServer.writeHead(out, 200, Map.of("Content-Length", String.valueOf(content.length)));
                out.write(content, 0, cut);
                return;
            }
            ScriptedHttpServer.rangeAware(content).respond(request, out);
        });
        Path dest = dir.resolve("model.bin");

        downloader().download(server.uri("/model.bin"), dest, DownloadOptions.defaults(), new CancellationToken());

        assertThat(Files.readAllBytes(dest)).isEqualTo(content);
        assertThat(server.requestCount()).isEqualTo(2);
        assertThat(server.requests().get(1).header("Range")).isEqualTo("bytes=" + cut + "-");
        assertThat(registry.find("dictation.backend.download.retry").counter()).isNotNull();
        assertThat(registry.find("dictation.backend.download.retry").counter().count()).isEqualTo(1.0);
    }

    @Test
    void incompleteTransfersStopAfterRetryBudget() throws IOException {
        server = ScriptedHttpServer.start((request, out) -> {
            ScriptedHttpServer.writeHead(out, 200, Map.of("Content-Length", String.valueOf(content.length)));
            out.write(content, 0, 1000);
        });
        Path dest = dir.resolve("model.bin");

        DownloadException e = catchThrowableOfType(() -> downloader().download(server.uri("/model.bin"), dest,
                DownloadOptions.defaults(), new CancellationToken()), DownloadException.class);

        assertThat(e).isNotNull();
        assertThat(e.getFailure()).isIn(DownloadFailure.INCOMPLETE, DownloadFailure.PREMATURE_CLOSE);
        assertThat(e.isRetryable()).isTrue();
        assertThat(server.requestCount()).isEqualTo(3);
        assertThat(ModelDownloader.tempPathFor(dest)).doesNotExist();
        assertThat(outcomeCount("failure")).isEqualTo(1.0);
    }

    @Test
    void httpErrorStatusIsNotRetried() throws IOException {
        server = ScriptedHttpServer.start(ScriptedHttpServer.status(404));
        Path dest = dir.resolve("model.bin");

        DownloadException e = catchThrowableOfType(() -> downloader().download(server.uri("/missing"), dest,
                DownloadOptions.defaults(), new CancellationToken()), DownloadException.class);

        assertThat(e.getFailure()).isEqualTo(DownloadFailure.HTTP_STATUS);
        assertThat(e.getStatusCode()).isEqualTo(404);
        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.HTTP_STATUS);
        assertThat(server.requestCount()).isEqualTo(1);
        assertThat(dest).doesNotExist();
    }

    @Test
    void serverErrorStatusIsNotRetried() throws IOException {
        server = ScriptedHttpServer.start(ScriptedHttpServer.status(503));
        Path dest = dir.resolve("model.bin");
        Files.write(ModelDownloader.tempPathFor(dest), new byte[100]);

        DownloadException e = catchThrowableOfType(() -> downloader().download(server.uri("/model.bin"), dest,
                DownloadOptions.defaults(), new CancellationToken()), DownloadException.class);

        assertThat(e.getStatusCode()).isEqualTo(503);
        assertThat(server.requestCount()).isEqualTo(1);
        assertThat(ModelDownloader.tempPathFor(dest)).doesNotExist();
    }

    @Test
    void followsRedirects() throws IOException {
        server = ScriptedHttpServer.start((request, out) -> {
            if (request.path().equals("/model.bin")) {
                ScriptedHttpServer.body(content).respond(request, out);
            } else {
                ScriptedHttpServer.redirect("/model.bin").respond(request, out);
            }
        });
        Path dest = dir.resolve("model.bin");

        downloader().download(server.uri("/latest"), dest, DownloadOptions.defaults(), new CancellationToken());

        assertThat(Files.readAllBytes(dest)).isEqualTo(content);
        assertThat(server.requests()).extracting(ScriptedHttpServer.Request::path)
                .containsExactly("/latest", "/model.bin");
    }

    @Test
    void redirectLoopFailsAfterHopLimit() throws IOException {
        server = ScriptedHttpServer.start(ScriptedHttpServer.redirect("/loop"));
        Path dest = dir.resolve("model.bin");

        DownloadException e = catchThrowableOfType(() -> downloader().download(server.uri("/loop"), dest,
                DownloadOptions.defaults(), new CancellationToken()), DownloadException.class);

        assertThat(e.getFailure()).isEqualTo(DownloadFailure.TOO_MANY_REDIRECTS);
        assertThat(server.requestCount()).isEqualTo(properties.getMaxRedirects() + 1);
    }

    @Test
    void stalledTransferFailsAsTimeout() throws IOException {
        properties.setMaxRetries(0);
        properties.setStallTimeoutMs(200);
        server = ScriptedHttpServer.start((request, out) -> {
            ScriptedHttpServer.writeHead(out, 200, Map.of("Content-Length", String.valueOf(content.length)));
            out.write(content, 0, 1000);
            out.flush();
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        Path dest = dir.resolve("model.bin");

        DownloadException e = catchThrowableOfType(() -> downloader().download(server.uri("/model.bin"), dest,
                DownloadOptions.defaults(), new CancellationToken()), DownloadException.class);

        assertThat(e.getFailure()).isEqualTo(DownloadFailure.TIMEOUT);
        assertThat(e.isRetryable()).isTrue();
    }

    @Test
    void insufficientDiskSpaceIsRefusedBeforeAnyRequest() throws IOException {
        server = ScriptedHttpServer.start(ScriptedHttpServer.body(content));
        long mb = 1024L * 1024L;
        Path dest = dir.resolve("model.bin");

        InsufficientDiskSpaceException e = catchThrowableOfType(() -> downloader(50 * mb).download(
                server.uri("/model.bin"), dest, new DownloadOptions(0, 200 * mb, null), new CancellationToken()),
                InsufficientDiskSpaceException.class);

        assertThat(e.getShortfallBytes()).isEqualTo(150 * mb);
        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.RESOURCE_EXHAUSTED);
        assertThat(server.requestCount()).isZero();
    }

    @Test
    void cancellationAbortsTransferAndDeletesTempFile() throws IOException {
        byte[] large = new byte[4 * 1024 * 1024];
        server = ScriptedHttpServer.start(ScriptedHttpServer.body(large));
        Path dest = dir.resolve("model.bin");
        CancellationToken token = new CancellationToken();

        OperationCancelledException e = catchThrowableOfType(() -> downloader().download(server.uri("/model.bin"),
                dest, new DownloadOptions(0, 0, (downloaded, total) -> token.cancel()), token),
                OperationCancelledException.class);

        assertThat(e).isNotNull();
        assertThat(e.isCancellation()).isTrue();
        assertThat(ModelDownloader.tempPathFor(dest)).doesNotExist();
        assertThat(dest).doesNotExist();
        assertThat(outcomeCount("cancelled")).isEqualTo(1.0);
    }

    @Test
    void alreadyCancelledTokenIssuesNoRequest() throws IOException {
        server = ScriptedHttpServer.start(ScriptedHttpServer.body(content));
        CancellationToken token = new CancellationToken();
        token.cancel();

        catchThrowableOfType(() -> downloader().download(server.uri("/model.bin"), dir.resolve("model.bin"),
                DownloadOptions.defaults(), token), OperationCancelledException.class);

        assertThat(server.requestCount()).isZero();
    }

    @Test
    void progressEndsWithFinalUpdate() throws IOException {
        server = ScriptedHttpServer.start(ScriptedHttpServer.body(content));
        List<long[]> updates = new ArrayList<>();

        downloader().download(server.uri("/model.bin"), dir.resolve("model.bin"),
                new DownloadOptions(0, 0, (downloaded, total) -> updates.add(new long[]{downloaded, total})),
                new CancellationToken());

        assertThat(updates).isNotEmpty();
        assertThat(updates.get(updates.size() - 1)).containsExactly(content.length, content.length);
        for (int i = 1; i < updates.size(); i++) {
            assertThat(updates.get(i)[0]).isGreaterThanOrEqualTo(updates.get(i - 1)[0]);
        }
    }

    @Test
    void expectedSizeIsUsedWhenServerSendsNoLength() throws IOException {
        server = ScriptedHttpServer.start((request, out) -> {
            ScriptedHttpServer.writeHead(out, 200, Map.of());
            out.write(content);
        });
        List<Long> totals = new ArrayList<>();

        downloader().download(server.uri("/model.bin"), dir.resolve("model.bin"),
                new DownloadOptions(content.length, 0, (downloaded, total) -> totals.add(total)),
                new CancellationToken());

        assertThat(totals).containsOnly((long) content.length);
    }

    @Test
    void contentRangeTotalIsParsed() throws IOException {
        assertThat(ModelDownloader.totalFromContentRange("bytes 500-999/1000")).isEqualTo(1000);
        assertThat(ModelDownloader.totalFromContentRange("bytes */1000")).isEqualTo(1000);
        assertThat(ModelDownloader.totalFromContentRange("bytes 0-99/*")).isZero();
        assertThat(ModelDownloader.totalFromContentRange(null)).isZero();
    }

    @Test
    void transportFailuresAreClassified() throws IOException {
        assertThat(ModelDownloader.classify(new SocketTimeoutException("Read timed out")).getFailure())
                .isEqualTo(DownloadFailure.TIMEOUT);
        assertThat(ModelDownloader.classify(new UnknownHostException("huggingface.co")).getFailure())
                .isEqualTo(DownloadFailure.DNS);
        assertThat(ModelDownloader.classify(new ConnectException("Connection refused")).getFailure())
                .isEqualTo(DownloadFailure.CONNECTION_REFUSED);
        assertThat(ModelDownloader.classify(new SocketException("Connection reset")).getFailure())
                .isEqualTo(DownloadFailure.CONNECTION_RESET);
        assertThat(ModelDownloader.classify(new EOFException()).getFailure())
                .isEqualTo(DownloadFailure.PREMATURE_CLOSE);
        assertThat(ModelDownloader.classify(new IOException("Premature EOF")).getFailure())
                .isEqualTo(DownloadFailure.PREMATURE_CLOSE);
        assertThat(ModelDownloader.classify(new IOException("something else")).getFailure())
                .isEqualTo(DownloadFailure.NETWORK);
        assertThat(ModelDownloader.classify(new IOException("something else")).isRetryable()).isFalse();
    }
}
