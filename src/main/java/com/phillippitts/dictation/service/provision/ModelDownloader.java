package com.phillippitts.dictation.service.provision;

import com.phillippitts.dictation.config.provision.ProvisioningProperties;
import com.phillippitts.dictation.exception.DownloadException;
import com.phillippitts.dictation.exception.DownloadFailure;
import com.phillippitts.dictation.exception.OperationCancelledException;
import com.phillippitts.dictation.service.cancel.CancellationToken;
import com.phillippitts.dictation.service.metrics.BackendMetrics;
import com.phillippitts.dictation.service.retry.RetryPolicy;
import com.phillippitts.dictation.util.LogSanitizer;
import com.phillippitts.dictation.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.HttpURLConnection;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URL;
import java.net.UnknownHostException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resumable HTTP downloader for model artifacts.
 *
 * <p>Bytes are written to {@code <destination>.tmp}. An existing temp file is resumed with a
 * {@code Range} request; a server answering {@code 200} instead of {@code 206} restarts the file
 * from byte zero. Redirects are followed manually so the hop limit is enforced. A read idle for the
 * stall window fails as {@link DownloadFailure#TIMEOUT}. Transport failures are retried through
 * {@link RetryPolicy}; HTTP status failures and cancellation are not.
 *
 * <p>On success the temp file is moved into place atomically (copy and delete across file stores).
 * Any final failure, cancellation included, deletes the temp file.
 *
 * <p><b>Thread Safety:</b> stateless between calls; concurrent downloads must use distinct
 * destinations.
 */
@Component
public class ModelDownloader {

    private static final Logger LOG = LogManager.getLogger(ModelDownloader.class);

    static final String TEMP_SUFFIX = ".tmp";

    private static final int BUFFER_SIZE = 64 * 1024;
    private static final Pattern CONTENT_RANGE_TOTAL = Pattern.compile("/(\\d+)\\s*$");

    private final ProvisioningProperties properties;
    private final DiskSpaceChecker diskSpaceChecker;
    private final BackendMetrics metrics;
    private final RetryPolicy retryPolicy;

    public ModelDownloader(ProvisioningProperties properties, DiskSpaceChecker diskSpaceChecker,
                           BackendMetrics metrics) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.diskSpaceChecker = Objects.requireNonNull(diskSpaceChecker, "diskSpaceChecker");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.retryPolicy = RetryPolicy.of(
                properties.getMaxRetries(),
                Duration.ofMillis(properties.getInitialBackoffMs()),
                Duration.ofMillis(properties.getMaxBackoffMs()),
                ModelDownloader::isRetryable);
    }

    /**
     * Downloads {@code url} to {@code destination}, blocking the calling thread.
     *
     * @param url         http or https source
     * @param destination final file path; parent directories are created
     * @param options     size hints, disk preflight and progress
     * @param token       cancellation token observed at every chunk and retry boundary
     * @return the destination path
     * @throws com.phillippitts.dictation.exception.InsufficientDiskSpaceException before any request
     * @throws DownloadException                 when the download fails
     * @throws OperationCancelledException       when cancelled
     */
    public Path download(URI url, Path destination, DownloadOptions options, CancellationToken token) {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(token, "token");

        Path directory = destination.toAbsolutePath().getParent();
        diskSpaceChecker.checkDiskSpace(directory, options.requiredFreeBytes());

        Path temp = tempPathFor(destination);
        String safeUrl = LogSanitizer.redactQuery(url.toString());
        long startNanos = System.nanoTime();
        LOG.info("Download starting: {} -> {}", safeUrl, destination);

        try {
            Files.createDirectories(directory);
            long bytes = retryPolicy.execute(
                    attempt -> attemptDownload(url, temp, options, token),
                    token,
                    (retryNumber, delay, cause) -> {
                        String failure = cause instanceof DownloadException de
                                ? de.getFailure().name() : "UNKNOWN";
                        metrics.incrementDownloadRetry(failure);
                        LOG.warn("Download attempt failed ({}), retry {} of {} in {}ms",
                                cause.getMessage(), retryNumber, retryPolicy.maxRetries(), delay.toMillis());
                    });
            moveIntoPlace(temp, destination);
            metrics.recordDownloadOutcome("success");
            LOG.info("Download complete: {} ({} bytes, {}ms)", destination, bytes,
                    TimeUtils.elapsedMillis(startNanos));
            return destination;
        } catch (OperationCancelledException e) {
            deleteQuietly(temp);
            metrics.recordDownloadOutcome("cancelled");
            LOG.info("Download cancelled: {}", safeUrl);
            throw e;
        } catch (IOException e) {
            deleteQuietly(temp);
            metrics.recordDownloadOutcome("failure");
            throw new DownloadException("Could not write " + destination + ": " + e.getMessage(),
                    DownloadFailure.IO, e);
        } catch (RuntimeException e) {
            deleteQuietly(temp);
            metrics.recordDownloadOutcome("failure");
            LOG.warn("Download failed: {}: {}", safeUrl, e.getMessage());
            throw e;
        }
    }

    static Path tempPathFor(Path destination) {
        return destination.resolveSibling(destination.getFileName() + TEMP_SUFFIX);
    }

    private long attemptDownload(URI url, Path temp, DownloadOptions options, CancellationToken token) {
        token.throwIfCancelled("Download");
        long offset = existingSize(temp);
        if (offset > 0) {
            LOG.info("Resuming download at byte {}", offset);
        }

        URL current = toUrl(url);
        for (int hops = 0; ; hops++) {
            if (hops > properties.getMaxRedirects()) {
                throw new DownloadException("Too many redirects (limit " + properties.getMaxRedirects() + ")",
                        DownloadFailure.TOO_MANY_REDIRECTS);
            }
            HttpURLConnection conn = open(current, offset);
            try (CancellationToken.Registration ignored = token.onCancel(conn::disconnect)) {
                int status = conn.getResponseCode();
                if (status >= 300 && status < 400) {
                    String location = conn.getHeaderField("Location");
                    if (location == null || location.isBlank()) {
                        throw new DownloadException("Redirect without Location header",
                                DownloadFailure.HTTP_STATUS, status, null);
                    }
                    current = new URL(current, location);
                    LOG.debug("Following redirect {} to {}", status, LogSanitizer.redactQuery(current.toString()));
                    continue;
                }
                if (status == HttpURLConnection.HTTP_OK || status == HttpURLConnection.HTTP_PARTIAL) {
                    return transfer(conn, status, offset, temp, options, token);
                }
                throw new DownloadException("HTTP " + status, DownloadFailure.HTTP_STATUS, status, null);
            } catch (IOException e) {
                if (token.isCancelled()) {
                    throw new OperationCancelledException("Download cancelled", e);
                }
                throw classify(e);
            } finally {
                conn.disconnect();
            }
        }
    }

    private HttpURLConnection open(URL url, long offset) {
        try {
            HttpURLConnection conn = (HttpURLConnection) url.openConnection();
            conn.setInstanceFollowRedirects(false);
            conn.setConnectTimeout(properties.getConnectTimeoutMs());
            conn.setReadTimeout(properties.getStallTimeoutMs());
            conn.setRequestProperty("User-Agent", properties.getUserAgent());
            if (offset > 0) {
                conn.setRequestProperty("Range", "bytes=" + offset + "-");
            }
            return conn;
        } catch (IOException e) {
            throw classify(e);
        }
    }

    private long transfer(HttpURLConnection conn, int status, long offset, Path temp,
                          DownloadOptions options, CancellationToken token) throws IOException {
        boolean append = status == HttpURLConnection.HTTP_PARTIAL && offset > 0;
        long downloaded = append ? offset : 0;
        long total;
        if (append) {
            total = totalFromContentRange(conn.getHeaderField("Content-Range"));
            if (total <= 0) {
                long length = conn.getContentLengthLong();
                total = length > 0 ? offset + length : 0;
            }
        } else {
            if (offset > 0) {
                LOG.info("Server ignored range request; restarting from byte 0");
            }
            total = Math.max(0, conn.getContentLengthLong());
        }
        if (total <= 0 && options.expectedSizeBytes() > 0) {
            total = options.expectedSizeBytes();
        }

        ProgressThrottle progress = new ProgressThrottle(options.progressListener(),
                Duration.ofMillis(properties.getProgressThrottleMs()));
        StandardOpenOption mode = append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING;

        try (InputStream in = conn.getInputStream();
             OutputStream out = Files.newOutputStream(temp, StandardOpenOption.CREATE,
                     StandardOpenOption.WRITE, mode)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                token.throwIfCancelled("Download");
                out.write(buffer, 0, read);
                downloaded += read;
                progress.update(downloaded, total);
            }
        }
        token.throwIfCancelled("Download");
        progress.complete(downloaded, total);

        if (total > 0 && downloaded < total) {
            throw new DownloadException("Download incomplete: received " + downloaded + " of " + total + " bytes",
                    DownloadFailure.INCOMPLETE);
        }
        return downloaded;
    }

    static long totalFromContentRange(String contentRange) {
        if (contentRange == null) {
            return 0;
        }
        Matcher matcher = CONTENT_RANGE_TOTAL.matcher(contentRange);
        return matcher.find() ? Long.parseLong(matcher.group(1)) : 0;
    }

    /**
     * Maps a transport exception to a download failure kind.
     */
    static DownloadException classify(IOException e) {
        DownloadFailure failure;
        String message = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (e instanceof SocketTimeoutException) {
            failure = DownloadFailure.TIMEOUT;
        } else if (e instanceof UnknownHostException) {
            failure = DownloadFailure.DNS;
        } else if (e instanceof ConnectException) {
            failure = DownloadFailure.CONNECTION_REFUSED;
        } else if (e instanceof SocketException && message.contains("reset")) {
            failure = DownloadFailure.CONNECTION_RESET;
        } else if (e instanceof EOFException || e instanceof SocketException
                || message.contains("premature eof")) {
            failure = DownloadFailure.PREMATURE_CLOSE;
        } else {
            failure = DownloadFailure.NETWORK;
        }
        return new DownloadException(failure.name().toLowerCase(Locale.ROOT) + ": " + e.getMessage(), failure, e);
    }

    private static boolean isRetryable(Throwable failure) {
        return failure instanceof DownloadException de && de.isRetryable();
    }

    private static URL toUrl(URI url) {
        try {
            return url.toURL();
        } catch (IOException | IllegalArgumentException e) {
            throw new DownloadException("Invalid download url: " + url, DownloadFailure.HTTP_STATUS, e);
        }
    }

    private static long existingSize(Path temp) {
        try {
            return Files.isRegularFile(temp) ? Files.size(temp) : 0;
        } catch (IOException e) {
            return 0;
        }
    }

    private static void moveIntoPlace(Path temp, Path destination) throws IOException {
        try {
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported, copying {} across file stores", destination);
            Files.copy(temp, destination, StandardCopyOption.REPLACE_EXISTING);
            Files.deleteIfExists(temp);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Could not delete temp file {}: {}", temp, e.toString());
        }
    }

    /**
     * Forwards at most one update per interval; {@link #complete} always forwards.
     */
    private static final class ProgressThrottle {
        private final DownloadProgressListener listener;
        private final long intervalNanos;
        private long lastNanos;
        private boolean emitted;

        ProgressThrottle(DownloadProgressListener listener, Duration interval) {
            this.listener = listener;
            this.intervalNanos = interval.toNanos();
        }

        void update(long downloaded, long total) {
            long now = System.nanoTime();
            if (!emitted || now - lastNanos >= intervalNanos) {
                emit(downloaded, total, now);
            }
        }

        void complete(long downloaded, long total) {
            emit(downloaded, total, System.nanoTime());
        }

        private void emit(long downloaded, long total, long now) {
            emitted = true;
            lastNanos = now;
            try {
                listener.onProgress(downloaded, total);
            } catch (RuntimeException e) {
                LOG.warn("Progress listener failed: {}", e.toString());
            }
        }
    }
}
