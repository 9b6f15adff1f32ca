package com.phillippitts.dictation.service.provision;

import com.phillippitts.dictation.config.provision.ProvisioningProperties;
import com.phillippitts.dictation.service.cancel.CancellationToken;
import com.phillippitts.dictation.service.process.ProcessFactory;
import com.phillippitts.dictation.service.process.ProcessTerminator;
import com.phillippitts.dictation.service.process.StreamGobbler;
import com.phillippitts.dictation.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Extracts {@code tar.bz2} model archives with the system {@code tar}. A failed attempt is retried
 * once with a clean target directory.
 */
@Component
public class ArchiveExtractor {

    private static final Logger LOG = LogManager.getLogger(ArchiveExtractor.class);

    private static final int STDERR_MAX_BYTES = 16 * 1024;
    private static final long WAIT_SLICE_MS = 200;

    private final ProcessFactory processFactory;
    private final ProvisioningProperties properties;

    public ArchiveExtractor(ProcessFactory processFactory, ProvisioningProperties properties) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Extracts the archive into {@code targetDir}, creating it.
     *
     * @throws IOException when every attempt failed
     */
    public void extract(Path archive, Path targetDir, CancellationToken token) throws IOException {
        int attempts = properties.getExtractionAttempts();
        IOException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            token.throwIfCancelled("Extraction");
            FileTrees.deleteRecursively(targetDir);
            Files.createDirectories(targetDir);
            try {
                runTar(archive, targetDir, token);
                LOG.info("Extracted {} into {}", archive.getFileName(), targetDir);
                return;
            } catch (IOException e) {
                last = e;
                LOG.warn("Extraction attempt {}/{} failed: {}", attempt, attempts, e.getMessage());
            }
        }
        throw last != null ? last : new IOException("Extraction not attempted");
    }

    private void runTar(Path archive, Path targetDir, CancellationToken token) throws IOException {
        List<String> command = List.of("tar", "-xjf", archive.toAbsolutePath().toString(),
                "-C", targetDir.toAbsolutePath().toString());
        Process process = processFactory.start(command, targetDir);
        StreamGobbler stdout = new StreamGobbler(process.getInputStream(), "tar-stdout", STDERR_MAX_BYTES, null);
        StreamGobbler stderr = new StreamGobbler(process.getErrorStream(), "tar-stderr", STDERR_MAX_BYTES, null);
        Thread outThread = stdout.start();
        Thread errThread = stderr.start();
        try (CancellationToken.Registration ignored = token.onCancel(process::destroyForcibly)) {
            long deadline = System.nanoTime() + ProcessTimeouts.HELPER_PROCESS_TIMEOUT.toNanos();
            while (!process.waitFor(WAIT_SLICE_MS, TimeUnit.MILLISECONDS)) {
                token.throwIfCancelled("Extraction");
                if (System.nanoTime() > deadline) {
                    throw new IOException("tar timed out after " + ProcessTimeouts.HELPER_PROCESS_TIMEOUT.toMinutes() + " min");
                }
            }
            token.throwIfCancelled("Extraction");
            int exit = process.exitValue();
            if (exit != 0) {
                ProcessTerminator.joinQuietly(errThread, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
                String detail = stderr.snippet(200);
                throw new IOException("tar exited with code " + exit + (detail.isBlank() ? "" : ": " + detail));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while extracting " + archive.getFileName(), e);
        } finally {
            if (process.isAlive()) {
                ProcessTerminator.terminate(process);
            }
            ProcessTerminator.joinQuietly(outThread, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
            ProcessTerminator.joinQuietly(errThread, ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        }
    }
}
