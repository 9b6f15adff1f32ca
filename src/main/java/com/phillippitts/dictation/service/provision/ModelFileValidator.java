package com.phillippitts.dictation.service.provision;

import com.phillippitts.dictation.exception.DownloadException;
import com.phillippitts.dictation.exception.DownloadFailure;
import com.phillippitts.dictation.exception.ModelInstallationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Post-download checks: plausible size and presence of required files.
 */
final class ModelFileValidator {

    private static final Logger LOG = LogManager.getLogger(ModelFileValidator.class);

    private static final long BYTES_PER_MB = 1_000_000L;

    private ModelFileValidator() {}

    /**
     * Deletes the file and throws when it is smaller than {@code expected * (1 - tolerance%)}.
     *
     * @return actual size in bytes
     */
    static long validateSize(String modelId, Path file, long expectedBytes, int tolerancePercent) {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new ModelInstallationException(modelId, "Downloaded file is unreadable: " + file, e);
        }
        if (expectedBytes <= 0) {
            return size;
        }
        long minimum = (long) (expectedBytes * (1 - tolerancePercent / 100.0));
        if (size < minimum) {
            deleteQuietly(file);
            String message = String.format("Download appears corrupted: file is %dMB, expected at least %dMB",
                    Math.round((double) size / BYTES_PER_MB), Math.round((double) minimum / BYTES_PER_MB));
            throw new ModelInstallationException(modelId, message,
                    new DownloadException(message, DownloadFailure.FILE_TOO_SMALL));
        }
        return size;
    }

    /**
     * @return required files missing from the directory, empty when complete
     */
    static List<String> missingFiles(Path directory, List<String> requiredFiles) {
        List<String> missing = new ArrayList<>();
        for (String name : requiredFiles) {
            if (!Files.isRegularFile(directory.resolve(name))) {
                missing.add(name);
            }
        }
        return missing;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete corrupted download {}: {}", file, e.toString());
        }
    }
}
