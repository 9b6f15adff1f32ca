package com.phillippitts.dictation.config.provision;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for model artifact provisioning.
 * Binds to properties prefixed with "provision".
 *
 * <p>Catalog entries are declared as an indexed list:
 * <pre>
 * provision.catalog[0].id=base
 * provision.catalog[0].backend=whisper
 * provision.catalog[0].url=https://huggingface.co/ggerganov/whisper.cpp/resolve/main/ggml-base.bin
 * provision.catalog[0].file-name=ggml-base.bin
 * provision.catalog[0].expected-size-bytes=147951465
 * </pre>
 */
@ConfigurationProperties(prefix = "provision")
@Validated
public class ProvisioningProperties {

    /** Root of the model cache; models live at {@code <cacheRoot>/<backend>/<modelId>/}. */
    @NotBlank(message = "Cache root must not be blank")
    private String cacheRoot = "models";

    /** Retries after the first attempt for transient failures. */
    @PositiveOrZero(message = "Max retries must not be negative")
    private int maxRetries = 3;

    @Positive(message = "Initial backoff must be positive")
    private int initialBackoffMs = 1000;

    @Positive(message = "Max backoff must be positive")
    private int maxBackoffMs = 30_000;

    @Positive(message = "Connect timeout must be positive")
    private int connectTimeoutMs = 60_000;

    /** A read idle for this long is treated as a stalled transfer. */
    @Positive(message = "Stall timeout must be positive")
    private int stallTimeoutMs = 30_000;

    @Positive(message = "Max redirects must be positive")
    private int maxRedirects = 5;

    @Positive(message = "Progress throttle must be positive")
    private int progressThrottleMs = 100;

    /** Age after which leftover temp files and staging directories are swept. */
    @Positive(message = "Stale age must be positive")
    private int staleAgeHours = 24;

    /** Allowed shortfall of a downloaded file against its expected size. */
    @PositiveOrZero(message = "Size tolerance must not be negative")
    private int sizeTolerancePercent = 10;

    /** Free space required for archives, as a multiple of the archive size (archive plus extraction). */
    @DecimalMin(value = "1.0", message = "Archive space multiplier must be at least 1.0")
    private double archiveSpaceMultiplier = 2.5;

    /** Free space required for single-file models, as a multiple of the file size. */
    @DecimalMin(value = "1.0", message = "File space multiplier must be at least 1.0")
    private double fileSpaceMultiplier = 1.2;

    @Positive(message = "Extraction attempts must be positive")
    private int extractionAttempts = 2;

    @NotBlank(message = "User agent must not be blank")
    private String userAgent = "DictationBackend/1.0 (model-provisioner)";

    /** Sweep stale downloads when the application starts. */
    private boolean sweepOnStartup = true;

    @Valid
    private List<ModelEntry> catalog = new ArrayList<>();

    public String getCacheRoot() {
        return cacheRoot;
    }

    public void setCacheRoot(String cacheRoot) {
        this.cacheRoot = cacheRoot;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public int getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public void setInitialBackoffMs(int initialBackoffMs) {
        this.initialBackoffMs = initialBackoffMs;
    }

    public int getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(int maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getStallTimeoutMs() {
        return stallTimeoutMs;
    }

    public void setStallTimeoutMs(int stallTimeoutMs) {
        this.stallTimeoutMs = stallTimeoutMs;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    public void setMaxRedirects(int maxRedirects) {
        this.maxRedirects = maxRedirects;
    }

    public int getProgressThrottleMs() {
        return progressThrottleMs;
    }

    public void setProgressThrottleMs(int progressThrottleMs) {
        this.progressThrottleMs = progressThrottleMs;
    }

    public int getStaleAgeHours() {
        return staleAgeHours;
    }

    public void setStaleAgeHours(int staleAgeHours) {
        this.staleAgeHours = staleAgeHours;
    }

    public int getSizeTolerancePercent() {
        return sizeTolerancePercent;
    }

    public void setSizeTolerancePercent(int sizeTolerancePercent) {
        this.sizeTolerancePercent = sizeTolerancePercent;
    }

    public double getArchiveSpaceMultiplier() {
        return archiveSpaceMultiplier;
    }

    public void setArchiveSpaceMultiplier(double archiveSpaceMultiplier) {
        this.archiveSpaceMultiplier = archiveSpaceMultiplier;
    }

    public double getFileSpaceMultiplier() {
        return fileSpaceMultiplier;
    }

    public void setFileSpaceMultiplier(double fileSpaceMultiplier) {
        this.fileSpaceMultiplier = fileSpaceMultiplier;
    }

    public int getExtractionAttempts() {
        return extractionAttempts;
    }

    public void setExtractionAttempts(int extractionAttempts) {
        this.extractionAttempts = extractionAttempts;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public boolean isSweepOnStartup() {
        return sweepOnStartup;
    }

    public void setSweepOnStartup(boolean sweepOnStartup) {
        this.sweepOnStartup = sweepOnStartup;
    }

    public List<ModelEntry> getCatalog() {
        return catalog;
    }

    public void setCatalog(List<ModelEntry> catalog) {
        this.catalog = catalog;
    }

    /**
     * One downloadable model. Archives are {@code tar.bz2} files whose top-level directory is
     * {@code archiveDirectory}; single-file models are stored as {@code fileName}.
     */
    public static class ModelEntry {
        @NotBlank(message = "Model id must not be blank")
        private String id;

        @NotBlank(message = "Model backend must not be blank")
        private String backend;

        @NotBlank(message = "Model url must not be blank")
        private String url;

        private String fileName;

        @PositiveOrZero(message = "Expected size must not be negative")
        private long expectedSizeBytes;

        private boolean archive;

        private String archiveDirectory;

        private List<String> requiredFiles = new ArrayList<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getBackend() {
            return backend;
        }

        public void setBackend(String backend) {
            this.backend = backend;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getFileName() {
            return fileName;
        }

        public void setFileName(String fileName) {
            this.fileName = fileName;
        }

        public long getExpectedSizeBytes() {
            return expectedSizeBytes;
        }

        public void setExpectedSizeBytes(long expectedSizeBytes) {
            this.expectedSizeBytes = expectedSizeBytes;
        }

        public boolean isArchive() {
            return archive;
        }

        public void setArchive(boolean archive) {
            this.archive = archive;
        }

        public String getArchiveDirectory() {
            return archiveDirectory;
        }

        public void setArchiveDirectory(String archiveDirectory) {
            this.archiveDirectory = archiveDirectory;
        }

        public List<String> getRequiredFiles() {
            return requiredFiles;
        }

        public void setRequiredFiles(List<String> requiredFiles) {
            this.requiredFiles = requiredFiles;
        }
    }
}
