package com.phillippitts.dictation.service.provision;

import com.phillippitts.dictation.config.provision.ProvisioningProperties;
import com.phillippitts.dictation.domain.BackendFamily;
import com.phillippitts.dictation.exception.DictationBackendException;
import com.phillippitts.dictation.exception.ErrorCode;
import com.phillippitts.dictation.exception.ModelInstallationException;
import com.phillippitts.dictation.service.cancel.CancellationToken;
import com.phillippitts.dictation.service.events.ModelDownloadedEvent;
import com.phillippitts.dictation.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Installs catalog models into the cache at {@code <cacheRoot>/<backend>/<modelId>/}.
 *
 * <p>Installation sequence:
 * <ol>
 *   <li>disk preflight (2.5x the archive size, 1.2x a single file)</li>
 *   <li>resumable download through {@link ModelDownloader}</li>
 *   <li>size validation against the catalog size</li>
 *   <li>archives: {@code tar -xjf} into a {@code temp-extract-*} staging directory, required file
 *       check, move into place</li>
 * </ol>
 * Corruption and extraction failures remove the partial model and surface as
 * {@link ModelInstallationException}. One download per model at a time; {@link #cancelDownload}
 * cancels it through its token.
 */
@Component
public class ModelProvisioner {

    private static final Logger LOG = LogManager.getLogger(ModelProvisioner.class);

    private final ProvisioningProperties properties;
    private final ModelCatalog catalog;
    private final ModelDownloader downloader;
    private final ArchiveExtractor extractor;
    private final StaleDownloadSweeper sweeper;
    private final ApplicationEventPublisher publisher;
    private final Path cacheRoot;

    private final Map<String, CancellationToken> activeDownloads = new ConcurrentHashMap<>();

    public ModelProvisioner(ProvisioningProperties properties,
                            ModelCatalog catalog,
                            ModelDownloader downloader,
                            ArchiveExtractor extractor,
                            StaleDownloadSweeper sweeper,
                            ApplicationEventPublisher publisher) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.downloader = Objects.requireNonNull(downloader, "downloader");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.sweeper = Objects.requireNonNull(sweeper, "sweeper");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.cacheRoot = Paths.get(properties.getCacheRoot()).toAbsolutePath();
    }

    public Path getCacheRoot() {
        return cacheRoot;
    }

    public ModelCatalog catalog() {
        return catalog;
    }

    /**
     * Returns the installed model path, downloading and installing the model first when needed.
     * Blocks the calling thread.
     *
     * @throws com.phillippitts.dictation.exception.ModelNotFoundException         unknown model
     * @throws com.phillippitts.dictation.exception.InsufficientDiskSpaceException before any request
     * @throws com.phillippitts.dictation.exception.DownloadException              download failed
     * @throws ModelInstallationException                                         validation or extraction failed
     * @throws com.phillippitts.dictation.exception.OperationCancelledException    cancelled
     */
    public Path ensureModel(BackendFamily backend, String modelId, DownloadProgressListener listener,
                            CancellationToken token) {
        ModelDescriptor model = catalog.require(backend, modelId);
        Path installed = model.installedPath(cacheRoot);
        if (isInstalled(model)) {
            LOG.debug("Model {}/{} already installed at {}", backend.id(), modelId, installed);
            return installed;
        }

        String key = key(backend, modelId);
        if (activeDownloads.putIfAbsent(key, token) != null) {
            throw new DictationBackendException("Download already in progress for " + key, ErrorCode.NOT_READY);
        }
        long startNanos = System.nanoTime();
        try {
            long bytes = model.archive()
                    ? installArchive(model, listener, token)
                    : installFile(model, listener, token);
            long durationMs = TimeUtils.elapsedMillis(startNanos);
            LOG.info("Model {} installed at {} ({} bytes, {}ms)", key, installed, bytes, durationMs);
            publisher.publishEvent(new ModelDownloadedEvent(backend.id(), modelId, installed, bytes, durationMs, null));
            return installed;
        } finally {
            activeDownloads.remove(key, token);
        }
    }

    private long installFile(ModelDescriptor model, DownloadProgressListener listener, CancellationToken token) {
        Path modelDir = model.modelDirectory(cacheRoot);
        Path target = modelDir.resolve(model.fileName());
        long required = requiredSpace(model.expectedSizeBytes(), properties.getFileSpaceMultiplier());
        try {
            downloader.download(model.url(), target,
                    new DownloadOptions(model.expectedSizeBytes(), required, listener), token);
            return ModelFileValidator.validateSize(model.id(), target, model.expectedSizeBytes(),
                    properties.getSizeTolerancePercent());
        } catch (ModelInstallationException e) {
            deleteQuietly(modelDir);
            throw e;
        }
    }

    private long installArchive(ModelDescriptor model, DownloadProgressListener listener, CancellationToken token) {
        Path backendDir = cacheRoot.resolve(model.backend().id());
        Path archive = backendDir.resolve(model.fileName());
        Path staging = backendDir.resolve(StaleDownloadSweeper.STAGING_PREFIX + model.id() + "-" + System.currentTimeMillis());
        Path modelDir = model.modelDirectory(cacheRoot);
        long required = requiredSpace(model.expectedSizeBytes(), properties.getArchiveSpaceMultiplier());

        downloader.download(model.url(), archive,
                new DownloadOptions(model.expectedSizeBytes(), required, listener), token);
        try {
            long bytes = ModelFileValidator.validateSize(model.id(), archive, model.expectedSizeBytes(),
                    properties.getSizeTolerancePercent());
            try {
                extractor.extract(archive, staging, token);
            } catch (IOException e) {
                throw new ModelInstallationException(model.id(), "Archive extraction failed: " + e.getMessage(), e);
            }

            Path extracted = staging.resolve(model.archiveDirectory());
            List<String> missing = ModelFileValidator.missingFiles(extracted, model.requiredFiles());
            if (!Files.isDirectory(extracted) || !missing.isEmpty()) {
                throw new ModelInstallationException(model.id(),
                        "Extracted model is incomplete, missing " + (missing.isEmpty() ? model.archiveDirectory() : missing));
            }
            try {
                FileTrees.deleteRecursively(modelDir);
                Files.move(extracted, modelDir, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                throw new ModelInstallationException(model.id(), "Could not move model into place: " + e.getMessage(), e);
            }
            return bytes;
        } catch (ModelInstallationException e) {
            deleteQuietly(modelDir);
            throw e;
        } finally {
            deleteQuietly(staging);
            deleteQuietly(archive);
        }
    }

    private static long requiredSpace(long expectedBytes, double multiplier) {
        return expectedBytes <= 0 ? 0 : (long) Math.ceil(expectedBytes * multiplier);
    }

    public boolean isInstalled(ModelDescriptor model) {
        Path path = model.installedPath(cacheRoot);
        if (model.archive()) {
            return Files.isDirectory(path) && ModelFileValidator.missingFiles(path, model.requiredFiles()).isEmpty();
        }
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    public ModelStatus modelStatus(BackendFamily backend, String modelId) {
        return statusOf(catalog.require(backend, modelId));
    }

    public List<ModelStatus> listModels(BackendFamily backend) {
        List<ModelStatus> result = new ArrayList<>();
        for (ModelDescriptor model : catalog.list(backend)) {
            result.add(statusOf(model));
        }
        return result;
    }

    private ModelStatus statusOf(ModelDescriptor model) {
        boolean installed = isInstalled(model);
        Path path = model.installedPath(cacheRoot);
        return new ModelStatus(
                model.backend().id(),
                model.id(),
                installed,
                activeDownloads.containsKey(key(model.backend(), model.id())),
                installed ? sizeOnDisk(path) : 0,
                model.expectedSizeBytes(),
                installed ? path.toString() : null);
    }

    /**
     * Cancels an in-flight download and removes the model's files.
     *
     * @return true when anything was deleted
     */
    public boolean deleteModel(BackendFamily backend, String modelId) {
        ModelDescriptor model = catalog.require(backend, modelId);
        cancelDownload(backend, modelId);
        Path modelDir = model.modelDirectory(cacheRoot);
        if (!Files.exists(modelDir)) {
            return false;
        }
        try {
            FileTrees.deleteRecursively(modelDir);
            LOG.info("Deleted model {}/{}", backend.id(), modelId);
            return true;
        } catch (IOException e) {
            throw new DictationBackendException("Could not delete " + modelDir + ": " + e.getMessage(),
                    ErrorCode.CONFIGURATION, e);
        }
    }

    /**
     * @return true when a download was in flight and has been asked to stop
     */
    public boolean cancelDownload(BackendFamily backend, String modelId) {
        CancellationToken token = activeDownloads.get(key(backend, modelId));
        if (token == null) {
            return false;
        }
        LOG.info("Cancelling download of {}/{}", backend.id(), modelId);
        token.cancel();
        return true;
    }

    public void cancelAllDownloads() {
        activeDownloads.values().forEach(CancellationToken::cancel);
    }

    public boolean isDownloading(BackendFamily backend, String modelId) {
        return activeDownloads.containsKey(key(backend, modelId));
    }

    /**
     * Removes stale temp files and staging directories under the cache root.
     */
    public int sweepStaleDownloads() {
        return sweeper.sweep(cacheRoot);
    }

    private static String key(BackendFamily backend, String modelId) {
        return backend.id() + "/" + modelId;
    }

    private static long sizeOnDisk(Path path) {
        if (Files.isRegularFile(path)) {
            try {
                return Files.size(path);
            } catch (IOException e) {
                return 0;
            }
        }
        try (var walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile).mapToLong(p -> p.toFile().length()).sum();
        } catch (IOException e) {
            return 0;
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            FileTrees.deleteRecursively(path);
        } catch (IOException e) {
            LOG.warn("Could not clean up {}: {}", path, e.toString());
        }
    }
}
