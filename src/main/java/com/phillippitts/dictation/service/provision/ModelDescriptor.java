package com.phillippitts.dictation.service.provision;

import com.phillippitts.dictation.domain.BackendFamily;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A downloadable model from the catalog.
 *
 * @param id                catalog id, also the model's directory name
 * @param backend           backend family that loads the model
 * @param url               download source
 * @param fileName          weights file name for single-file models; archive file name otherwise
 * @param expectedSizeBytes expected download size (0 = unknown, no size check)
 * @param archive           whether the download is a {@code tar.bz2} archive
 * @param archiveDirectory  top-level directory inside the archive
 * @param requiredFiles     files the installed model directory must contain
 */
public record ModelDescriptor(
        String id,
        BackendFamily backend,
        URI url,
        String fileName,
        long expectedSizeBytes,
        boolean archive,
        String archiveDirectory,
        List<String> requiredFiles
) {
    public ModelDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(url, "url");
        requiredFiles = requiredFiles == null ? List.of() : List.copyOf(requiredFiles);
        if (archive && (archiveDirectory == null || archiveDirectory.isBlank())) {
            throw new IllegalArgumentException("Archive model " + id + " needs an archive directory");
        }
        if (fileName == null || fileName.isBlank()) {
            fileName = archive ? id + ".tar.bz2" : null;
        }
        if (fileName == null) {
            throw new IllegalArgumentException("Model " + id + " needs a file name");
        }
    }

    /** {@code <cacheRoot>/<backend>/<id>} */
    public Path modelDirectory(Path cacheRoot) {
        return cacheRoot.resolve(backend.id()).resolve(id);
    }

    /**
     * Path handed to the server: the weights file for single-file models, the model directory
     * for archives.
     */
    public Path installedPath(Path cacheRoot) {
        Path dir = modelDirectory(cacheRoot);
        return archive ? dir : dir.resolve(fileName);
    }
}
