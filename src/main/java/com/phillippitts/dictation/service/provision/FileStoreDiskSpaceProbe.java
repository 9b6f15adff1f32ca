package com.phillippitts.dictation.service.provision;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link DiskSpaceProbe} backed by {@link java.nio.file.FileStore}. Directories that do not exist
 * yet are measured at their closest existing ancestor.
 */
@Component
public class FileStoreDiskSpaceProbe implements DiskSpaceProbe {

    @Override
    public long usableBytes(Path directory) throws IOException {
        Path existing = directory.toAbsolutePath();
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            throw new IOException("No existing ancestor for " + directory);
        }
        return Files.getFileStore(existing).getUsableSpace();
    }
}
