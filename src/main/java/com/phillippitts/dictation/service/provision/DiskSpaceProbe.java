package com.phillippitts.dictation.service.provision;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reports usable space of the file store holding a directory. Abstracted for tests.
 */
@FunctionalInterface
public interface DiskSpaceProbe {

    long usableBytes(Path directory) throws IOException;
}
