package com.phillippitts.dictation.service.provision;

import com.phillippitts.dictation.exception.InsufficientDiskSpaceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Disk space preflight for large downloads. The caller decides the safety margin and passes the
 * full requirement.
 */
@Component
public class DiskSpaceChecker {

    private static final Logger LOG = LogManager.getLogger(DiskSpaceChecker.class);

    private final DiskSpaceProbe probe;

    public DiskSpaceChecker(DiskSpaceProbe probe) {
        this.probe = Objects.requireNonNull(probe, "probe");
    }

    /**
     * Refuses when the directory's file store has less usable space than required.
     * A store that cannot be measured is not a reason to refuse.
     *
     * @throws InsufficientDiskSpaceException carrying required, available and shortfall bytes
     */
    public void checkDiskSpace(Path directory, long requiredBytes) {
        if (requiredBytes <= 0) {
            return;
        }
        long available;
        try {
            available = probe.usableBytes(directory);
        } catch (IOException e) {
            LOG.debug("Could not measure free space in {}: {}", directory, e.toString());
            return;
        }
        if (available < requiredBytes) {
            throw new InsufficientDiskSpaceException(directory, requiredBytes, available);
        }
        LOG.debug("Disk space ok in {}: need {}B, have {}B", directory, requiredBytes, available);
    }
}
