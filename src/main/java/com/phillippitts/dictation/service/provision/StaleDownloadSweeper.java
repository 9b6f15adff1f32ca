package com.phillippitts.dictation.service.provision;

import com.phillippitts.dictation.config.provision.ProvisioningProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Deletes download artifacts left behind by interrupted runs: {@code *.tmp} files and
 * {@code temp-extract-*} staging directories older than the configured age.
 */
@Component
public class StaleDownloadSweeper {

    private static final Logger LOG = LogManager.getLogger(StaleDownloadSweeper.class);

    static final String STAGING_PREFIX = "temp-extract-";

    // <root>/<backend>/<model-id>/<file>
    private static final int MAX_DEPTH = 3;

    private final Duration maxAge;
    private final Clock clock;

    @Autowired
    public StaleDownloadSweeper(ProvisioningProperties properties) {
        this(Duration.ofHours(properties.getStaleAgeHours()), Clock.systemUTC());
    }

    StaleDownloadSweeper(Duration maxAge, Clock clock) {
        this.maxAge = maxAge;
        this.clock = clock;
    }

    /**
     * @return number of artifacts removed
     */
    public int sweep(Path root) {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(root, MAX_DEPTH)) {
            candidates = walk.filter(StaleDownloadSweeper::isArtifact).collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Could not scan {} for stale downloads: {}", root, e.toString());
            return 0;
        }

        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (Path path : candidates) {
            try {
                if (!Files.exists(path) || !Files.getLastModifiedTime(path).toInstant().isBefore(cutoff)) {
                    continue;
                }
                FileTrees.deleteRecursively(path);
                removed++;
                LOG.info("Removed stale download artifact {}", path);
            } catch (IOException e) {
                LOG.debug("Skipping {}: {}", path, e.toString());
            }
        }
        return removed;
    }

    private static boolean isArtifact(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        if (name.startsWith(STAGING_PREFIX)) {
            return Files.isDirectory(path);
        }
        return name.endsWith(ModelDownloader.TEMP_SUFFIX) && Files.isRegularFile(path);
    }
}
