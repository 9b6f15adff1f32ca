package com.phillippitts.dictation.service.provision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class StaleDownloadSweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path root;

    private StaleDownloadSweeper sweeper;

    @BeforeEach
    void setUp() {
        sweeper = new StaleDownloadSweeper(Duration.ofHours(24), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private Path touch(Path path, Duration age) throws IOException {
        Files.createDirectories(path.getParent());
        if (!Files.exists(path)) {
            Files.write(path, new byte[16]);
        }
        Files.setLastModifiedTime(path, FileTime.from(NOW.minus(age)));
        return path;
    }

    @Test
    void removesOldTempFiles() throws IOException {
        Path stale = touch(root.resolve("whisper/base/ggml-base.bin.tmp"), Duration.ofHours(30));

        int removed = sweeper.sweep(root);

        assertThat(removed).isEqualTo(1);
        assertThat(stale).doesNotExist();
    }

    @Test
    void keepsRecentTempFiles() throws IOException {
        Path fresh = touch(root.resolve("whisper/base/ggml-base.bin.tmp"), Duration.ofHours(2));

        assertThat(sweeper.sweep(root)).isZero();
        assertThat(fresh).exists();
    }

    @Test
    void removesOldStagingDirectories() throws IOException {
        Path staging = root.resolve("parakeet/temp-extract-tdt-v3-1700000000000");
        touch(staging.resolve("model/encoder.onnx"), Duration.ofHours(48));
        Files.setLastModifiedTime(staging, FileTime.from(NOW.minus(Duration.ofHours(48))));

        assertThat(sweeper.sweep(root)).isEqualTo(1);
        assertThat(staging).doesNotExist();
    }

    @Test
    void leavesInstalledModelsAlone() throws IOException {
        Path model = touch(root.resolve("whisper/base/ggml-base.bin"), Duration.ofDays(90));

        assertThat(sweeper.sweep(root)).isZero();
        assertThat(model).exists();
    }

    @Test
    void missingRootIsNotAnError() {
        assertThat(sweeper.sweep(root.resolve("absent"))).isZero();
    }
}
