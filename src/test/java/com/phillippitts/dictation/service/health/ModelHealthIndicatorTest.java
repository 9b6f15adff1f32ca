package com.phillippitts.dictation.service.health;

import com.phillippitts.dictation.config.stt.ParakeetServerConfig;
import com.phillippitts.dictation.config.stt.WhisperServerConfig;
import com.phillippitts.dictation.domain.BackendFamily;
import com.phillippitts.dictation.service.provision.ModelProvisioner;
import com.phillippitts.dictation.service.provision.ModelStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ModelHealthIndicatorTest {

    @TempDir
    Path tempDir;

    private ModelProvisioner provisioner;

    @BeforeEach
    void setUp() {
        provisioner = mock(ModelProvisioner.class);
        when(provisioner.getCacheRoot()).thenReturn(tempDir.resolve("models"));
    }

    @Test
    void shouldReportUpWhenBinariesAndModelsPresent() throws IOException {
        Path whisperBinary = executable("whisper-server");
        Path parakeetBinary = executable("sherpa-server");
        when(provisioner.listModels(BackendFamily.WHISPER)).thenReturn(List.of(
                installed("whisper", "base"), missing("whisper", "large-v3")));
        when(provisioner.listModels(BackendFamily.PARAKEET)).thenReturn(List.of(
                installed("parakeet", "tdt-v3")));

        Health health = indicator(whisperBinary, parakeetBinary).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("status", "All binaries and models accessible")
                .containsEntry("whisperModels", 1L)
                .containsEntry("parakeetModels", 1L)
                .containsEntry("cacheRoot", tempDir.resolve("models").toString());
        assertThat(health.getDetails().get("whisperBinary")).asString()
                .contains("accessible and executable at");
    }

    @Test
    void shouldReportDownWhenBinaryMissing() throws IOException {
        Path parakeetBinary = executable("sherpa-server");
        when(provisioner.listModels(BackendFamily.WHISPER)).thenReturn(List.of(installed("whisper", "base")));
        when(provisioner.listModels(BackendFamily.PARAKEET)).thenReturn(List.of(installed("parakeet", "tdt-v3")));

        Health health = indicator(tempDir.resolve("nonexistent"), parakeetBinary).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Missing binaries or models");
        assertThat(health.getDetails().get("whisperBinary")).asString().startsWith("NOT FOUND at");
    }

    @Test
    void shouldReportDownWhenBinaryNotExecutable() throws IOException {
        Path whisperBinary = Files.createFile(tempDir.resolve("whisper-server"));
        whisperBinary.toFile().setExecutable(false);
        Path parakeetBinary = executable("sherpa-server");
        when(provisioner.listModels(BackendFamily.WHISPER)).thenReturn(List.of(installed("whisper", "base")));
        when(provisioner.listModels(BackendFamily.PARAKEET)).thenReturn(List.of(installed("parakeet", "tdt-v3")));

        Health health = indicator(whisperBinary, parakeetBinary).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails().get("whisperBinary")).asString().startsWith("not executable at");
    }

    @Test
    void shouldReportDownWhenBackendHasNoInstalledModel() throws IOException {
        Path whisperBinary = executable("whisper-server");
        Path parakeetBinary = executable("sherpa-server");
        when(provisioner.listModels(BackendFamily.WHISPER)).thenReturn(List.of(installed("whisper", "base")));
        when(provisioner.listModels(BackendFamily.PARAKEET)).thenReturn(List.of(missing("parakeet", "tdt-v3")));

        Health health = indicator(whisperBinary, parakeetBinary).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("parakeetModels", 0L);
    }

    private ModelHealthIndicator indicator(Path whisperBinary, Path parakeetBinary) {
        WhisperServerConfig whisper = new WhisperServerConfig(whisperBinary.toString(), "", 8178, 8199,
                30, 5, 2, 300, 10, 0, "auto", true, 65536);
        ParakeetServerConfig parakeet = new ParakeetServerConfig(parakeetBinary.toString(), "", 6006, 6029,
                60, 5, 300, 10, 2, true, 65536);
        return new ModelHealthIndicator(whisper, parakeet, provisioner);
    }

    private Path executable(String name) throws IOException {
        Path binary = Files.createFile(tempDir.resolve(name));
        binary.toFile().setExecutable(true);
        return binary;
    }

    private static ModelStatus installed(String backend, String modelId) {
        return new ModelStatus(backend, modelId, true, false, 1024, 1024, "/models/" + modelId);
    }

    private static ModelStatus missing(String backend, String modelId) {
        return new ModelStatus(backend, modelId, false, false, 0, 1024, null);
    }
}
