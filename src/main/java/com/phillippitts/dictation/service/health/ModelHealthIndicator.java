package com.phillippitts.dictation.service.health;

import com.phillippitts.dictation.config.stt.ParakeetServerConfig;
import com.phillippitts.dictation.config.stt.WhisperServerConfig;
import com.phillippitts.dictation.domain.BackendFamily;
import com.phillippitts.dictation.service.provision.ModelProvisioner;
import com.phillippitts.dictation.service.provision.ModelStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Health indicator for server binaries and provisioned models.
 *
 * <p>UP when every backend has an executable binary and at least one installed model.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ModelHealthIndicator implements HealthIndicator {

    private final WhisperServerConfig whisperConfig;
    private final ParakeetServerConfig parakeetConfig;
    private final ModelProvisioner provisioner;

    public ModelHealthIndicator(WhisperServerConfig whisperConfig,
                                ParakeetServerConfig parakeetConfig,
                                ModelProvisioner provisioner) {
        this.whisperConfig = whisperConfig;
        this.parakeetConfig = parakeetConfig;
        this.provisioner = provisioner;
    }

    @Override
    public Health health() {
        Path whisperBinary = Paths.get(whisperConfig.binaryPath());
        Path parakeetBinary = Paths.get(parakeetConfig.binaryPath());
        long whisperModels = installedCount(BackendFamily.WHISPER);
        long parakeetModels = installedCount(BackendFamily.PARAKEET);

        boolean allHealthy = Files.isExecutable(whisperBinary) && Files.isExecutable(parakeetBinary)
                && whisperModels > 0 && parakeetModels > 0;

        Health.Builder builder = allHealthy ? Health.up() : Health.down();
        return builder
                .withDetail("status", allHealthy ? "All binaries and models accessible"
                        : "Missing binaries or models")
                .withDetail("whisperBinary", formatBinaryStatus(whisperBinary))
                .withDetail("parakeetBinary", formatBinaryStatus(parakeetBinary))
                .withDetail("whisperModels", whisperModels)
                .withDetail("parakeetModels", parakeetModels)
                .withDetail("cacheRoot", provisioner.getCacheRoot().toString())
                .build();
    }

    private long installedCount(BackendFamily backend) {
        List<ModelStatus> models = provisioner.listModels(backend);
        return models.stream().filter(ModelStatus::downloaded).count();
    }

    private String formatBinaryStatus(Path path) {
        if (!Files.isRegularFile(path)) {
            return "NOT FOUND at " + path;
        }
        if (!Files.isExecutable(path)) {
            return "not executable at " + path;
        }
        return "accessible and executable at " + path;
    }
}
