package com.phillippitts.dictation.service.provision;

import com.phillippitts.dictation.config.provision.ProvisioningProperties;
import com.phillippitts.dictation.domain.BackendFamily;
import com.phillippitts.dictation.exception.ModelNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Downloadable models per backend, bound from {@code provision.catalog[*]}.
 */
@Component
public class ModelCatalog {

    private static final Logger LOG = LogManager.getLogger(ModelCatalog.class);

    private final Map<String, ModelDescriptor> models = new LinkedHashMap<>();

    @Autowired
    public ModelCatalog(ProvisioningProperties properties) {
        this(toDescriptors(properties.getCatalog()));
    }

    ModelCatalog(List<ModelDescriptor> descriptors) {
        for (ModelDescriptor descriptor : descriptors) {
            ModelDescriptor previous = models.put(key(descriptor.backend(), descriptor.id()), descriptor);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate catalog entry " + descriptor.backend().id()
                        + "/" + descriptor.id());
            }
        }
        LOG.info("Model catalog loaded with {} entries", models.size());
    }

    public Optional<ModelDescriptor> find(BackendFamily backend, String modelId) {
        return Optional.ofNullable(models.get(key(backend, modelId)));
    }

    /**
     * @throws ModelNotFoundException when the catalog has no such model
     */
    public ModelDescriptor require(BackendFamily backend, String modelId) {
        return find(backend, modelId)
                .orElseThrow(() -> new ModelNotFoundException(backend.id() + "/" + modelId));
    }

    public List<ModelDescriptor> list(BackendFamily backend) {
        List<ModelDescriptor> result = new ArrayList<>();
        for (ModelDescriptor descriptor : models.values()) {
            if (descriptor.backend() == backend) {
                result.add(descriptor);
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static String key(BackendFamily backend, String modelId) {
        return backend.id() + "/" + modelId;
    }

    private static List<ModelDescriptor> toDescriptors(List<ProvisioningProperties.ModelEntry> entries) {
        List<ModelDescriptor> descriptors = new ArrayList<>();
        for (ProvisioningProperties.ModelEntry entry : entries) {
            descriptors.add(new ModelDescriptor(
                    entry.getId(),
                    BackendFamily.fromId(entry.getBackend()),
                    URI.create(entry.getUrl()),
                    entry.getFileName(),
                    entry.getExpectedSizeBytes(),
                    entry.isArchive(),
                    entry.getArchiveDirectory(),
                    entry.getRequiredFiles()));
        }
        return descriptors;
    }
}
