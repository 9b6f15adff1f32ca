package com.phillippitts.dictation.presentation.controller;

import com.phillippitts.dictation.context.SttBackendContext;
import com.phillippitts.dictation.domain.BackendFamily;
import com.phillippitts.dictation.service.provision.ModelStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Model catalog and provisioning. Downloads run on the provisioning executor; clients poll the
 * list endpoint for completion.
 */
@RestController
class ModelController {

    private static final Logger LOG = LogManager.getLogger(ModelController.class);

    private final SttBackendContext context;

    ModelController(SttBackendContext context) {
        this.context = context;
    }

    @GetMapping("/api/models/{backend}")
    ResponseEntity<List<ModelStatus>> list(@PathVariable String backend) {
        return ResponseEntity.ok(context.provisioner().listModels(BackendFamily.fromId(backend)));
    }

    @PostMapping("/api/models/{backend}/{modelId}/download")
    ResponseEntity<ModelStatus> download(@PathVariable String backend, @PathVariable String modelId) {
        BackendFamily family = BackendFamily.fromId(backend);
        LOG.info("Download requested: {}/{}", family.id(), modelId);
        context.downloadModel(family, modelId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(context.provisioner().modelStatus(family, modelId));
    }

    @DeleteMapping("/api/models/{backend}/{modelId}/download")
    ResponseEntity<Map<String, Object>> cancel(@PathVariable String backend, @PathVariable String modelId) {
        boolean cancelled = context.provisioner().cancelDownload(BackendFamily.fromId(backend), modelId);
        return ResponseEntity.ok(Map.of("modelId", modelId, "cancelled", cancelled));
    }

    @DeleteMapping("/api/models/{backend}/{modelId}")
    ResponseEntity<Map<String, Object>> delete(@PathVariable String backend, @PathVariable String modelId) {
        boolean deleted = context.provisioner().deleteModel(BackendFamily.fromId(backend), modelId);
        return ResponseEntity.ok(Map.of("modelId", modelId, "deleted", deleted));
    }
}
