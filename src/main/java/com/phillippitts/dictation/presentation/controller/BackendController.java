package com.phillippitts.dictation.presentation.controller;

import com.phillippitts.dictation.context.SttBackendContext;
import com.phillippitts.dictation.domain.BackendFamily;
import com.phillippitts.dictation.service.stt.local.ServerStartOptions;
import com.phillippitts.dictation.service.stt.local.ServerStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * Status of all backends and start/stop of the local inference servers.
 */
@RestController
class BackendController {

    private static final Logger LOG = LogManager.getLogger(BackendController.class);

    private final SttBackendContext context;

    BackendController(SttBackendContext context) {
        this.context = context;
    }

    @GetMapping("/api/backend/status")
    ResponseEntity<SttBackendContext.BackendStatus> status() {
        return ResponseEntity.ok(context.status());
    }

    /**
     * Starts a server and answers once it is ready (or failed).
     */
    @PostMapping("/api/servers/{backend}/start")
    CompletableFuture<ResponseEntity<ServerStatus>> start(@PathVariable String backend,
                                                          @RequestParam("model") String modelId,
                                                          @RequestParam(value = "language", required = false) String language,
                                                          @RequestParam(value = "threads", defaultValue = "0") int threads) {
        BackendFamily family = BackendFamily.fromId(backend);
        LOG.info("Start requested: backend={}, model={}", family.id(), modelId);
        ServerStartOptions options = new ServerStartOptions(language, threads);
        return context.startServer(family, modelId, options)
                .thenApply(ignored -> ResponseEntity.ok(context.server(family).getStatus()));
    }

    @PostMapping("/api/servers/{backend}/stop")
    ResponseEntity<ServerStatus> stop(@PathVariable String backend) {
        BackendFamily family = BackendFamily.fromId(backend);
        LOG.info("Stop requested: backend={}", family.id());
        context.stopServer(family);
        return ResponseEntity.ok(context.server(family).getStatus());
    }
}
