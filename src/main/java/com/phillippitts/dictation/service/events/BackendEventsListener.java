package com.phillippitts.dictation.service.events;

import com.phillippitts.dictation.domain.ServerProcessState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for backend lifecycle events. Privacy-safe and throttled to avoid log spam
 * from flapping servers.
 */
@Component
class BackendEventsListener {
    private static final Logger LOG = LogManager.getLogger(BackendEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onServerStateChanged(ServerStateChangedEvent e) {
        if (e.current() == ServerProcessState.CRASHED) {
            if (shouldLog("server-crashed-" + e.backend())) {
                LOG.error("Local {} server crashed: {}. It will be restarted on the next start request.",
                        e.backend(), e.reason());
            }
        } else if (e.current() == ServerProcessState.DEGRADED) {
            if (shouldLog("server-degraded-" + e.backend())) {
                LOG.warn("Local {} server failed its health check: {}", e.backend(), e.reason());
            }
        } else {
            LOG.debug("Local {} server {} -> {} ({})", e.backend(), e.previous(), e.current(), e.reason());
        }
    }

    @EventListener
    void onGpuFallback(GpuFallbackEvent e) {
        if (shouldLog("gpu-fallback-" + e.backend())) {
            LOG.warn("GPU {} server unavailable ({}); running on CPU. Check GPU drivers or unset {}.",
                    e.backend(), e.reason(), e.gpuBinaryPath());
        }
    }

    @EventListener
    void onModelDownloaded(ModelDownloadedEvent e) {
        LOG.info("Model {}/{} installed at {} ({} bytes in {}ms)",
                e.backend(), e.modelId(), e.path(), e.bytes(), e.durationMs());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
