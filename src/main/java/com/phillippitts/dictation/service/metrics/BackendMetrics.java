package com.phillippitts.dictation.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the speech-recognition backends.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Local transcription latency and outcome per backend (whisper, parakeet)</li>
 *   <li>Streaming session reconnects and re-warms</li>
 *   <li>GPU to CPU fallbacks of local servers</li>
 *   <li>Model download retries and outcomes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class BackendMetrics {

    private static final String METRIC_PREFIX = "dictation.backend";

    private final MeterRegistry registry;

    public BackendMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records transcription latency for a local backend.
     *
     * @param backend       backend id (whisper, parakeet)
     * @param durationNanos duration in nanoseconds
     */
    public void recordTranscriptionLatency(String backend, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".transcription.latency")
                .description("Time taken by a local server to transcribe audio")
                .tag("backend", backend)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the transcription failure counter for a local backend.
     *
     * @param backend backend id
     * @param reason  error code name
     */
    public void incrementTranscriptionFailure(String backend, String reason) {
        Counter.builder(METRIC_PREFIX + ".transcription.failure")
                .description("Number of failed local transcriptions")
                .tag("backend", backend)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts a streaming reconnect.
     *
     * @param reason liveness, auth
     */
    public void incrementStreamingReconnect(String reason) {
        Counter.builder(METRIC_PREFIX + ".streaming.reconnect")
                .description("Number of streaming session reconnects")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Counts a re-warm attempt of the streaming session's warm socket.
     */
    public void incrementRewarm() {
        Counter.builder(METRIC_PREFIX + ".streaming.rewarm")
                .description("Number of warm socket re-warm attempts")
                .register(registry)
                .increment();
    }

    public void incrementGpuFallback(String backend) {
        Counter.builder(METRIC_PREFIX + ".server.gpu_fallback")
                .description("Number of GPU binary startups that fell back to the CPU binary")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    public void incrementDownloadRetry(String failure) {
        Counter.builder(METRIC_PREFIX + ".download.retry")
                .description("Number of model download retries")
                .tag("failure", failure)
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome of a model download.
     *
     * @param outcome success, failure, cancelled
     */
    public void recordDownloadOutcome(String outcome) {
        Counter.builder(METRIC_PREFIX + ".download.outcome")
                .description("Number of finished model downloads by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
