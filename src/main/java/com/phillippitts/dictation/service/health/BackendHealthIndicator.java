package com.phillippitts.dictation.service.health;

import com.phillippitts.dictation.domain.ServerProcessState;
import com.phillippitts.dictation.service.stt.local.ServerStatus;
import com.phillippitts.dictation.service.stt.local.parakeet.ParakeetServerManager;
import com.phillippitts.dictation.service.stt.local.whisper.WhisperServerManager;
import com.phillippitts.dictation.service.stt.streaming.StreamingSession;
import com.phillippitts.dictation.service.stt.streaming.StreamingStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the local inference servers and the streaming session.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: no server crashed or degraded (stopped servers are fine, they start on demand)</li>
 *   <li>DEGRADED: a server failed its last health check</li>
 *   <li>DOWN: a server process exited unexpectedly</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class BackendHealthIndicator implements HealthIndicator {

    private final WhisperServerManager whisper;
    private final ParakeetServerManager parakeet;
    private final StreamingSession streamingSession;

    public BackendHealthIndicator(WhisperServerManager whisper,
                                  ParakeetServerManager parakeet,
                                  StreamingSession streamingSession) {
        this.whisper = whisper;
        this.parakeet = parakeet;
        this.streamingSession = streamingSession;
    }

    @Override
    public Health health() {
        List<ServerStatus> servers = List.of(whisper.getStatus(), parakeet.getStatus());
        boolean crashed = servers.stream().anyMatch(s -> s.state() == ServerProcessState.CRASHED);
        boolean degraded = servers.stream().anyMatch(s -> s.state() == ServerProcessState.DEGRADED);

        Health.Builder builder = new Health.Builder();
        if (crashed) {
            builder.down().withDetail("status", "Local server exited unexpectedly");
        } else if (degraded) {
            builder.status("DEGRADED").withDetail("status", "Local server failing health checks");
        } else {
            builder.up().withDetail("status", "Backends operational");
        }
        for (ServerStatus server : servers) {
            builder.withDetail(server.backend(), describe(server));
        }
        StreamingStatus streaming = streamingSession.getStatus();
        Map<String, Object> streamingDetail = new LinkedHashMap<>();
        streamingDetail.put("state", streaming.state().name());
        streamingDetail.put("warmConnection", streaming.warmConnection());
        streamingDetail.put("credentialValid", streaming.credentialValid());
        builder.withDetail("streaming", streamingDetail);
        return builder.build();
    }

    private Map<String, Object> describe(ServerStatus server) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("state", server.state().name());
        detail.put("binary", server.binaryAvailable() ? "available" : "missing");
        if (server.port() > 0) {
            detail.put("port", server.port());
        }
        if (server.gpu()) {
            detail.put("gpu", true);
        }
        return detail;
    }
}
