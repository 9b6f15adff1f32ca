package com.phillippitts.dictation.service.health;

import com.phillippitts.dictation.domain.ConnectionState;
import com.phillippitts.dictation.domain.ServerProcessState;
import com.phillippitts.dictation.service.stt.local.ServerStatus;
import com.phillippitts.dictation.service.stt.local.parakeet.ParakeetServerManager;
import com.phillippitts.dictation.service.stt.local.whisper.WhisperServerManager;
import com.phillippitts.dictation.service.stt.streaming.StreamingSession;
import com.phillippitts.dictation.service.stt.streaming.StreamingStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BackendHealthIndicatorTest {

    private WhisperServerManager whisper;
    private ParakeetServerManager parakeet;
    private StreamingSession streaming;
    private BackendHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        whisper = mock(WhisperServerManager.class);
        parakeet = mock(ParakeetServerManager.class);
        streaming = mock(StreamingSession.class);
        when(streaming.getStatus()).thenReturn(
                new StreamingStatus(ConnectionState.WARM_IDLE, null, true, true, 0));
        indicator = new BackendHealthIndicator(whisper, parakeet, streaming);
    }

    @Test
    void shouldReportUpWhenServersStoppedOrReady() {
        when(whisper.getStatus()).thenReturn(status("whisper", ServerProcessState.READY, 8178, true));
        when(parakeet.getStatus()).thenReturn(status("parakeet", ServerProcessState.STOPPED, -1, false));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Backends operational");
        @SuppressWarnings("unchecked")
        Map<String, Object> whisperDetail = (Map<String, Object>) health.getDetails().get("whisper");
        assertThat(whisperDetail)
                .containsEntry("state", "READY")
                .containsEntry("port", 8178)
                .containsEntry("gpu", true);
        @SuppressWarnings("unchecked")
        Map<String, Object> parakeetDetail = (Map<String, Object>) health.getDetails().get("parakeet");
        assertThat(parakeetDetail).doesNotContainKey("port").doesNotContainKey("gpu");
    }

    @Test
    void shouldReportDegradedWhenHealthChecksFail() {
        when(whisper.getStatus()).thenReturn(status("whisper", ServerProcessState.DEGRADED, 8178, false));
        when(parakeet.getStatus()).thenReturn(status("parakeet", ServerProcessState.READY, 6006, false));

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo("DEGRADED");
    }

    @Test
    void shouldReportDownWhenServerCrashed() {
        when(whisper.getStatus()).thenReturn(status("whisper", ServerProcessState.DEGRADED, 8178, false));
        when(parakeet.getStatus()).thenReturn(status("parakeet", ServerProcessState.CRASHED, -1, false));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "Local server exited unexpectedly");
    }

    @Test
    void shouldIncludeStreamingDetail() {
        when(whisper.getStatus()).thenReturn(status("whisper", ServerProcessState.STOPPED, -1, false));
        when(parakeet.getStatus()).thenReturn(status("parakeet", ServerProcessState.STOPPED, -1, false));

        @SuppressWarnings("unchecked")
        Map<String, Object> detail = (Map<String, Object>) indicator.health().getDetails().get("streaming");

        assertThat(detail)
                .containsEntry("state", "WARM_IDLE")
                .containsEntry("warmConnection", true)
                .containsEntry("credentialValid", true);
    }

    private static ServerStatus status(String backend, ServerProcessState state, int port, boolean gpu) {
        return new ServerStatus(backend, true, state, port, port > 0 ? "/models/m.bin" : null, gpu);
    }
}
