package com.phillippitts.dictation.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the remote real-time streaming session.
 * Binds to properties prefixed with "stt.streaming".
 */
@ConfigurationProperties(prefix = "stt.streaming")
@Validated
public class StreamingProperties {

    /** WebSocket endpoint of the real-time ASR service. */
    @NotBlank(message = "Streaming endpoint must not be blank")
    private String endpoint = "wss://api.deepgram.com/v1/listen";

    /** Interval between keepalive frames on idle sockets. */
    @Positive(message = "Keepalive interval must be positive")
    private int keepaliveIntervalMs = 3000;

    /** Length of the silence frame sent on warm sockets. */
    @Positive(message = "Silence frame length must be positive")
    private int silenceFrameMs = 100;

    /** Window after adopting a warm socket in which a transcript must arrive. */
    @Positive(message = "Liveness timeout must be positive")
    private int livenessTimeoutMs = 2500;

    /** Upper bound on opening a socket. */
    @Positive(message = "Connect timeout must be positive")
    private int connectTimeoutMs = 30_000;

    /** Upper bound on waiting for the server to acknowledge CloseStream. */
    @Positive(message = "Termination timeout must be positive")
    private int terminationTimeoutMs = 5000;

    /** Server-side token validity window. */
    @Positive(message = "Token expiry must be positive")
    private int tokenExpirySeconds = 300;

    /** Margin before expiry at which a token stops being reused. */
    @Positive(message = "Refresh buffer must be positive")
    private int refreshBufferSeconds = 30;

    /** First re-warm delay; doubles per attempt. */
    @Positive(message = "Re-warm base delay must be positive")
    private int rewarmBaseDelayMs = 2000;

    /** Cap on the re-warm delay. */
    @Positive(message = "Re-warm max delay must be positive")
    private int rewarmMaxDelayMs = 60_000;

    /** Re-warm attempts before pre-warming is abandoned until the next caller warmup. */
    @Positive(message = "Max re-warm attempts must be positive")
    private int maxRewarmAttempts = 10;

    /**
     * Static credential used when the host application provides no {@code TokenRefresher} bean.
     * Blank disables the streaming backend's default credential source.
     */
    private String apiToken = "";

    /** Seconds of audio the cold-start and replay buffers hold. */
    @Positive(message = "Cold start buffer seconds must be positive")
    private int coldStartBufferSeconds = 3;

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public int getKeepaliveIntervalMs() {
        return keepaliveIntervalMs;
    }

    public void setKeepaliveIntervalMs(int keepaliveIntervalMs) {
        this.keepaliveIntervalMs = keepaliveIntervalMs;
    }

    public int getSilenceFrameMs() {
        return silenceFrameMs;
    }

    public void setSilenceFrameMs(int silenceFrameMs) {
        this.silenceFrameMs = silenceFrameMs;
    }

    public int getLivenessTimeoutMs() {
        return livenessTimeoutMs;
    }

    public void setLivenessTimeoutMs(int livenessTimeoutMs) {
        this.livenessTimeoutMs = livenessTimeoutMs;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getTerminationTimeoutMs() {
        return terminationTimeoutMs;
    }

    public void setTerminationTimeoutMs(int terminationTimeoutMs) {
        this.terminationTimeoutMs = terminationTimeoutMs;
    }

    public int getTokenExpirySeconds() {
        return tokenExpirySeconds;
    }

    public void setTokenExpirySeconds(int tokenExpirySeconds) {
        this.tokenExpirySeconds = tokenExpirySeconds;
    }

    public int getRefreshBufferSeconds() {
        return refreshBufferSeconds;
    }

    public void setRefreshBufferSeconds(int refreshBufferSeconds) {
        this.refreshBufferSeconds = refreshBufferSeconds;
    }

    public int getRewarmBaseDelayMs() {
        return rewarmBaseDelayMs;
    }

    public void setRewarmBaseDelayMs(int rewarmBaseDelayMs) {
        this.rewarmBaseDelayMs = rewarmBaseDelayMs;
    }

    public int getRewarmMaxDelayMs() {
        return rewarmMaxDelayMs;
    }

    public void setRewarmMaxDelayMs(int rewarmMaxDelayMs) {
        this.rewarmMaxDelayMs = rewarmMaxDelayMs;
    }

    public int getMaxRewarmAttempts() {
        return maxRewarmAttempts;
    }

    public void setMaxRewarmAttempts(int maxRewarmAttempts) {
        this.maxRewarmAttempts = maxRewarmAttempts;
    }

    public int getColdStartBufferSeconds() {
        return coldStartBufferSeconds;
    }

    public void setColdStartBufferSeconds(int coldStartBufferSeconds) {
        this.coldStartBufferSeconds = coldStartBufferSeconds;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }
}
