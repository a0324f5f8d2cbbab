package com.phillippitts.ellie.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the embedded voice client (capture, session transport, text fallback).
 * The client beans are only created when {@code ellie.client.enabled=true}.
 */
@ConfigurationProperties(prefix = "ellie.client")
public class ClientProperties {

    private boolean enabled = false;
    private String serverUrl = "ws://localhost:8080/ws/voice";
    private String httpBaseUrl = "http://localhost:8080";
    private long connectTimeoutMs = 10_000;

    /** How long a sent {@code voice-input} waits for its terminal event. */
    private long responseTimeoutMs = 30_000;

    /** Capture or transport faults in a row that switch the client to text mode. */
    private int maxVoiceFailures = 3;

    private Reconnect reconnect = new Reconnect();
    private Capture capture = new Capture();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getHttpBaseUrl() {
        return httpBaseUrl;
    }

    public void setHttpBaseUrl(String httpBaseUrl) {
        this.httpBaseUrl = httpBaseUrl;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getResponseTimeoutMs() {
        return responseTimeoutMs;
    }

    public void setResponseTimeoutMs(long responseTimeoutMs) {
        this.responseTimeoutMs = responseTimeoutMs;
    }

    public int getMaxVoiceFailures() {
        return maxVoiceFailures;
    }

    public void setMaxVoiceFailures(int maxVoiceFailures) {
        this.maxVoiceFailures = maxVoiceFailures;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public void setReconnect(Reconnect reconnect) {
        this.reconnect = reconnect;
    }

    public Capture getCapture() {
        return capture;
    }

    public void setCapture(Capture capture) {
        this.capture = capture;
    }

    /**
     * Exponential backoff for automatic reconnects.
     */
    public static class Reconnect {
        private long initialDelayMs = 1_000;
        private long maxDelayMs = 5_000;
        private double multiplier = 2.0;
        private int maxAttempts = 5;

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    /**
     * Microphone capture settings. Audio is PCM16LE mono and sent as WAV.
     */
    public static class Capture {
        private String deviceName;
        private int sampleRate = 16_000;
        private int chunkMillis = 40;
        private int maxDurationMs = 30_000;

        /** Limit on waiting for the microphone to open, permission prompt included; 0 waits indefinitely. */
        private long permissionWaitMs = 0;

        public String getDeviceName() {
            return deviceName;
        }

        public void setDeviceName(String deviceName) {
            this.deviceName = deviceName;
        }

        public int getSampleRate() {
            return sampleRate;
        }

        public void setSampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
        }

        public int getChunkMillis() {
            return chunkMillis;
        }

        public void setChunkMillis(int chunkMillis) {
            this.chunkMillis = chunkMillis;
        }

        public int getMaxDurationMs() {
            return maxDurationMs;
        }

        public void setMaxDurationMs(int maxDurationMs) {
            this.maxDurationMs = maxDurationMs;
        }

        public long getPermissionWaitMs() {
            return permissionWaitMs;
        }

        public void setPermissionWaitMs(long permissionWaitMs) {
            this.permissionWaitMs = permissionWaitMs;
        }
    }
}
