package com.phillippitts.ellie.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints, credentials and model parameters for the upstream providers.
 *
 * <p>API keys are read from the environment ({@code OPENAI_API_KEY}, {@code GROQ_API_KEY}) via
 * {@code application.properties} placeholders. A provider without a key is reported unavailable
 * and its turns go straight to the next fallback step.
 */
@ConfigurationProperties(prefix = "ellie.providers")
public class ProviderProperties {

    private Endpoint transcription = new Endpoint("https://api.openai.com", "whisper-1");
    private ChatEndpoint fast = new ChatEndpoint("https://api.groq.com/openai", "llama3-8b-8192", 0.7, 500);
    private ChatEndpoint accurate = new ChatEndpoint("https://api.openai.com", "gpt-3.5-turbo", 0.6, 600);
    private SynthesisEndpoint synthesis = new SynthesisEndpoint();
    private Http http = new Http();

    public Endpoint getTranscription() {
        return transcription;
    }

    public void setTranscription(Endpoint transcription) {
        this.transcription = transcription;
    }

    public ChatEndpoint getFast() {
        return fast;
    }

    public void setFast(ChatEndpoint fast) {
        this.fast = fast;
    }

    public ChatEndpoint getAccurate() {
        return accurate;
    }

    public void setAccurate(ChatEndpoint accurate) {
        this.accurate = accurate;
    }

    public SynthesisEndpoint getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(SynthesisEndpoint synthesis) {
        this.synthesis = synthesis;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    /**
     * Base URL, key and model of one provider.
     */
    public static class Endpoint {
        private String baseUrl;
        private String apiKey;
        private String model;

        public Endpoint() {
        }

        Endpoint(String baseUrl, String model) {
            this.baseUrl = baseUrl;
            this.model = model;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    /**
     * OpenAI-compatible chat completion endpoint.
     */
    public static class ChatEndpoint extends Endpoint {
        private double temperature = 0.7;
        private int maxTokens = 500;

        public ChatEndpoint() {
        }

        ChatEndpoint(String baseUrl, String model, double temperature, int maxTokens) {
            super(baseUrl, model);
            this.temperature = temperature;
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }
    }

    /**
     * Text-to-speech endpoint and default voice parameters.
     */
    public static class SynthesisEndpoint extends Endpoint {
        private String voice = "nova";
        private double speed = 1.0;
        private String responseFormat = "mp3";
        private int maxInputChars = 4096;

        public SynthesisEndpoint() {
            super("https://api.openai.com", "tts-1");
        }

        public String getVoice() {
            return voice;
        }

        public void setVoice(String voice) {
            this.voice = voice;
        }

        public double getSpeed() {
            return speed;
        }

        public void setSpeed(double speed) {
            this.speed = speed;
        }

        public String getResponseFormat() {
            return responseFormat;
        }

        public void setResponseFormat(String responseFormat) {
            this.responseFormat = responseFormat;
        }

        public int getMaxInputChars() {
            return maxInputChars;
        }

        public void setMaxInputChars(int maxInputChars) {
            this.maxInputChars = maxInputChars;
        }
    }

    /**
     * Shared HTTP client settings.
     */
    public static class Http {
        private int maxConnections = 50;
        private int pendingAcquireTimeoutSeconds = 30;
        private int responseTimeoutSeconds = 60;
        private int maxInMemorySizeBytes = 25 * 1024 * 1024;

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public int getPendingAcquireTimeoutSeconds() {
            return pendingAcquireTimeoutSeconds;
        }

        public void setPendingAcquireTimeoutSeconds(int pendingAcquireTimeoutSeconds) {
            this.pendingAcquireTimeoutSeconds = pendingAcquireTimeoutSeconds;
        }

        public int getResponseTimeoutSeconds() {
            return responseTimeoutSeconds;
        }

        public void setResponseTimeoutSeconds(int responseTimeoutSeconds) {
            this.responseTimeoutSeconds = responseTimeoutSeconds;
        }

        public int getMaxInMemorySizeBytes() {
            return maxInMemorySizeBytes;
        }

        public void setMaxInMemorySizeBytes(int maxInMemorySizeBytes) {
            this.maxInMemorySizeBytes = maxInMemorySizeBytes;
        }
    }
}
