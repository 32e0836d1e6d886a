package fr.lapetina.codex.summarizer.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the summarizer.
 * Designed to be populated from YAML.
 */
public class SummarizerConfig {

    private List<ModelSettings> models = new ArrayList<>();
    // Legacy single-model form
    private String apiKey;
    private String model;
    private ProcessingConfig processing = new ProcessingConfig();
    private RetryConfig retry = new RetryConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<ModelSettings> getModels() { return models; }
    public void setModels(List<ModelSettings> models) { this.models = models; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public ProcessingConfig getProcessing() { return processing; }
    public void setProcessing(ProcessingConfig processing) { this.processing = processing; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * One entry of the provider chain, in chain order.
     */
    public static class ModelSettings {
        private String provider;
        private String model;
        private String apiKey;
        private String apiKeyEnv;
        private String baseUrl;
        private double temperature = 0.0;
        private int maxTokens = 16000;

        public ModelSettings() {
        }

        public ModelSettings(String provider, String model, String apiKey, int maxTokens) {
            this.provider = provider;
            this.model = model;
            this.apiKey = apiKey;
            this.maxTokens = maxTokens;
        }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
    }

    /**
     * Chunking and worker pool configuration.
     */
    public static class ProcessingConfig {
        private int chunkSize = 2000;
        private int chunkOverlap = 400;
        private int maxChunksPerFile = 10;
        private int maxWorkers = 8;
        private int timeoutSeconds = 30;

        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

        public int getChunkOverlap() { return chunkOverlap; }
        public void setChunkOverlap(int chunkOverlap) { this.chunkOverlap = chunkOverlap; }

        public int getMaxChunksPerFile() { return maxChunksPerFile; }
        public void setMaxChunksPerFile(int maxChunksPerFile) { this.maxChunksPerFile = maxChunksPerFile; }

        public int getMaxWorkers() { return maxWorkers; }
        public void setMaxWorkers(int maxWorkers) { this.maxWorkers = maxWorkers; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    /**
     * Retry and fallback configuration.
     */
    public static class RetryConfig {
        private int attempts = 3;
        private long backoffBaseMs = 1000;
        private boolean fallbackEnabled = true;

        public int getAttempts() { return attempts; }
        public void setAttempts(int attempts) { this.attempts = attempts; }

        public long getBackoffBaseMs() { return backoffBaseMs; }
        public void setBackoffBaseMs(long backoffBaseMs) { this.backoffBaseMs = backoffBaseMs; }

        public boolean isFallbackEnabled() { return fallbackEnabled; }
        public void setFallbackEnabled(boolean fallbackEnabled) { this.fallbackEnabled = fallbackEnabled; }
    }

    /**
     * HTTP timeout configuration.
     */
    public static class TimeoutsConfig {
        private long connectTimeoutMs = 10000;
        private long requestTimeoutMs = 60000;

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "codex";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
