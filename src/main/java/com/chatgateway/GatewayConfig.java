package com.chatgateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.chatgateway.models.ModelDescriptor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway tuning and provider wiring. Bundled defaults come from the classpath resource
 * {@code gateway.json}; an operator file passed with {@code --config} is overlaid field by field.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GatewayConfig {

    public static final String DEFAULT_RESOURCE = "/gateway.json";

    private int maxTokens = 10000;
    private int maxTurns = 100;
    private int perUserQueueDepth = 2;
    private int globalConcurrencyLimit = 8;
    private long requestTimeoutMs = 100_000L;
    private long responseTimeoutMs = 0L;
    private long streamKeepAliveMs = 1_000L;
    private boolean restrictToAuthorizedUsers;
    private String defaultSystemPrompt = "You are a helpful assistant.";
    private String defaultModel;
    private int initialCredit = 0;
    private String adminKey;
    private RetrySettings retry = new RetrySettings();
    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();
    private List<ModelDescriptor> models = new ArrayList<>();

    public static GatewayConfig load(ObjectMapper mapper, Path overrideFile) throws IOException {
        GatewayConfig config;
        try (InputStream in = GatewayConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            config = in != null ? mapper.readValue(in, GatewayConfig.class) : new GatewayConfig();
        }
        if (overrideFile != null) {
            if (!Files.exists(overrideFile)) {
                throw new IOException("Configuration file not found: " + overrideFile);
            }
            config = mapper.readerForUpdating(config).readValue(overrideFile.toFile());
        }
        config.validate();
        return config;
    }

    public void validate() {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be > 0");
        }
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("maxTurns must be > 0");
        }
        if (perUserQueueDepth < 0) {
            throw new IllegalArgumentException("perUserQueueDepth must be >= 0");
        }
        if (globalConcurrencyLimit <= 0) {
            throw new IllegalArgumentException("globalConcurrencyLimit must be > 0");
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("requestTimeoutMs must be > 0");
        }
        if (responseTimeoutMs < 0) {
            throw new IllegalArgumentException("responseTimeoutMs must be >= 0");
        }
        if (streamKeepAliveMs <= 0) {
            throw new IllegalArgumentException("streamKeepAliveMs must be > 0");
        }
        if (retry == null || retry.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("retry.maxAttempts must be >= 1");
        }
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    public void setMaxTurns(int maxTurns) {
        this.maxTurns = maxTurns;
    }

    public int getPerUserQueueDepth() {
        return perUserQueueDepth;
    }

    public void setPerUserQueueDepth(int perUserQueueDepth) {
        this.perUserQueueDepth = perUserQueueDepth;
    }

    public int getGlobalConcurrencyLimit() {
        return globalConcurrencyLimit;
    }

    public void setGlobalConcurrencyLimit(int globalConcurrencyLimit) {
        this.globalConcurrencyLimit = globalConcurrencyLimit;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    /**
     * How long a non-streaming HTTP caller waits for an outcome before its turn is cancelled.
     * 0 means {@code requestTimeoutMs} plus five seconds.
     */
    public long getResponseTimeoutMs() {
        return responseTimeoutMs > 0 ? responseTimeoutMs : requestTimeoutMs + 5_000L;
    }

    public void setResponseTimeoutMs(long responseTimeoutMs) {
        this.responseTimeoutMs = responseTimeoutMs;
    }

    /**
     * Idle interval after which a streaming response gets a {@code waiting} line.
     */
    public long getStreamKeepAliveMs() {
        return streamKeepAliveMs;
    }

    public void setStreamKeepAliveMs(long streamKeepAliveMs) {
        this.streamKeepAliveMs = streamKeepAliveMs;
    }

    public boolean isRestrictToAuthorizedUsers() {
        return restrictToAuthorizedUsers;
    }

    public void setRestrictToAuthorizedUsers(boolean restrictToAuthorizedUsers) {
        this.restrictToAuthorizedUsers = restrictToAuthorizedUsers;
    }

    public String getDefaultSystemPrompt() {
        return defaultSystemPrompt;
    }

    public void setDefaultSystemPrompt(String defaultSystemPrompt) {
        this.defaultSystemPrompt = defaultSystemPrompt;
    }

    /**
     * Model for users who never chose one; falls back to the first configured model.
     */
    public String getDefaultModel() {
        if ((defaultModel == null || defaultModel.isBlank()) && !models.isEmpty()) {
            return models.get(0).getName();
        }
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public int getInitialCredit() {
        return initialCredit;
    }

    public void setInitialCredit(int initialCredit) {
        this.initialCredit = initialCredit;
    }

    public String getAdminKey() {
        return adminKey;
    }

    public void setAdminKey(String adminKey) {
        this.adminKey = adminKey;
    }

    public RetrySettings getRetry() {
        return retry;
    }

    public void setRetry(RetrySettings retry) {
        this.retry = retry;
    }

    public Map<String, ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderSettings> providers) {
        this.providers = providers != null ? providers : new LinkedHashMap<>();
    }

    public List<ModelDescriptor> getModels() {
        return models;
    }

    public void setModels(List<ModelDescriptor> models) {
        this.models = models != null ? models : new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RetrySettings {
        private int maxAttempts = 3;
        private long initialBackoffMs = 350;
        private long maxBackoffMs = 10_000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }

    /**
     * Connection settings for one backend. {@code type} picks the adapter family
     * (openai-compatible, anthropic, gemini); the map key is the provider name models refer to.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderSettings {
        private String type;
        private String baseUrl;
        private String apiKeyEnv;
        private Integer timeoutMs;
        private Integer maxOutputTokens;
        private Double temperature;
        private Double topP;
        private String systemPreamble;
        private boolean injectTimestamp;
        private String timeZone;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public Integer getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(Integer timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public Integer getMaxOutputTokens() {
            return maxOutputTokens;
        }

        public void setMaxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
        }

        /**
         * Clamped to [0, 2].
         */
        public Double getTemperature() {
            return temperature == null ? null : Math.max(0.0, Math.min(2.0, temperature));
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        /**
         * Clamped to [0, 1].
         */
        public Double getTopP() {
            return topP == null ? null : Math.max(0.0, Math.min(1.0, topP));
        }

        public void setTopP(Double topP) {
            this.topP = topP;
        }

        public String getSystemPreamble() {
            return systemPreamble;
        }

        public void setSystemPreamble(String systemPreamble) {
            this.systemPreamble = systemPreamble;
        }

        public boolean isInjectTimestamp() {
            return injectTimestamp;
        }

        public void setInjectTimestamp(boolean injectTimestamp) {
            this.injectTimestamp = injectTimestamp;
        }

        public String getTimeZone() {
            return timeZone;
        }

        public void setTimeZone(String timeZone) {
            this.timeZone = timeZone;
        }

        public String resolveApiKey() {
            if (apiKeyEnv == null || apiKeyEnv.isBlank()) {
                return null;
            }
            return System.getenv(apiKeyEnv);
        }
    }
}
