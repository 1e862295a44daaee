package fr.lapetina.aitranslation.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the translation gateway.
 * Designed to be populated from YAML.
 */
public class TranslationConfig {

    private ServerConfig server = new ServerConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private List<String> priorityOrder = new ArrayList<>();
    private List<CredentialPoolConfig> credentialPools = new ArrayList<>();
    private SelectionConfig selection = new SelectionConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private ClassificationConfig classification = new ClassificationConfig();
    private ConsensusConfig consensus = new ConsensusConfig();
    private ConfidenceConfig confidence = new ConfidenceConfig();
    private PromptConfig prompt = new PromptConfig();
    private IdentityConfig identity = new IdentityConfig();
    private UsageConfig usage = new UsageConfig();
    private ValidationConfig validation = new ValidationConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public List<String> getPriorityOrder() { return priorityOrder; }
    public void setPriorityOrder(List<String> priorityOrder) { this.priorityOrder = priorityOrder; }

    public List<CredentialPoolConfig> getCredentialPools() { return credentialPools; }
    public void setCredentialPools(List<CredentialPoolConfig> credentialPools) { this.credentialPools = credentialPools; }

    public SelectionConfig getSelection() { return selection; }
    public void setSelection(SelectionConfig selection) { this.selection = selection; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public ClassificationConfig getClassification() { return classification; }
    public void setClassification(ClassificationConfig classification) { this.classification = classification; }

    public ConsensusConfig getConsensus() { return consensus; }
    public void setConsensus(ConsensusConfig consensus) { this.consensus = consensus; }

    public ConfidenceConfig getConfidence() { return confidence; }
    public void setConfidence(ConfidenceConfig confidence) { this.confidence = confidence; }

    public PromptConfig getPrompt() { return prompt; }
    public void setPrompt(PromptConfig prompt) { this.prompt = prompt; }

    public IdentityConfig getIdentity() { return identity; }
    public void setIdentity(IdentityConfig identity) { this.identity = identity; }

    public UsageConfig getUsage() { return usage; }
    public void setUsage(UsageConfig usage) { this.usage = usage; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * One chat-completion backend.
     * Give either {@code apiKey}, {@code apiKeyEnv} or {@code credentialPool}.
     */
    public static class ProviderConfig {
        private String id;
        private String family;
        private String modelId;
        private String endpoint;
        private int maxTokens = 4000;
        private int contextWindow = 128000;
        private int requestsPerMinute = 30;
        private int tokensPerMinute = 14000;
        private long dailyTokenBudget = 500000;
        private String apiKey;
        private String apiKeyEnv;
        private String credentialPool;
        private boolean enabled = true;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getFamily() { return family; }
        public void setFamily(String family) { this.family = family; }

        public String getModelId() { return modelId; }
        public void setModelId(String modelId) { this.modelId = modelId; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public int getContextWindow() { return contextWindow; }
        public void setContextWindow(int contextWindow) { this.contextWindow = contextWindow; }

        public int getRequestsPerMinute() { return requestsPerMinute; }
        public void setRequestsPerMinute(int requestsPerMinute) { this.requestsPerMinute = requestsPerMinute; }

        public int getTokensPerMinute() { return tokensPerMinute; }
        public void setTokensPerMinute(int tokensPerMinute) { this.tokensPerMinute = tokensPerMinute; }

        public long getDailyTokenBudget() { return dailyTokenBudget; }
        public void setDailyTokenBudget(long dailyTokenBudget) { this.dailyTokenBudget = dailyTokenBudget; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public String getCredentialPool() { return credentialPool; }
        public void setCredentialPool(String credentialPool) { this.credentialPool = credentialPool; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * A named set of interchangeable keys.
     */
    public static class CredentialPoolConfig {
        private String name;
        private long defaultCooldownSeconds = 900;
        private List<KeyConfig> keys = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public long getDefaultCooldownSeconds() { return defaultCooldownSeconds; }
        public void setDefaultCooldownSeconds(long defaultCooldownSeconds) { this.defaultCooldownSeconds = defaultCooldownSeconds; }

        public List<KeyConfig> getKeys() { return keys; }
        public void setKeys(List<KeyConfig> keys) { this.keys = keys; }
    }

    /**
     * One key of a pool, inline or by environment variable.
     */
    public static class KeyConfig {
        private String displayName;
        private String key;
        private String keyEnv;

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public String getKey() { return key; }
        public void setKey(String key) { this.key = key; }

        public String getKeyEnv() { return keyEnv; }
        public void setKeyEnv(String keyEnv) { this.keyEnv = keyEnv; }
    }

    /**
     * Provider selection defaults.
     */
    public static class SelectionConfig {
        private int maxProviders = 3;

        public int getMaxProviders() { return maxProviders; }
        public void setMaxProviders(int maxProviders) { this.maxProviders = maxProviders; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long requestTimeoutMs = 60000;
        private long connectTimeoutMs = 10000;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Default cooldowns when a rate-limit error carries no retry hint.
     */
    public static class ClassificationConfig {
        private long perMinuteCooldownSeconds = 60;
        private long dailyCooldownSeconds = 86400;

        public long getPerMinuteCooldownSeconds() { return perMinuteCooldownSeconds; }
        public void setPerMinuteCooldownSeconds(long seconds) { this.perMinuteCooldownSeconds = seconds; }

        public long getDailyCooldownSeconds() { return dailyCooldownSeconds; }
        public void setDailyCooldownSeconds(long seconds) { this.dailyCooldownSeconds = seconds; }
    }

    /**
     * Consensus scoring.
     */
    public static class ConsensusConfig {
        private double boostFactor = 0.08;
        private double confidenceCap = 0.95;
        private EmbeddingConfig embedding = new EmbeddingConfig();

        public double getBoostFactor() { return boostFactor; }
        public void setBoostFactor(double boostFactor) { this.boostFactor = boostFactor; }

        public double getConfidenceCap() { return confidenceCap; }
        public void setConfidenceCap(double confidenceCap) { this.confidenceCap = confidenceCap; }

        public EmbeddingConfig getEmbedding() { return embedding; }
        public void setEmbedding(EmbeddingConfig embedding) { this.embedding = embedding; }
    }

    /**
     * Embedding backend: {@code local} (hash based) or {@code openai}.
     */
    public static class EmbeddingConfig {
        private String type = "local";
        private int dimension = 768;
        private String seed = "ai-translation-gateway";
        private String endpoint = "https://api.openai.com/v1/embeddings";
        private String model = "text-embedding-3-small";
        private String apiKey;
        private String apiKeyEnv;
        private long timeoutMs = 30000;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public int getDimension() { return dimension; }
        public void setDimension(int dimension) { this.dimension = dimension; }

        public String getSeed() { return seed; }
        public void setSeed(String seed) { this.seed = seed; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    /**
     * Candidate confidence heuristic.
     */
    public static class ConfidenceConfig {
        private String sourceScript = "TIBETAN";

        public String getSourceScript() { return sourceScript; }
        public void setSourceScript(String sourceScript) { this.sourceScript = sourceScript; }
    }

    /**
     * Languages used by the default prompt template.
     */
    public static class PromptConfig {
        private String sourceLanguage = "Tibetan";
        private String targetLanguage = "English";

        public String getSourceLanguage() { return sourceLanguage; }
        public void setSourceLanguage(String sourceLanguage) { this.sourceLanguage = sourceLanguage; }

        public String getTargetLanguage() { return targetLanguage; }
        public void setTargetLanguage(String targetLanguage) { this.targetLanguage = targetLanguage; }
    }

    /**
     * Identification headers some providers require.
     */
    public static class IdentityConfig {
        private String referer = "https://translation-gateway.local";
        private String title = "AI Translation Gateway";
        private String userAgent = "AiTranslationGateway/1.0";

        public String getReferer() { return referer; }
        public void setReferer(String referer) { this.referer = referer; }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
    }

    /**
     * Daily usage accounting.
     */
    public static class UsageConfig {
        private String dailyResetZone = "UTC";

        public String getDailyResetZone() { return dailyResetZone; }
        public void setDailyResetZone(String dailyResetZone) { this.dailyResetZone = dailyResetZone; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxTextLength = 20000;

        public int getMaxTextLength() { return maxTextLength; }
        public void setMaxTextLength(int maxTextLength) { this.maxTextLength = maxTextLength; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ai_translation";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
