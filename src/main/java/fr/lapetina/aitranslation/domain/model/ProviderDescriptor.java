package fr.lapetina.aitranslation.domain.model;

import java.net.URI;
import java.util.Objects;

/**
 * Immutable description of one translation backend (vendor + model).
 * Built once from configuration; a reload replaces the instance.
 *
 * A descriptor carries either its own API key or the name of a
 * credential pool that supplies keys per call.
 */
public final class ProviderDescriptor {
    private final String id;
    private final ProviderFamily family;
    private final ModelFamily modelFamily;
    private final String modelId;
    private final URI endpoint;
    private final int maxTokens;
    private final int contextWindow;
    private final int requestsPerMinute;
    private final int tokensPerMinute;
    private final long dailyTokenBudget;
    private final String apiKey;
    private final String credentialPool;
    private final boolean enabled;

    private ProviderDescriptor(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Provider ID is required");
        this.modelId = Objects.requireNonNull(builder.modelId, "Model ID is required");
        this.endpoint = Objects.requireNonNull(builder.endpoint, "Endpoint is required");
        this.family = builder.family != null ? builder.family : ProviderFamily.fromProviderId(builder.id);
        this.modelFamily = ModelFamily.detect(builder.modelId, builder.id);
        this.maxTokens = builder.maxTokens;
        this.contextWindow = builder.contextWindow;
        this.requestsPerMinute = builder.requestsPerMinute;
        this.tokensPerMinute = builder.tokensPerMinute;
        this.dailyTokenBudget = builder.dailyTokenBudget;
        this.apiKey = builder.apiKey;
        this.credentialPool = builder.credentialPool;
        this.enabled = builder.enabled;
        if (apiKey == null && credentialPool == null) {
            throw new IllegalArgumentException("Provider " + id + " needs an API key or a credential pool");
        }
    }

    public String getId() {
        return id;
    }

    public ProviderFamily getFamily() {
        return family;
    }

    public ModelFamily getModelFamily() {
        return modelFamily;
    }

    public String getModelId() {
        return modelId;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getContextWindow() {
        return contextWindow;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }

    public int getTokensPerMinute() {
        return tokensPerMinute;
    }

    public long getDailyTokenBudget() {
        return dailyTokenBudget;
    }

    /**
     * Dedicated API key, or null when keys come from a credential pool.
     */
    public String getApiKey() {
        return apiKey;
    }

    public String getCredentialPool() {
        return credentialPool;
    }

    public boolean usesCredentialPool() {
        return credentialPool != null;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderDescriptor that = (ProviderDescriptor) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ProviderDescriptor{" +
                "id='" + id + '\'' +
                ", family=" + family +
                ", model='" + modelId + '\'' +
                ", endpoint=" + endpoint +
                (credentialPool != null ? ", pool='" + credentialPool + '\'' : "") +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private ProviderFamily family;
        private String modelId;
        private URI endpoint;
        private int maxTokens = 4000;
        private int contextWindow = 128000;
        private int requestsPerMinute = 30;
        private int tokensPerMinute = 14000;
        private long dailyTokenBudget = 500000;
        private String apiKey;
        private String credentialPool;
        private boolean enabled = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder family(ProviderFamily family) {
            this.family = family;
            return this;
        }

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder endpoint(String url) {
            this.endpoint = URI.create(url);
            return this;
        }

        public Builder endpoint(URI url) {
            this.endpoint = url;
            return this;
        }

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder contextWindow(int contextWindow) {
            this.contextWindow = contextWindow;
            return this;
        }

        public Builder requestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
            return this;
        }

        public Builder tokensPerMinute(int tokensPerMinute) {
            this.tokensPerMinute = tokensPerMinute;
            return this;
        }

        public Builder dailyTokenBudget(long dailyTokenBudget) {
            this.dailyTokenBudget = dailyTokenBudget;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder credentialPool(String credentialPool) {
            this.credentialPool = credentialPool;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public ProviderDescriptor build() {
            return new ProviderDescriptor(this);
        }
    }
}
