package fr.lapetina.aitranslation;

import fr.lapetina.aitranslation.domain.classification.ErrorClassifier;
import fr.lapetina.aitranslation.domain.confidence.CandidateConfidenceEstimator;
import fr.lapetina.aitranslation.domain.consensus.ConsensusBuilder;
import fr.lapetina.aitranslation.domain.consensus.EmbeddingProvider;
import fr.lapetina.aitranslation.domain.consensus.SemanticAgreement;
import fr.lapetina.aitranslation.domain.model.ProviderDescriptor;
import fr.lapetina.aitranslation.domain.model.ProviderFamily;
import fr.lapetina.aitranslation.domain.selection.ProviderSelector;
import fr.lapetina.aitranslation.fanout.TranslationFanOut;
import fr.lapetina.aitranslation.fanout.TranslationOrchestrator;
import fr.lapetina.aitranslation.infrastructure.config.ConfigLoader;
import fr.lapetina.aitranslation.infrastructure.config.TranslationConfig;
import fr.lapetina.aitranslation.infrastructure.credential.Credential;
import fr.lapetina.aitranslation.infrastructure.credential.CredentialPool;
import fr.lapetina.aitranslation.infrastructure.embedding.LocalHashEmbeddingProvider;
import fr.lapetina.aitranslation.infrastructure.embedding.OpenAiEmbeddingClient;
import fr.lapetina.aitranslation.infrastructure.health.DailyUsageResetter;
import fr.lapetina.aitranslation.infrastructure.health.ProviderHealthTracker;
import fr.lapetina.aitranslation.infrastructure.health.ProviderRegistry;
import fr.lapetina.aitranslation.infrastructure.http.ClientIdentity;
import fr.lapetina.aitranslation.infrastructure.http.DefaultPromptBuilder;
import fr.lapetina.aitranslation.infrastructure.http.ProviderHttpClient;
import fr.lapetina.aitranslation.infrastructure.http.ProviderRequestFactory;
import fr.lapetina.aitranslation.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Factory for creating a fully-wired translation orchestrator from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     ConsensusResult result = factory.getOrchestrator().translate(text, null, 3);
 * }
 * }</pre>
 */
public class OrchestratorFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorFactory.class);

    private final ConfigLoader configLoader;
    private final TranslationConfig config;
    private final Function<String, String> environment;
    private final Clock clock;
    private final MetricsRegistry metricsRegistry;
    private final ProviderRegistry providerRegistry;
    private final ProviderHealthTracker healthTracker;
    private final Map<String, CredentialPool> credentialPools = new ConcurrentHashMap<>();
    private final ProviderHttpClient httpClient;
    private final ProviderSelector selector;
    private final TranslationOrchestrator orchestrator;
    private final DailyUsageResetter dailyUsageResetter;

    protected OrchestratorFactory(
            String configPath,
            ProviderHttpClient httpClientOverride,
            Clock clock,
            Function<String, String> environment
    ) {
        log.info("Initializing OrchestratorFactory from config: {}", configPath);

        this.clock = clock;
        this.environment = environment;

        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        this.providerRegistry = new ProviderRegistry();
        this.healthTracker = new ProviderHealthTracker(clock);
        providerRegistry.addListener(event -> {
            if (event.type() == ProviderRegistry.ProviderRegistryEvent.Type.REMOVED) {
                healthTracker.unregister(event.descriptor().getId());
            } else {
                healthTracker.register(event.descriptor().getId());
            }
        });

        List<ProviderDescriptor> descriptors = buildDescriptors(config);
        credentialPools.putAll(buildCredentialPools(config));
        providerRegistry.replaceAll(descriptors);

        this.httpClient = httpClientOverride != null ? httpClientOverride : createHttpClient();

        ErrorClassifier classifier = new ErrorClassifier(
                Duration.ofSeconds(config.getClassification().getPerMinuteCooldownSeconds()),
                Duration.ofSeconds(config.getClassification().getDailyCooldownSeconds()));

        CandidateConfidenceEstimator estimator = new CandidateConfidenceEstimator(
                Character.UnicodeScript.forName(config.getConfidence().getSourceScript()));

        ConsensusBuilder consensusBuilder = new ConsensusBuilder(
                new SemanticAgreement(createEmbeddingProvider()),
                config.getConsensus().getBoostFactor(),
                config.getConsensus().getConfidenceCap());

        this.selector = new ProviderSelector(providerRegistry, healthTracker, credentialPools,
                config.getPriorityOrder());

        TranslationFanOut fanOut = new TranslationFanOut(providerRegistry, healthTracker, credentialPools,
                classifier, httpClient, estimator, metricsRegistry);

        this.orchestrator = new TranslationOrchestrator(selector, fanOut, consensusBuilder, providerRegistry,
                healthTracker, credentialPools, metricsRegistry, config.getValidation().getMaxTextLength());

        this.dailyUsageResetter = new DailyUsageResetter(this::resetDailyCounters,
                ZoneId.of(config.getUsage().getDailyResetZone()), clock);

        configLoader.addListener(this::onConfigChanged);
        registerMetrics();

        log.info("OrchestratorFactory initialized with {} providers and {} credential pools",
                providerRegistry.size(), credentialPools.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static OrchestratorFactory create(String configPath) {
        return new OrchestratorFactory(configPath, null, Clock.systemUTC(), System::getenv);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static OrchestratorFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the daily reset job and the configuration watcher.
     */
    public OrchestratorFactory start() {
        dailyUsageResetter.start();
        configLoader.startWatching();
        log.info("Orchestrator started");
        return this;
    }

    public TranslationOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public ProviderHealthTracker getHealthTracker() {
        return healthTracker;
    }

    public Map<String, CredentialPool> getCredentialPools() {
        return credentialPools;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public ProviderSelector getSelector() {
        return selector;
    }

    public TranslationConfig getConfig() {
        return configLoader.getCurrentConfig() != null ? configLoader.getCurrentConfig() : config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * Clears daily usage counters of every provider and credential.
     */
    public void resetDailyCounters() {
        healthTracker.resetDailyCounters();
        credentialPools.values().forEach(CredentialPool::resetDailyCounters);
    }

    private ProviderHttpClient createHttpClient() {
        TranslationConfig.IdentityConfig identity = config.getIdentity();
        ProviderRequestFactory requestFactory = new ProviderRequestFactory(
                new DefaultPromptBuilder(config.getPrompt().getSourceLanguage(), config.getPrompt().getTargetLanguage()),
                ProviderHttpClient.defaultObjectMapper(),
                new ClientIdentity(identity.getReferer(), identity.getTitle(), identity.getUserAgent()));
        return new ProviderHttpClient(
                requestFactory,
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()),
                Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()));
    }

    private EmbeddingProvider createEmbeddingProvider() {
        TranslationConfig.EmbeddingConfig embedding = config.getConsensus().getEmbedding();
        if ("openai".equals(embedding.getType().toLowerCase(Locale.ROOT))) {
            String apiKey = resolveSecret(embedding.getApiKey(), embedding.getApiKeyEnv());
            if (apiKey != null) {
                log.info("Using OpenAI-compatible embeddings: endpoint={}, model={}",
                        embedding.getEndpoint(), embedding.getModel());
                return new OpenAiEmbeddingClient(URI.create(embedding.getEndpoint()), embedding.getModel(),
                        apiKey, Duration.ofMillis(embedding.getTimeoutMs()));
            }
            log.warn("No API key for OpenAI embeddings, falling back to local hash embeddings");
        }
        return new LocalHashEmbeddingProvider(embedding.getDimension(), embedding.getSeed());
    }

    private List<ProviderDescriptor> buildDescriptors(TranslationConfig source) {
        List<ProviderDescriptor> descriptors = new ArrayList<>();
        for (TranslationConfig.ProviderConfig providerConfig : source.getProviders()) {
            String apiKey = resolveSecret(providerConfig.getApiKey(), providerConfig.getApiKeyEnv());
            if (apiKey == null && providerConfig.getCredentialPool() == null) {
                log.warn("Provider skipped, no API key configured: providerId={}, apiKeyEnv={}",
                        providerConfig.getId(), providerConfig.getApiKeyEnv());
                continue;
            }
            descriptors.add(ProviderDescriptor.builder()
                    .id(providerConfig.getId())
                    .family(providerConfig.getFamily() != null
                            ? ProviderFamily.fromName(providerConfig.getFamily())
                            : null)
                    .modelId(providerConfig.getModelId())
                    .endpoint(providerConfig.getEndpoint())
                    .maxTokens(providerConfig.getMaxTokens())
                    .contextWindow(providerConfig.getContextWindow())
                    .requestsPerMinute(providerConfig.getRequestsPerMinute())
                    .tokensPerMinute(providerConfig.getTokensPerMinute())
                    .dailyTokenBudget(providerConfig.getDailyTokenBudget())
                    .apiKey(apiKey)
                    .credentialPool(providerConfig.getCredentialPool())
                    .enabled(providerConfig.isEnabled())
                    .build());
        }
        return descriptors;
    }

    private Map<String, CredentialPool> buildCredentialPools(TranslationConfig source) {
        Map<String, CredentialPool> loaded = new HashMap<>();
        for (TranslationConfig.CredentialPoolConfig poolConfig : source.getCredentialPools()) {
            List<Credential> credentials = new ArrayList<>();
            int backupIndex = 1;
            for (TranslationConfig.KeyConfig keyConfig : poolConfig.getKeys()) {
                String key = resolveSecret(keyConfig.getKey(), keyConfig.getKeyEnv());
                if (key == null) {
                    log.warn("Credential skipped, no key configured: pool={}, keyEnv={}",
                            poolConfig.getName(), keyConfig.getKeyEnv());
                    continue;
                }
                String displayName = keyConfig.getDisplayName();
                if (displayName == null) {
                    displayName = credentials.isEmpty()
                            ? "Primary " + poolConfig.getName().toUpperCase(Locale.ROOT)
                            : "Backup " + backupIndex++;
                }
                credentials.add(new Credential(key, displayName));
            }
            loaded.put(poolConfig.getName(), new CredentialPool(poolConfig.getName(), credentials, clock,
                    Duration.ofSeconds(poolConfig.getDefaultCooldownSeconds())));
        }
        return loaded;
    }

    private String resolveSecret(String inline, String envName) {
        if (inline != null && !inline.isBlank()) {
            return inline;
        }
        if (envName != null && !envName.isBlank()) {
            String value = environment.apply(envName);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private void registerMetrics() {
        for (ProviderDescriptor descriptor : providerRegistry.getAll()) {
            String providerId = descriptor.getId();
            metricsRegistry.registerProviderStatus(providerId, () -> healthTracker.getState(providerId)
                    .map(state -> state.getStatus().gaugeValue())
                    .orElse(0));
        }
        for (String poolName : credentialPools.keySet()) {
            metricsRegistry.registerPoolAvailableKeys(poolName, () -> {
                CredentialPool pool = credentialPools.get(poolName);
                return pool != null ? pool.status().availableKeys() : 0;
            });
        }
    }

    private void onConfigChanged(TranslationConfig oldConfig, TranslationConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");

        List<ProviderDescriptor> descriptors;
        Map<String, CredentialPool> pools;
        try {
            descriptors = buildDescriptors(newConfig);
            pools = buildCredentialPools(newConfig);
        } catch (RuntimeException e) {
            log.error("Configuration rejected, keeping the running providers and pools", e);
            return;
        }

        // Credential pool state is rebuilt; provider health state survives for providers that remain.
        credentialPools.keySet().retainAll(pools.keySet());
        credentialPools.putAll(pools);
        providerRegistry.replaceAll(descriptors);
        selector.setPriorityOrder(newConfig.getPriorityOrder());
        orchestrator.setMaxTextLength(newConfig.getValidation().getMaxTextLength());
        registerMetrics();

        log.info("Configuration updates applied");
    }

    @Override
    public void close() {
        log.info("Shutting down OrchestratorFactory...");

        try {
            dailyUsageResetter.close();
        } catch (Exception e) {
            log.warn("Error closing daily usage resetter", e);
        }

        try {
            httpClient.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP client", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        try {
            configLoader.close();
        } catch (Exception e) {
            log.warn("Error closing config loader", e);
        }

        log.info("OrchestratorFactory shut down");
    }
}
