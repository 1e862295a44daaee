package fr.lapetina.aitranslation.fanout;

import fr.lapetina.aitranslation.domain.consensus.ConsensusBuilder;
import fr.lapetina.aitranslation.domain.exception.AllProvidersFailedException;
import fr.lapetina.aitranslation.domain.exception.NoProvidersAvailableException;
import fr.lapetina.aitranslation.domain.model.CandidateResult;
import fr.lapetina.aitranslation.domain.model.ConsensusResult;
import fr.lapetina.aitranslation.domain.model.ProviderDescriptor;
import fr.lapetina.aitranslation.domain.model.ProviderStatusSnapshot;
import fr.lapetina.aitranslation.domain.selection.ProviderSelector;
import fr.lapetina.aitranslation.infrastructure.credential.CredentialPool;
import fr.lapetina.aitranslation.infrastructure.credential.PoolStatus;
import fr.lapetina.aitranslation.infrastructure.health.ProviderHealthTracker;
import fr.lapetina.aitranslation.infrastructure.health.ProviderRegistry;
import fr.lapetina.aitranslation.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Entry point of the gateway: select, fan out, reconcile.
 */
public final class TranslationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TranslationOrchestrator.class);

    static final String MDC_REQUEST_ID = "requestId";

    private final ProviderSelector selector;
    private final TranslationFanOut fanOut;
    private final ConsensusBuilder consensusBuilder;
    private final ProviderRegistry registry;
    private final ProviderHealthTracker healthTracker;
    private final Map<String, CredentialPool> pools;
    private final MetricsRegistry metrics;
    private volatile int maxTextLength;

    public TranslationOrchestrator(
            ProviderSelector selector,
            TranslationFanOut fanOut,
            ConsensusBuilder consensusBuilder,
            ProviderRegistry registry,
            ProviderHealthTracker healthTracker,
            Map<String, CredentialPool> pools,
            MetricsRegistry metrics,
            int maxTextLength
    ) {
        this.selector = selector;
        this.fanOut = fanOut;
        this.consensusBuilder = consensusBuilder;
        this.registry = registry;
        this.healthTracker = healthTracker;
        this.pools = pools;
        this.metrics = metrics;
        this.maxTextLength = maxTextLength;
    }

    public ConsensusResult translate(String text, String context, int maxProviders) {
        return translate(text, context, maxProviders, CancellationToken.none());
    }

    /**
     * Translates {@code text} with up to {@code maxProviders} providers.
     *
     * @throws IllegalArgumentException     for blank or oversized text, or {@code maxProviders < 1}
     * @throws NoProvidersAvailableException when nothing can be called right now
     * @throws AllProvidersFailedException   when every selected provider failed
     */
    public ConsensusResult translate(String text, String context, int maxProviders, CancellationToken token) {
        validate(text, maxProviders);

        String previousRequestId = MDC.get(MDC_REQUEST_ID);
        if (previousRequestId == null) {
            MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());
        }
        Instant start = Instant.now();
        try {
            List<String> selected = selector.select(maxProviders);
            if (selected.isEmpty()) {
                metrics.incrementTranslation("no_providers");
                throw new NoProvidersAvailableException();
            }
            log.info("Translation started: textLength={}, providers={}", text.length(), selected);

            List<CandidateResult> candidates = fanOut.translateAll(text, context, selected, token);
            if (candidates.isEmpty()) {
                metrics.incrementTranslation("failed");
                log.warn("All selected providers failed: providers={}", selected);
                throw new AllProvidersFailedException(selected);
            }

            ConsensusResult result = consensusBuilder.build(candidates);
            if (result.consensus()) {
                metrics.recordAgreement(result.modelAgreement());
                metrics.incrementTranslation("consensus");
            } else {
                metrics.incrementTranslation("single");
            }

            Duration latency = Duration.between(start, Instant.now());
            metrics.recordTranslationLatency(latency);
            log.info("Translation complete: selected={}, confidence={}, consensus={}, agreement={}, models={}, latencyMs={}",
                    result.selectedProviderId(), result.confidence(), result.consensus(),
                    result.modelAgreement(), result.modelsUsed(), latency.toMillis());
            return result;
        } finally {
            if (previousRequestId == null) {
                MDC.remove(MDC_REQUEST_ID);
            }
        }
    }

    private void validate(String text, int maxProviders) {
        if (text == null || text.isBlank()) {
            metrics.incrementTranslation("invalid");
            throw new IllegalArgumentException("Text is required");
        }
        if (maxProviders < 1) {
            metrics.incrementTranslation("invalid");
            throw new IllegalArgumentException("maxProviders must be at least 1: " + maxProviders);
        }
        if (text.length() > maxTextLength) {
            metrics.incrementTranslation("invalid");
            throw new IllegalArgumentException(
                    "Text too long: " + text.length() + " characters (max " + maxTextLength + ")");
        }
    }

    /**
     * Status of every registered provider, in registration order.
     */
    public Map<String, ProviderStatusSnapshot> providerStatusSnapshot() {
        Map<String, ProviderStatusSnapshot> snapshot = new LinkedHashMap<>();
        for (ProviderDescriptor descriptor : registry.getAll()) {
            snapshot.put(descriptor.getId(), healthTracker.snapshot(descriptor));
        }
        return snapshot;
    }

    /**
     * Status of every credential pool, by pool name.
     */
    public Map<String, PoolStatus> poolStatusSnapshot() {
        Map<String, PoolStatus> snapshot = new LinkedHashMap<>();
        new TreeMap<>(pools).forEach((name, pool) -> snapshot.put(name, pool.status()));
        return snapshot;
    }

    public void setMaxTextLength(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }
}
