package fr.lapetina.aitranslation.infrastructure.metrics;

import fr.lapetina.aitranslation.domain.model.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Translation outcome counters and consensus agreement distribution
 * - Per-provider call counters, failure counters by kind and latency timers
 * - Provider status and pool availability gauges
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> translationCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> callCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final DistributionSummary agreementSummary;
    private final Timer translationTimer;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.agreementSummary = DistributionSummary.builder(prefix + "_consensus_agreement")
                .description("Model agreement of multi-candidate translations")
                .publishPercentiles(0.5, 0.9)
                .register(registry);

        this.translationTimer = Timer.builder(prefix + "_translation_latency")
                .description("End-to-end translation latency")
                .publishPercentileHistogram()
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("ai_translation");
    }

    /**
     * Counts a translation request by outcome (consensus, single, no_providers, failed, invalid).
     */
    public void incrementTranslation(String outcome) {
        translationCounters.computeIfAbsent(outcome, k ->
                Counter.builder(prefix + "_translations_total")
                        .description("Translation requests by outcome")
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordTranslationLatency(Duration latency) {
        translationTimer.record(latency);
    }

    public void recordAgreement(double agreement) {
        agreementSummary.record(agreement);
    }

    /**
     * Counts a provider call by outcome (success, failure, cancelled).
     */
    public void incrementProviderCall(String providerId, String outcome) {
        String key = providerId + ":" + outcome;
        callCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_provider_calls_total")
                        .description("Provider calls by outcome")
                        .tag("provider", providerId)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void incrementProviderFailure(String providerId, FailureKind kind) {
        String key = providerId + ":" + kind.name();
        failureCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_provider_failures_total")
                        .description("Provider failures by kind")
                        .tag("provider", providerId)
                        .tag("kind", kind.name())
                        .register(registry)
        ).increment();
    }

    public void recordProviderLatency(String providerId, Duration latency) {
        latencyTimers.computeIfAbsent(providerId, k ->
                Timer.builder(prefix + "_provider_latency")
                        .description("Provider call latency")
                        .tag("provider", providerId)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Registers a gauge for provider status (0=DISABLED, 1=RATE_LIMITED, 2=AVAILABLE).
     */
    public void registerProviderStatus(String providerId, Supplier<Number> statusValue) {
        Gauge.builder(prefix + "_provider_status", statusValue, s -> s.get().doubleValue())
                .description("Provider status (0=DISABLED, 1=RATE_LIMITED, 2=AVAILABLE)")
                .tag("provider", providerId)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Registers a gauge for the number of available keys in a credential pool.
     */
    public void registerPoolAvailableKeys(String poolName, Supplier<Number> availableKeys) {
        Gauge.builder(prefix + "_pool_available_keys", availableKeys, s -> s.get().doubleValue())
                .description("Available credentials per pool")
                .tag("pool", poolName)
                .strongReference(true)
                .register(registry);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
