package fr.lapetina.aitranslation.infrastructure.metrics;

import fr.lapetina.aitranslation.domain.model.FailureKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("gateway_test");
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should keep reporting gauges after garbage collection")
    void shouldKeepGaugesAcrossGc() {
        AtomicInteger keys = new AtomicInteger(2);
        metrics.registerProviderStatus("groq-a", () -> 2);
        metrics.registerPoolAvailableKeys("openrouter", keys::get);

        for (int i = 0; i < 5; i++) {
            System.gc();
        }
        keys.set(1);

        String scrape = metrics.scrape();
        assertThat(scrape).contains("gateway_test_provider_status{provider=\"groq-a\",} 2.0");
        assertThat(scrape).contains("gateway_test_pool_available_keys{pool=\"openrouter\",} 1.0");
    }

    @Test
    @DisplayName("should count outcomes and failures with tags")
    void shouldCountWithTags() {
        metrics.incrementTranslation("consensus");
        metrics.incrementProviderCall("groq-a", "success");
        metrics.incrementProviderFailure("cerebras-c", FailureKind.AUTHENTICATION);
        metrics.recordProviderLatency("groq-a", Duration.ofMillis(250));
        metrics.recordAgreement(0.9);

        assertThat(metrics.scrape())
                .contains("gateway_test_translations_total{outcome=\"consensus\",} 1.0")
                .contains("gateway_test_provider_calls_total{outcome=\"success\",provider=\"groq-a\",} 1.0")
                .contains("gateway_test_provider_failures_total{kind=\"AUTHENTICATION\",provider=\"cerebras-c\",} 1.0")
                .contains("gateway_test_consensus_agreement_count");
    }
}
