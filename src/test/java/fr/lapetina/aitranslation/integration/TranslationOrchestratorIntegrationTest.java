package fr.lapetina.aitranslation.integration;

import fr.lapetina.aitranslation.domain.exception.AllProvidersFailedException;
import fr.lapetina.aitranslation.domain.exception.NoProvidersAvailableException;
import fr.lapetina.aitranslation.domain.model.ConsensusResult;
import fr.lapetina.aitranslation.domain.model.ProviderStatus;
import fr.lapetina.aitranslation.domain.model.ProviderStatusSnapshot;
import fr.lapetina.aitranslation.fanout.TranslationOrchestrator;
import fr.lapetina.aitranslation.infrastructure.credential.PoolStatus;
import fr.lapetina.aitranslation.testutil.StubProviderHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

class TranslationOrchestratorIntegrationTest {

    private static final String TEXT = "སེམས་ཀྱི་རང་བཞིན་འོད་གསལ་བ།";

    private TestOrchestratorFactory factory;
    private TranslationOrchestrator orchestrator;
    private StubProviderHttpClient providers;

    @BeforeEach
    void setUp() {
        factory = TestOrchestratorFactory.create();
        factory.start();
        orchestrator = factory.getOrchestrator();
        providers = factory.getHttpClient();
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Test
    @DisplayName("should register only providers with a resolvable key")
    void shouldSkipProviderWithoutKey() {
        assertThat(factory.getProviderRegistry().size()).isEqualTo(3);
        assertThat(factory.getProviderRegistry().get("groq-no-key")).isEmpty();
        assertThat(factory.getProviderRegistry().get("cerebras-c").orElseThrow().getApiKey())
                .isEqualTo("test-cerebras-key");
    }

    @Nested
    @DisplayName("consensus")
    class Consensus {

        @Test
        @DisplayName("should agree fully when every provider returns the same translation")
        void shouldReachConsensus() {
            ConsensusResult result = orchestrator.translate(TEXT, null, 3);

            assertThat(result.consensus()).isTrue();
            assertThat(result.modelsUsed()).containsExactly("groq-a", "openrouter-b", "cerebras-c");
            assertThat(result.modelAgreement()).isCloseTo(1.0, within(1e-6));
            assertThat(result.translation()).isEqualTo(StubProviderHttpClient.DEFAULT_TRANSLATION);
            assertThat(result.confidence()).isGreaterThan(0.83).isLessThanOrEqualTo(0.95);
            assertThat(result.selectedProviderId()).isEqualTo("groq-a");
            assertThat(result.totalTokensUsed()).isEqualTo(300);
        }

        @Test
        @DisplayName("should honour the requested provider count")
        void shouldLimitProviders() {
            ConsensusResult result = orchestrator.translate(TEXT, null, 2);

            assertThat(result.modelsUsed()).containsExactly("groq-a", "openrouter-b");
            assertThat(providers.getCalls()).hasSize(2);
        }

        @Test
        @DisplayName("should return the single survivor without consensus")
        void shouldReturnSingleCandidate() {
            providers.fail("groq-a", 500, "internal error");
            providers.fail("openrouter-b", 502, "bad gateway");

            ConsensusResult result = orchestrator.translate(TEXT, "Heart sutra commentary", 3);

            assertThat(result.consensus()).isFalse();
            assertThat(result.modelsUsed()).containsExactly("cerebras-c");
            assertThat(result.selectedProviderId()).isEqualTo("cerebras-c");
            assertThat(result.modelAgreement()).isZero();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("should report every attempted provider when all fail")
        void shouldFailWhenAllFail() {
            providers.fail("groq-a", 500, "boom");
            providers.fail("openrouter-b", 503, "unavailable");
            providers.fail("cerebras-c", 500, "boom");

            AllProvidersFailedException failure = catchThrowableOfType(
                    () -> orchestrator.translate(TEXT, null, 3), AllProvidersFailedException.class);

            assertThat(failure).isNotInstanceOf(NoProvidersAvailableException.class);
            assertThat(failure.getAttemptedProviders()).containsExactly("groq-a", "openrouter-b", "cerebras-c");
        }

        @Test
        @DisplayName("should reject invalid input before calling anyone")
        void shouldRejectInvalidInput() {
            assertThatThrownBy(() -> orchestrator.translate("  ", null, 3))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> orchestrator.translate(TEXT, null, 0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> orchestrator.translate("x".repeat(501), null, 3))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("max 500");
            assertThat(providers.getCalls()).isEmpty();
        }

        @Test
        @DisplayName("should run out of providers and recover once cooldowns expire")
        void shouldRecoverAfterRateLimits() {
            providers.fail("groq-a", 429, "Too many requests");
            providers.fail("openrouter-b", 429, "Too many requests");
            providers.fail("cerebras-c", 429, "Too many requests");

            assertThatThrownBy(() -> orchestrator.translate(TEXT, null, 3))
                    .isInstanceOf(AllProvidersFailedException.class);
            // the pool still holds a second key
            assertThatThrownBy(() -> orchestrator.translate(TEXT, null, 3))
                    .isInstanceOf(AllProvidersFailedException.class);
            assertThatThrownBy(() -> orchestrator.translate(TEXT, null, 3))
                    .isInstanceOf(NoProvidersAvailableException.class);

            providers.clear();
            factory.getClock().advance(Duration.ofSeconds(61));

            ConsensusResult result = orchestrator.translate(TEXT, null, 3);
            assertThat(result.modelsUsed()).containsExactly("groq-a", "cerebras-c");

            factory.getClock().advance(Duration.ofMinutes(15));
            assertThat(orchestrator.translate(TEXT, null, 3).modelsUsed())
                    .containsExactly("groq-a", "openrouter-b", "cerebras-c");
        }

        @Test
        @DisplayName("should take a provider out permanently on authentication failure")
        void shouldDisableOnAuthFailure() {
            providers.fail("groq-a", 401, "Invalid API Key");

            orchestrator.translate(TEXT, null, 3);
            providers.clear();
            factory.getClock().advance(Duration.ofDays(2));

            assertThat(orchestrator.translate(TEXT, null, 3).modelsUsed())
                    .containsExactly("openrouter-b", "cerebras-c");

            factory.getHealthTracker().reset("groq-a");
            assertThat(orchestrator.translate(TEXT, null, 3).modelsUsed()).contains("groq-a");
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        @DisplayName("should expose provider health and usage")
        void shouldSnapshotProviders() {
            providers.fail("cerebras-c", 429, "Rate limit reached on tokens per minute (TPM). Please try again in 30s.");
            orchestrator.translate(TEXT, null, 3);

            Map<String, ProviderStatusSnapshot> snapshot = orchestrator.providerStatusSnapshot();

            assertThat(snapshot).containsOnlyKeys("groq-a", "openrouter-b", "cerebras-c");
            assertThat(snapshot.get("groq-a").status()).isEqualTo(ProviderStatus.AVAILABLE);
            assertThat(snapshot.get("groq-a").tokensUsedToday()).isEqualTo(100);
            assertThat(snapshot.get("cerebras-c").status()).isEqualTo(ProviderStatus.RATE_LIMITED);
            assertThat(snapshot.get("cerebras-c").available()).isFalse();
            assertThat(snapshot.get("cerebras-c").lastError()).contains("TPM");
        }

        @Test
        @DisplayName("should expose credential pools without key material")
        void shouldSnapshotPools() {
            orchestrator.translate(TEXT, null, 3);

            Map<String, PoolStatus> pools = orchestrator.poolStatusSnapshot();

            assertThat(pools).containsOnlyKeys("openrouter");
            PoolStatus pool = pools.get("openrouter");
            assertThat(pool.totalKeys()).isEqualTo(2);
            assertThat(pool.availableKeys()).isEqualTo(2);
            assertThat(pool.keys()).extracting(PoolStatus.CredentialSnapshot::displayName)
                    .containsExactly("Primary OPENROUTER", "Backup 1");
            assertThat(pool.toString()).doesNotContain("or-key-1");
        }

        @Test
        @DisplayName("should clear daily usage on reset")
        void shouldResetDailyCounters() {
            orchestrator.translate(TEXT, null, 3);

            factory.resetDailyCounters();

            assertThat(orchestrator.providerStatusSnapshot().get("groq-a").tokensUsedToday()).isZero();
            assertThat(orchestrator.poolStatusSnapshot().get("openrouter").keys())
                    .allSatisfy(key -> assertThat(key.callsToday()).isZero());
        }
    }
}
