package fr.lapetina.aitranslation.integration;

import fr.lapetina.aitranslation.OrchestratorFactory;
import fr.lapetina.aitranslation.testutil.MutableClock;
import fr.lapetina.aitranslation.testutil.StubProviderHttpClient;

import java.util.Map;

/**
 * Factory wired to scripted providers, a controllable clock and a fixed environment.
 */
public class TestOrchestratorFactory extends OrchestratorFactory {

    public static final Map<String, String> ENVIRONMENT = Map.of("TEST_CEREBRAS_KEY", "test-cerebras-key");

    private final StubProviderHttpClient httpClient;
    private final MutableClock clock;

    private TestOrchestratorFactory(String configPath, StubProviderHttpClient httpClient, MutableClock clock) {
        super(configPath, httpClient, clock, ENVIRONMENT::get);
        this.httpClient = httpClient;
        this.clock = clock;
    }

    public static TestOrchestratorFactory create() {
        return create("test-config.yaml");
    }

    public static TestOrchestratorFactory create(String configPath) {
        return new TestOrchestratorFactory(configPath, new StubProviderHttpClient(), MutableClock.atEpoch());
    }

    public StubProviderHttpClient getHttpClient() {
        return httpClient;
    }

    public MutableClock getClock() {
        return clock;
    }
}
