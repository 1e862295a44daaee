package fr.lapetina.aitranslation.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aitranslation.infrastructure.credential.CredentialPool;
import fr.lapetina.aitranslation.integration.TestOrchestratorFactory;
import fr.lapetina.aitranslation.testutil.StubProviderHttpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private static final String TEXT = "སེམས་ཀྱི་རང་བཞིན་འོད་གསལ་བ།";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();

    private TestOrchestratorFactory factory;
    private HttpServer server;
    private StubProviderHttpClient providers;

    @BeforeEach
    void setUp() throws Exception {
        factory = TestOrchestratorFactory.create();
        factory.start();
        providers = factory.getHttpClient();
        server = new HttpServer("127.0.0.1", 0, 10, 2,
                factory.getOrchestrator(),
                factory.getProviderRegistry(),
                factory.getHealthTracker(),
                factory.getSelector(),
                factory.getCredentialPools(),
                factory.getMetricsRegistry(),
                factory.getConfigLoader());
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        factory.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .header("X-Request-ID", "test-request")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://127.0.0.1:" + server.getPort() + path);
    }

    private String translateBody(String text) throws Exception {
        return objectMapper.createObjectNode().put("text", text).toString();
    }

    @Nested
    @DisplayName("POST /v1/translate")
    class Translate {

        @Test
        @DisplayName("should return the consensus result")
        void shouldTranslate() throws Exception {
            HttpResponse<String> response = post("/v1/translate", translateBody(TEXT));

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.path("translation").asText()).isEqualTo(StubProviderHttpClient.DEFAULT_TRANSLATION);
            assertThat(body.path("consensus").asBoolean()).isTrue();
            assertThat(body.path("modelsUsed")).hasSize(3);
            assertThat(body.path("selectedProviderId").asText()).isEqualTo("groq-a");
        }

        @Test
        @DisplayName("should pass maxProviders through")
        void shouldHonourMaxProviders() throws Exception {
            String body = objectMapper.createObjectNode()
                    .put("text", TEXT)
                    .put("maxProviders", 1)
                    .put("context", "Dzogchen instruction")
                    .toString();

            HttpResponse<String> response = post("/v1/translate", body);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(objectMapper.readTree(response.body()).path("consensus").asBoolean()).isFalse();
            assertThat(providers.getCalls()).hasSize(1);
        }

        @Test
        @DisplayName("should reject blank text with 400")
        void shouldRejectBlankText() throws Exception {
            HttpResponse<String> response = post("/v1/translate", translateBody("   "));

            assertThat(response.statusCode()).isEqualTo(400);
            assertThat(objectMapper.readTree(response.body()).path("error").asText()).contains("Text is required");
        }

        @Test
        @DisplayName("should reject malformed JSON with 400")
        void shouldRejectMalformedJson() throws Exception {
            assertThat(post("/v1/translate", "{not json").statusCode()).isEqualTo(400);
        }

        @Test
        @DisplayName("should reject GET with 405")
        void shouldRejectGet() throws Exception {
            assertThat(get("/v1/translate").statusCode()).isEqualTo(405);
        }

        @Test
        @DisplayName("should return 502 with attempted providers when every call fails")
        void shouldReportAllFailed() throws Exception {
            providers.fail("groq-a", 500, "boom");
            providers.fail("openrouter-b", 500, "boom");
            providers.fail("cerebras-c", 500, "boom");

            HttpResponse<String> response = post("/v1/translate", translateBody(TEXT));

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(objectMapper.readTree(response.body()).path("attemptedProviders")).hasSize(3);
        }

        @Test
        @DisplayName("should return 503 when no provider can be called")
        void shouldReportNoProviders() throws Exception {
            factory.getProviderRegistry().getAll().forEach(p -> factory.getHealthTracker()
                    .getState(p.getId()).orElseThrow()
                    .disable("test", "disabled for test", factory.getClock().instant()));

            HttpResponse<String> response = post("/v1/translate", translateBody(TEXT));

            assertThat(response.statusCode()).isEqualTo(503);
        }
    }

    @Nested
    @DisplayName("GET /health")
    class Health {

        @Test
        @DisplayName("should be UP when every provider is available")
        void shouldBeUp() throws Exception {
            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.path("status").asText()).isEqualTo("UP");
            assertThat(body.path("availableProviders").asInt()).isEqualTo(3);
        }

        @Test
        @DisplayName("should be DEGRADED with 200 when some providers are out")
        void shouldBeDegraded() throws Exception {
            providers.fail("groq-a", 401, "Invalid API Key");
            post("/v1/translate", translateBody(TEXT));

            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(objectMapper.readTree(response.body()).path("status").asText()).isEqualTo("DEGRADED");
        }

        @Test
        @DisplayName("should not count a pooled provider whose keys are all out")
        void shouldIgnoreExhaustedPool() throws Exception {
            CredentialPool pool = factory.getCredentialPools().get("openrouter");
            pool.markDisabled(pool.nextAvailable().orElseThrow(), "revoked");
            pool.markDisabled(pool.nextAvailable().orElseThrow(), "revoked");
            assertThat(factory.getHealthTracker().isAvailable("openrouter-b")).isTrue();

            HttpResponse<String> response = get("/health");

            assertThat(response.statusCode()).isEqualTo(200);
            JsonNode body = objectMapper.readTree(response.body());
            assertThat(body.path("status").asText()).isEqualTo("DEGRADED");
            assertThat(body.path("availableProviders").asInt()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("should serve Prometheus metrics")
    void shouldServeMetrics() throws Exception {
        post("/v1/translate", translateBody(TEXT));

        HttpResponse<String> response = get("/metrics");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("ai_translation_translations_total");
    }

    @Nested
    @DisplayName("/admin")
    class Admin {

        @Test
        @DisplayName("should list providers and pools")
        void shouldListStatus() throws Exception {
            JsonNode providersBody = objectMapper.readTree(get("/admin/providers").body());
            JsonNode poolsBody = objectMapper.readTree(get("/admin/pools").body());

            assertThat(providersBody.has("groq-a")).isTrue();
            assertThat(providersBody.path("groq-a").path("status").asText()).isEqualTo("AVAILABLE");
            assertThat(poolsBody.path("openrouter").path("totalKeys").asInt()).isEqualTo(2);
            assertThat(poolsBody.toString()).doesNotContain("or-key-1");
        }

        @Test
        @DisplayName("should reset a disabled provider")
        void shouldResetProvider() throws Exception {
            providers.fail("groq-a", 401, "Invalid API Key");
            post("/v1/translate", translateBody(TEXT));
            assertThat(factory.getHealthTracker().isAvailable("groq-a")).isFalse();

            HttpResponse<String> response = post("/admin/providers/groq-a/reset", "");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(factory.getHealthTracker().isAvailable("groq-a")).isTrue();
        }

        @Test
        @DisplayName("should reset a pooled key by display name")
        void shouldResetKey() throws Exception {
            providers.fail("openrouter-b", 401, "User not found.");
            post("/v1/translate", translateBody(TEXT));
            assertThat(factory.getCredentialPools().get("openrouter").status().disabledKeys()).isEqualTo(1);

            HttpResponse<String> response = post("/admin/pools/openrouter/keys/Primary%20OPENROUTER/reset", "");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(factory.getCredentialPools().get("openrouter").status().disabledKeys()).isZero();
        }

        @Test
        @DisplayName("should answer 404 for unknown targets")
        void shouldRejectUnknownTargets() throws Exception {
            assertThat(post("/admin/providers/missing/reset", "").statusCode()).isEqualTo(404);
            assertThat(post("/admin/pools/missing/keys/x/reset", "").statusCode()).isEqualTo(404);
            assertThat(get("/admin/unknown").statusCode()).isEqualTo(404);
        }
    }
}
