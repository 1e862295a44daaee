package fr.lapetina.aitranslation.infrastructure.config;

import fr.lapetina.aitranslation.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static InputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    private static final String VALID = """
            providers:
              - id: groq-a
                modelId: qwen-2.5-32b
                endpoint: http://localhost/groq
                apiKey: key
            """;

    @Test
    @DisplayName("should load the test configuration from the classpath")
    void shouldLoadFromClasspath() {
        TranslationConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getServer().getPort()).isZero();
        assertThat(config.getServer().getWorkerThreads()).isEqualTo(2);
        assertThat(config.getProviders()).extracting(TranslationConfig.ProviderConfig::getId)
                .containsExactly("groq-a", "openrouter-b", "cerebras-c", "groq-no-key");
        assertThat(config.getPriorityOrder()).containsExactly("groq-a", "openrouter-b", "cerebras-c");
        assertThat(config.getCredentialPools()).hasSize(1);
        assertThat(config.getCredentialPools().get(0).getKeys()).hasSize(2);
        assertThat(config.getValidation().getMaxTextLength()).isEqualTo(500);
    }

    @Test
    @DisplayName("should apply defaults for omitted sections")
    void shouldApplyDefaults() {
        TranslationConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml(VALID));

        assertThat(config.getServer().getPort()).isEqualTo(8080);
        assertThat(config.getSelection().getMaxProviders()).isEqualTo(3);
        assertThat(config.getConsensus().getBoostFactor()).isEqualTo(0.08);
        assertThat(config.getConsensus().getConfidenceCap()).isEqualTo(0.95);
        assertThat(config.getConsensus().getEmbedding().getType()).isEqualTo("local");
        assertThat(config.getClassification().getPerMinuteCooldownSeconds()).isEqualTo(60);
        assertThat(config.getProviders().get(0).getRequestsPerMinute()).isEqualTo(30);
    }

    @Test
    @DisplayName("should fail when the file does not exist anywhere")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should fail on empty YAML")
    void shouldFailOnEmptyYaml() {
        assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("should fail on malformed YAML")
    void shouldFailOnMalformedYaml() {
        assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("providers: [ {id: ")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid YAML");
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject duplicate provider ids")
        void shouldRejectDuplicateIds() {
            String content = VALID + """
                      - id: groq-a
                        modelId: other
                        endpoint: http://localhost/other
                    """;

            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate provider id: groq-a");
        }

        @Test
        @DisplayName("should reject a provider without endpoint")
        void shouldRejectMissingEndpoint() {
            String content = """
                    providers:
                      - id: broken
                        modelId: some-model
                    """;

            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("broken");
        }

        @Test
        @DisplayName("should reject a reference to an unknown credential pool")
        void shouldRejectUnknownPool() {
            String content = """
                    providers:
                      - id: openrouter-x
                        modelId: some-model
                        endpoint: http://localhost/or
                        credentialPool: nowhere
                    """;

            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("nowhere");
        }

        @Test
        @DisplayName("should reject an endpoint without scheme or host")
        void shouldRejectMalformedEndpoint() {
            String content = VALID.replace("http://localhost/groq", "localhost groq");

            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("groq-a");
        }

        @Test
        @DisplayName("should reject an unknown provider family")
        void shouldRejectUnknownFamily() {
            String content = VALID.replace("    apiKey: key", "    apiKey: key\n    family: grok");

            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("grok");
        }

        @Test
        @DisplayName("should reject an unknown embedding type")
        void shouldRejectEmbeddingType() {
            String content = VALID + """
                    consensus:
                      embedding:
                        type: quantum
                    """;

            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("quantum");
        }

        @Test
        @DisplayName("should reject a non-positive text limit")
        void shouldRejectTextLimit() {
            String content = VALID + """
                    validation:
                      maxTextLength: 0
                    """;

            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml(content)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("maxTextLength");
        }

        @Test
        @DisplayName("should only warn about unknown ids in the priority order")
        void shouldAcceptUnknownPriorityId() {
            String content = VALID + """
                    priorityOrder:
                      - groq-a
                      - retired-provider
                    """;

            TranslationConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml(content));

            assertThat(config.getPriorityOrder()).containsExactly("groq-a", "retired-provider");
        }
    }

    @Nested
    @DisplayName("reload")
    class Reload {

        @TempDir
        Path dir;

        @Test
        @DisplayName("should notify listeners with old and new configuration")
        void shouldNotifyListeners() throws Exception {
            Path file = dir.resolve("config.yaml");
            Files.writeString(file, VALID);
            ConfigLoader loader = new ConfigLoader(file.toString());
            List<String> seen = new ArrayList<>();
            loader.addListener((oldConfig, newConfig) ->
                    seen.add((oldConfig == null ? "none" : oldConfig.getProviders().get(0).getModelId())
                            + "->" + newConfig.getProviders().get(0).getModelId()));

            loader.load();
            Files.writeString(file, VALID.replace("qwen-2.5-32b", "llama-3.3-70b"));
            loader.reload();

            assertThat(seen).containsExactly("none->qwen-2.5-32b", "qwen-2.5-32b->llama-3.3-70b");
            assertThat(loader.getCurrentConfig().getProviders().get(0).getModelId()).isEqualTo("llama-3.3-70b");
        }

        @Test
        @DisplayName("should keep the current configuration when the new one is invalid")
        void shouldKeepCurrentOnFailure() throws Exception {
            Path file = dir.resolve("config.yaml");
            Files.writeString(file, VALID);
            ConfigLoader loader = new ConfigLoader(file.toString());
            TranslationConfig original = loader.load();

            Files.writeString(file, VALID + VALID.substring(VALID.indexOf("  - id")));
            TranslationConfig afterReload = loader.reload();

            assertThat(afterReload).isSameAs(original);
            assertThat(loader.getCurrentConfig()).isSameAs(original);
        }
    }
}
