package fr.lapetina.aitranslation.infrastructure.health;

import fr.lapetina.aitranslation.domain.model.ProviderDescriptor;
import fr.lapetina.aitranslation.infrastructure.health.ProviderRegistry.ProviderRegistryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderRegistryTest {

    private ProviderRegistry registry;
    private List<ProviderRegistryEvent> events;

    @BeforeEach
    void setUp() {
        registry = new ProviderRegistry();
        events = new ArrayList<>();
        registry.addListener(events::add);
    }

    private static ProviderDescriptor provider(String id, boolean enabled) {
        return ProviderDescriptor.builder()
                .id(id)
                .modelId("model-" + id)
                .endpoint("http://localhost/" + id)
                .apiKey("key")
                .enabled(enabled)
                .build();
    }

    @Test
    @DisplayName("should keep insertion order")
    void shouldKeepInsertionOrder() {
        registry.register(provider("c", true));
        registry.register(provider("a", true));
        registry.register(provider("b", true));

        assertThat(registry.getAll()).extracting(ProviderDescriptor::getId).containsExactly("c", "a", "b");
    }

    @Test
    @DisplayName("should filter disabled providers")
    void shouldFilterDisabled() {
        registry.register(provider("a", true));
        registry.register(provider("b", false));

        assertThat(registry.getEnabled()).extracting(ProviderDescriptor::getId).containsExactly("a");
    }

    @Test
    @DisplayName("should publish added, updated and removed events on replaceAll")
    void shouldDiffOnReplaceAll() {
        registry.register(provider("a", true));
        registry.register(provider("b", true));
        events.clear();

        registry.replaceAll(List.of(provider("b", true), provider("c", true)));

        assertThat(registry.getAll()).extracting(ProviderDescriptor::getId).containsExactly("b", "c");
        assertThat(events).extracting(e -> e.type() + ":" + e.descriptor().getId())
                .containsExactlyInAnyOrder("REMOVED:a", "UPDATED:b", "ADDED:c");
    }

    @Test
    @DisplayName("should return empty for unknown ids")
    void shouldReturnEmptyForUnknown() {
        assertThat(registry.get("missing")).isEmpty();
        assertThat(registry.remove("missing")).isNull();
    }
}
