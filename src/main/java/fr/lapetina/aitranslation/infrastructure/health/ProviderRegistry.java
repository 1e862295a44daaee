package fr.lapetina.aitranslation.infrastructure.health;

import fr.lapetina.aitranslation.domain.model.ProviderDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Registry of configured providers.
 *
 * Keeps registration order so snapshots list providers the way they were configured.
 * Descriptors are immutable; a reload replaces them wholesale.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderDescriptor> providers = new LinkedHashMap<>();
    private final List<Consumer<ProviderRegistryEvent>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a new provider or replaces the descriptor of an existing one.
     */
    public void register(ProviderDescriptor descriptor) {
        ProviderDescriptor previous;
        synchronized (providers) {
            previous = providers.put(descriptor.getId(), descriptor);
        }
        if (previous == null) {
            log.info("Provider registered: {}", descriptor);
            notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.ADDED, descriptor));
        } else {
            log.info("Provider updated: {}", descriptor);
            notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.UPDATED, descriptor));
        }
    }

    public ProviderDescriptor remove(String providerId) {
        ProviderDescriptor removed;
        synchronized (providers) {
            removed = providers.remove(providerId);
        }
        if (removed != null) {
            log.info("Provider removed: {}", removed);
            notifyListeners(new ProviderRegistryEvent(ProviderRegistryEvent.Type.REMOVED, removed));
        }
        return removed;
    }

    public Optional<ProviderDescriptor> get(String providerId) {
        synchronized (providers) {
            return Optional.ofNullable(providers.get(providerId));
        }
    }

    /**
     * All providers in registration order.
     */
    public List<ProviderDescriptor> getAll() {
        synchronized (providers) {
            return new ArrayList<>(providers.values());
        }
    }

    public List<ProviderDescriptor> getEnabled() {
        return getAll().stream()
                .filter(ProviderDescriptor::isEnabled)
                .toList();
    }

    /**
     * Replaces all providers with a new set. Used for configuration reload.
     */
    public void replaceAll(Collection<ProviderDescriptor> descriptors) {
        Set<String> newIds = new HashSet<>();
        for (ProviderDescriptor descriptor : descriptors) {
            newIds.add(descriptor.getId());
            register(descriptor);
        }

        List<String> existingIds;
        synchronized (providers) {
            existingIds = new ArrayList<>(providers.keySet());
        }
        for (String existingId : existingIds) {
            if (!newIds.contains(existingId)) {
                remove(existingId);
            }
        }

        log.info("Provider registry replaced: {} providers registered", size());
    }

    public void addListener(Consumer<ProviderRegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<ProviderRegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(ProviderRegistryEvent event) {
        for (Consumer<ProviderRegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener", e);
            }
        }
    }

    public int size() {
        synchronized (providers) {
            return providers.size();
        }
    }

    /**
     * Event for registry changes.
     */
    public record ProviderRegistryEvent(Type type, ProviderDescriptor descriptor) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED
        }
    }
}
