package fr.lapetina.aitranslation.domain.selection;

import fr.lapetina.aitranslation.domain.model.ProviderDescriptor;
import fr.lapetina.aitranslation.infrastructure.credential.CredentialPool;
import fr.lapetina.aitranslation.infrastructure.health.ProviderHealthTracker;
import fr.lapetina.aitranslation.infrastructure.health.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Picks which providers to call for one request.
 *
 * Walks the priority order and keeps the providers that are registered, enabled and
 * available right now. A pooled provider also needs a credential left in its pool.
 */
public final class ProviderSelector {

    private static final Logger log = LoggerFactory.getLogger(ProviderSelector.class);

    private final ProviderRegistry registry;
    private final ProviderHealthTracker healthTracker;
    private final Map<String, CredentialPool> pools;
    private final List<String> priorityOrder = new CopyOnWriteArrayList<>();

    public ProviderSelector(
            ProviderRegistry registry,
            ProviderHealthTracker healthTracker,
            Map<String, CredentialPool> pools,
            List<String> priorityOrder
    ) {
        this.registry = registry;
        this.healthTracker = healthTracker;
        this.pools = pools != null ? pools : new ConcurrentHashMap<>();
        setPriorityOrder(priorityOrder);
    }

    /**
     * Selects with the configured priority order.
     */
    public List<String> select(int maxProviders) {
        return select(priorityOrder, maxProviders);
    }

    /**
     * Available providers from {@code order}, in that order, at most {@code maxProviders}.
     * Never throws; an empty list means nothing can be called right now.
     */
    public List<String> select(List<String> order, int maxProviders) {
        if (maxProviders <= 0 || order == null || order.isEmpty()) {
            return List.of();
        }

        Set<String> unique = new LinkedHashSet<>(order);
        List<String> selected = new ArrayList<>(Math.min(maxProviders, unique.size()));
        for (String providerId : unique) {
            if (selected.size() >= maxProviders) {
                break;
            }
            if (isSelectable(providerId)) {
                selected.add(providerId);
            }
        }

        if (selected.isEmpty()) {
            log.warn("No providers available: candidates={}", unique);
        } else {
            log.debug("Providers selected: selected={}, max={}", selected, maxProviders);
        }
        return List.copyOf(selected);
    }

    /**
     * Whether a call to {@code providerId} could be made right now.
     */
    public boolean isSelectable(String providerId) {
        Optional<ProviderDescriptor> descriptor = registry.get(providerId);
        if (descriptor.isEmpty() || !descriptor.get().isEnabled()) {
            return false;
        }
        if (!healthTracker.isAvailable(providerId)) {
            return false;
        }
        if (descriptor.get().usesCredentialPool()) {
            CredentialPool pool = pools.get(descriptor.get().getCredentialPool());
            return pool != null && pool.hasAvailable();
        }
        return true;
    }

    public List<String> getPriorityOrder() {
        return List.copyOf(priorityOrder);
    }

    /**
     * Replaces the configured order. Used for configuration reload.
     */
    public void setPriorityOrder(List<String> order) {
        List<String> replacement = order != null ? new ArrayList<>(new LinkedHashSet<>(order)) : List.of();
        priorityOrder.clear();
        priorityOrder.addAll(replacement);
        log.info("Provider priority order set: {}", replacement);
    }
}
