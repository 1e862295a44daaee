package fr.lapetina.aitranslation.infrastructure.health;

import fr.lapetina.aitranslation.domain.classification.Classification;
import fr.lapetina.aitranslation.domain.model.HealthTransition;
import fr.lapetina.aitranslation.domain.model.ProviderDescriptor;
import fr.lapetina.aitranslation.domain.model.ProviderHealthState;
import fr.lapetina.aitranslation.domain.model.ProviderStatus;
import fr.lapetina.aitranslation.domain.model.ProviderStatusSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns the health state of every provider.
 *
 * Recovery is pull-based: an expired cooldown is only noticed the next time
 * availability is queried, never by a background timer.
 */
public final class ProviderHealthTracker {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthTracker.class);

    private final Clock clock;
    private final Map<String, ProviderHealthState> states = new ConcurrentHashMap<>();
    private final List<Consumer<HealthTransition>> listeners = new CopyOnWriteArrayList<>();

    public ProviderHealthTracker(Clock clock) {
        this.clock = clock;
    }

    public ProviderHealthTracker() {
        this(Clock.systemUTC());
    }

    /**
     * Ensures a state exists for the provider. Existing state is kept.
     */
    public ProviderHealthState register(String providerId) {
        return states.computeIfAbsent(providerId, ProviderHealthState::new);
    }

    public void unregister(String providerId) {
        if (states.remove(providerId) != null) {
            log.debug("Health state dropped: providerId={}", providerId);
        }
    }

    public Optional<ProviderHealthState> getState(String providerId) {
        return Optional.ofNullable(states.get(providerId));
    }

    /**
     * Reports whether the provider may be called now, recovering it first if its
     * cooldown has passed. Unknown providers are unavailable.
     */
    public boolean isAvailable(String providerId) {
        ProviderHealthState state = states.get(providerId);
        if (state == null) {
            return false;
        }
        HealthTransition recovery = state.refresh(clock.instant());
        if (recovery != null) {
            log.info("Provider recovered: providerId={}, reason={}", providerId, recovery.reason());
            notifyListeners(recovery);
        }
        return state.getStatus() == ProviderStatus.AVAILABLE;
    }

    /**
     * Applies a classified failure.
     *
     * @return the transition, or null when the status did not change
     */
    public HealthTransition recordFailure(String providerId, Classification classification, String error) {
        ProviderHealthState state = register(providerId);
        Instant now = clock.instant();

        HealthTransition transition = switch (classification.targetStatus()) {
            case DISABLED -> state.disable(classification.reason(), error, now);
            case RATE_LIMITED -> {
                Duration cooldown = classification.cooldown() != null ? classification.cooldown() : Duration.ZERO;
                yield state.rateLimit(now.plus(cooldown), classification.reason(), error, now);
            }
            case AVAILABLE -> {
                state.recordTransientFailure(error);
                yield null;
            }
        };

        if (transition != null) {
            if (transition.to() == ProviderStatus.DISABLED) {
                log.warn("Provider disabled: providerId={}, reason={}", providerId, transition.reason());
            } else {
                log.warn("Provider rate limited: providerId={}, until={}, reason={}",
                        providerId, state.getDisabledUntil(), transition.reason());
            }
            notifyListeners(transition);
        } else {
            log.debug("Failure recorded without transition: providerId={}, kind={}, status={}",
                    providerId, classification.kind(), state.getStatus());
        }
        return transition;
    }

    public void recordSuccess(String providerId, long tokensUsed) {
        register(providerId).recordSuccess(tokensUsed, clock.instant());
    }

    /**
     * Operator re-enable.
     *
     * @return true if the provider is known
     */
    public boolean reset(String providerId) {
        ProviderHealthState state = states.get(providerId);
        if (state == null) {
            return false;
        }
        HealthTransition transition = state.reset(clock.instant());
        if (transition != null) {
            log.info("Provider manually reset: providerId={}, previousStatus={}", providerId, transition.from());
            notifyListeners(transition);
        }
        return true;
    }

    public void resetDailyCounters() {
        states.values().forEach(ProviderHealthState::resetDailyCounters);
        log.info("Daily provider counters reset: providers={}", states.size());
    }

    /**
     * Builds a dashboard view of one provider. Refreshes its availability first.
     */
    public ProviderStatusSnapshot snapshot(ProviderDescriptor descriptor) {
        boolean available = descriptor.isEnabled() && isAvailable(descriptor.getId());
        ProviderHealthState state = register(descriptor.getId());
        Instant now = clock.instant();
        return new ProviderStatusSnapshot(
                descriptor.getId(),
                descriptor.getModelId(),
                state.getStatus(),
                available,
                state.getDisabledUntil(),
                state.getDisabledReason(),
                ProviderStatusSnapshot.abbreviate(state.getLastError()),
                state.getTokensUsedToday(),
                descriptor.getDailyTokenBudget(),
                state.getRequestsInCurrentMinute(now),
                descriptor.getRequestsPerMinute(),
                state.getTotalRequests(),
                state.getTotalFailures(),
                state.getLastSuccess()
        );
    }

    public Clock getClock() {
        return clock;
    }

    public void addListener(Consumer<HealthTransition> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<HealthTransition> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(HealthTransition transition) {
        for (Consumer<HealthTransition> listener : listeners) {
            try {
                listener.accept(transition);
            } catch (Exception e) {
                log.error("Error notifying health listener", e);
            }
        }
    }
}
