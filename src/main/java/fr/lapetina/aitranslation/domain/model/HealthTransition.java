package fr.lapetina.aitranslation.domain.model;

import java.time.Instant;

/**
 * A status change of one provider, published to tracker listeners.
 */
public record HealthTransition(
        String providerId,
        ProviderStatus from,
        ProviderStatus to,
        String reason,
        Instant at
) {
    public boolean isRecovery() {
        return to == ProviderStatus.AVAILABLE && from != ProviderStatus.AVAILABLE;
    }
}
