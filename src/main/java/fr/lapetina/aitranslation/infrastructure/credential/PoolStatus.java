package fr.lapetina.aitranslation.infrastructure.credential;

import fr.lapetina.aitranslation.domain.model.ProviderStatus;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of a credential pool. Never carries key material.
 */
public record PoolStatus(
        String poolName,
        int totalKeys,
        int availableKeys,
        int rateLimitedKeys,
        int disabledKeys,
        List<CredentialSnapshot> keys
) {
    public PoolStatus {
        keys = keys != null ? List.copyOf(keys) : List.of();
    }

    /**
     * @param resetIn time left before a rate-limited key recovers ("4m 12s"), null otherwise
     */
    public record CredentialSnapshot(
            String displayName,
            ProviderStatus status,
            int callsToday,
            Instant lastUsed,
            String resetIn,
            String disabledReason,
            double averageLatencyMs
    ) {
    }
}
