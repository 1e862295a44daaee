package fr.lapetina.aitranslation.domain.classification;

import fr.lapetina.aitranslation.domain.model.FailureKind;
import fr.lapetina.aitranslation.domain.model.ProviderStatus;

import java.time.Duration;

/**
 * Outcome of classifying one failed provider call.
 *
 * @param kind         failure category
 * @param targetStatus status the provider moves to (AVAILABLE means no change)
 * @param cooldown     exclusion window for RATE_LIMITED, null otherwise
 * @param reason       human-readable reason stored on the health state
 * @param rule         name of the rule that matched
 */
public record Classification(
        FailureKind kind,
        ProviderStatus targetStatus,
        Duration cooldown,
        String reason,
        String rule
) {
    public static Classification transientFailure() {
        return new Classification(FailureKind.TRANSIENT, ProviderStatus.AVAILABLE, null,
                "Transient failure", "transient");
    }

    public boolean changesState() {
        return targetStatus != ProviderStatus.AVAILABLE;
    }
}
