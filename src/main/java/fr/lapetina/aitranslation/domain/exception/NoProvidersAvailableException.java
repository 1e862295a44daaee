package fr.lapetina.aitranslation.domain.exception;

import java.util.List;

/**
 * Selection returned nothing, so no call was attempted.
 *
 * Means "degrade to no AI translation for this request", not "retry immediately":
 * every candidate provider is rate limited, disabled or out of credentials.
 */
public final class NoProvidersAvailableException extends AllProvidersFailedException {

    public NoProvidersAvailableException() {
        super("No providers currently available due to rate limits or disabled credentials", List.of());
    }
}
