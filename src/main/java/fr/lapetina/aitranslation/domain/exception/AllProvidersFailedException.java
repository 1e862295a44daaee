package fr.lapetina.aitranslation.domain.exception;

import java.util.List;

/**
 * No usable candidate was produced for a translation request.
 *
 * This is the only failure the orchestrator surfaces to its caller. Callers decide
 * whether to retry later, fall back to a deterministic path, or report upstream.
 */
public class AllProvidersFailedException extends RuntimeException {

    private final List<String> attemptedProviders;

    public AllProvidersFailedException(String message, List<String> attemptedProviders) {
        super(message);
        this.attemptedProviders = attemptedProviders != null ? List.copyOf(attemptedProviders) : List.of();
    }

    public AllProvidersFailedException(List<String> attemptedProviders) {
        this("All translation providers failed: " + attemptedProviders, attemptedProviders);
    }

    /**
     * Providers that were called for this request (empty when none were selected).
     */
    public List<String> getAttemptedProviders() {
        return attemptedProviders;
    }
}
