package fr.lapetina.aitranslation.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * One provider's translation of one request, before consensus.
 * Immutable and thread-safe.
 */
public record CandidateResult(
        String translation,
        double confidence,
        String providerId,
        String modelId,
        long tokensUsed,
        Duration latency
) {
    public CandidateResult {
        Objects.requireNonNull(providerId, "Provider ID is required");
        translation = translation != null ? translation : "";
        latency = latency != null ? latency : Duration.ZERO;
    }

    /**
     * A candidate is usable once it carries text.
     */
    public boolean isUsable() {
        return !translation.isBlank();
    }

    /**
     * Zero-confidence placeholder standing in for a failed provider call.
     */
    public static CandidateResult failed(String providerId, String modelId) {
        return new CandidateResult("", 0.0, providerId, modelId, 0, Duration.ZERO);
    }
}
