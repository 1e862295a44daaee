package fr.lapetina.aitranslation.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Final answer reconciled from one or more candidates.
 *
 * {@code consensus} is true iff at least two candidates succeeded; how much they
 * agreed is reported by {@code modelAgreement}, not by the flag.
 */
public record ConsensusResult(
        String translation,
        double confidence,
        boolean consensus,
        double modelAgreement,
        List<String> modelsUsed,
        String selectedProviderId,
        String selectedModelId,
        long totalTokensUsed
) {
    public ConsensusResult {
        Objects.requireNonNull(translation, "Translation is required");
        modelsUsed = modelsUsed != null ? List.copyOf(modelsUsed) : List.of();
    }
}
