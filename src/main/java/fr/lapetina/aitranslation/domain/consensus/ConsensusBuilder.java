package fr.lapetina.aitranslation.domain.consensus;

import fr.lapetina.aitranslation.domain.exception.AllProvidersFailedException;
import fr.lapetina.aitranslation.domain.exception.EmbeddingException;
import fr.lapetina.aitranslation.domain.model.CandidateResult;
import fr.lapetina.aitranslation.domain.model.ConsensusResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reconciles candidate translations into one answer.
 *
 * The candidate with the highest raw confidence wins (earliest on ties). With two or
 * more candidates its confidence is boosted by how much the candidates agree:
 * {@code min(cap, base + agreement * boostFactor)}.
 *
 * Agreement does not change which candidate wins, so two divergent translations still
 * return the more confident one with {@code consensus = true} and a low agreement.
 */
public final class ConsensusBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConsensusBuilder.class);

    public static final double DEFAULT_BOOST_FACTOR = 0.08;
    public static final double DEFAULT_CONFIDENCE_CAP = 0.95;

    private final SemanticAgreement semanticAgreement;
    private final double boostFactor;
    private final double confidenceCap;

    public ConsensusBuilder(SemanticAgreement semanticAgreement) {
        this(semanticAgreement, DEFAULT_BOOST_FACTOR, DEFAULT_CONFIDENCE_CAP);
    }

    public ConsensusBuilder(SemanticAgreement semanticAgreement, double boostFactor, double confidenceCap) {
        this.semanticAgreement = semanticAgreement;
        this.boostFactor = boostFactor;
        this.confidenceCap = confidenceCap;
    }

    /**
     * @throws AllProvidersFailedException when there is no candidate
     */
    public ConsensusResult build(List<CandidateResult> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new AllProvidersFailedException("No candidate translations to reconcile", List.of());
        }

        List<String> modelsUsed = candidates.stream().map(CandidateResult::providerId).toList();
        long totalTokens = candidates.stream().mapToLong(CandidateResult::tokensUsed).sum();

        if (candidates.size() == 1) {
            CandidateResult only = candidates.get(0);
            log.debug("Single candidate, no consensus: providerId={}", only.providerId());
            return new ConsensusResult(only.translation(), only.confidence(), false, 0.0,
                    modelsUsed, only.providerId(), only.modelId(), totalTokens);
        }

        CandidateResult best = candidates.get(0);
        for (CandidateResult candidate : candidates) {
            if (candidate.confidence() > best.confidence()) {
                best = candidate;
            }
        }

        double agreement = measureAgreement(candidates);
        double confidence = Math.min(confidenceCap, best.confidence() + agreement * boostFactor);

        log.debug("Consensus built: candidates={}, selected={}, agreement={}, confidence={}",
                candidates.size(), best.providerId(), agreement, confidence);

        return new ConsensusResult(best.translation(), confidence, true, agreement,
                modelsUsed, best.providerId(), best.modelId(), totalTokens);
    }

    private double measureAgreement(List<CandidateResult> candidates) {
        try {
            return semanticAgreement.measure(candidates.stream().map(CandidateResult::translation).toList());
        } catch (EmbeddingException e) {
            log.warn("Agreement scoring failed, continuing without boost: error={}", e.getMessage());
            return 0.0;
        }
    }
}
