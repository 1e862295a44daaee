package fr.lapetina.aitranslation.domain.confidence;

import fr.lapetina.aitranslation.domain.model.ModelFamily;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw confidence of a single candidate translation, before consensus.
 *
 * Starts at 0.70 and adjusts for model lineage, source-term preservation,
 * latency and length. The result always lies in [0.10, 0.95].
 */
public final class CandidateConfidenceEstimator {

    static final double BASE = 0.70;
    static final double PER_PRESERVED_TERM = 0.03;
    static final double MAX_PRESERVED_TERMS_BONUS = 0.15;
    static final double FAST_BONUS = 0.05;
    static final double SLOW_PENALTY = 0.10;
    static final double SHORT_PENALTY = 0.20;
    static final double LONG_PENALTY = 0.10;
    static final double MIN = 0.10;
    static final double MAX = 0.95;

    private static final Duration FAST = Duration.ofSeconds(5);
    private static final Duration SLOW = Duration.ofSeconds(30);
    private static final int MIN_WORDS = 5;
    private static final int MAX_WORDS = 1000;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Pattern preservedTerm;

    public CandidateConfidenceEstimator() {
        this(Character.UnicodeScript.TIBETAN);
    }

    /**
     * @param sourceScript script whose terms, kept in parentheses, earn a bonus
     */
    public CandidateConfidenceEstimator(Character.UnicodeScript sourceScript) {
        String script = "\\p{sc=" + sourceScript.name() + "}";
        this.preservedTerm = Pattern.compile("\\([^)]*" + script + "[^)]*\\)");
    }

    public double estimate(String translation, ModelFamily modelFamily, Duration latency) {
        double confidence = BASE;

        if (modelFamily != null) {
            confidence += modelFamily.getConfidenceBonus();
        }

        confidence += Math.min(MAX_PRESERVED_TERMS_BONUS, countPreservedTerms(translation) * PER_PRESERVED_TERM);

        if (latency != null) {
            if (latency.compareTo(FAST) < 0) {
                confidence += FAST_BONUS;
            } else if (latency.compareTo(SLOW) > 0) {
                confidence -= SLOW_PENALTY;
            }
        }

        int words = countWords(translation);
        if (words < MIN_WORDS) {
            confidence -= SHORT_PENALTY;
        } else if (words > MAX_WORDS) {
            confidence -= LONG_PENALTY;
        }

        return Math.max(MIN, Math.min(MAX, confidence));
    }

    int countPreservedTerms(String translation) {
        if (translation == null || translation.isEmpty()) {
            return 0;
        }
        Matcher matcher = preservedTerm.matcher(translation);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    static int countWords(String translation) {
        if (translation == null || translation.isBlank()) {
            return 0;
        }
        return WHITESPACE.split(translation.trim()).length;
    }
}
