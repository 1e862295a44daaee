package fr.lapetina.aitranslation.domain.model;

import java.util.Locale;

/**
 * Model lineage behind a provider. Drives the prompt hint, sampling parameters
 * and the fixed confidence bonus of a candidate.
 *
 * Detection order matters: {@code deepseek-r1-distill-qwen} is a DeepSeek-R1 model.
 */
public enum ModelFamily {
    DEEPSEEK_R1("deepseek-r1", "Use step-by-step reasoning for complex terminology.", 0.6, 0.9, null, 0.10),
    DEEPSEEK("deepseek", "Use step-by-step reasoning for complex terminology.", 0.1, null, null, 0.0),
    QWEN("qwen", "Focus on cultural context and nuanced meaning.", 0.1, 0.8, 0.1, 0.08),
    KIMI("kimi", "Ensure comprehensive understanding of lengthy texts.", 0.1, null, null, 0.06),
    GPT_OSS("gpt-oss", "Apply reasoning for complex philosophical concepts.", 0.1, null, null, 0.05),
    GENERIC("", null, 0.1, null, null, 0.0);

    private final String marker;
    private final String promptHint;
    private final double temperature;
    private final Double topP;
    private final Double frequencyPenalty;
    private final double confidenceBonus;

    ModelFamily(String marker, String promptHint, double temperature, Double topP,
                Double frequencyPenalty, double confidenceBonus) {
        this.marker = marker;
        this.promptHint = promptHint;
        this.temperature = temperature;
        this.topP = topP;
        this.frequencyPenalty = frequencyPenalty;
        this.confidenceBonus = confidenceBonus;
    }

    /** Short note appended to the prompt, or null. */
    public String getPromptHint() {
        return promptHint;
    }

    public double getTemperature() {
        return temperature;
    }

    /** Nucleus sampling value, or null to omit the field. */
    public Double getTopP() {
        return topP;
    }

    /** Frequency penalty, or null to omit the field. */
    public Double getFrequencyPenalty() {
        return frequencyPenalty;
    }

    public double getConfidenceBonus() {
        return confidenceBonus;
    }

    /**
     * Detects the family from the model id and provider id.
     */
    public static ModelFamily detect(String modelId, String providerId) {
        String haystack = (modelId + " " + providerId).toLowerCase(Locale.ROOT);
        for (ModelFamily family : values()) {
            if (family != GENERIC && haystack.contains(family.marker)) {
                return family;
            }
        }
        return GENERIC;
    }
}
