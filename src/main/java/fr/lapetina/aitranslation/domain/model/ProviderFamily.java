package fr.lapetina.aitranslation.domain.model;

import java.util.Locale;

/**
 * Hosting backend of a provider. Decides the wire-level extras a request needs.
 */
public enum ProviderFamily {
    GROQ("groq", true),
    OPENROUTER("openrouter", true),
    /** Cerebras rejects {@code frequency_penalty}. */
    CEREBRAS("cerebras", false),
    OPENAI_COMPATIBLE("openai", true);

    private final String prefix;
    private final boolean supportsFrequencyPenalty;

    ProviderFamily(String prefix, boolean supportsFrequencyPenalty) {
        this.prefix = prefix;
        this.supportsFrequencyPenalty = supportsFrequencyPenalty;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean supportsFrequencyPenalty() {
        return supportsFrequencyPenalty;
    }

    /**
     * Resolves a family from its configuration name ("groq", "OPENROUTER", ...).
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static ProviderFamily fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ProviderFamily family : values()) {
            if (family.prefix.equals(normalized) || family.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown provider family: " + name);
    }

    /**
     * Derives the family from a provider id such as {@code groq-qwen-2.5}.
     * Ids without a known prefix fall back to {@link #OPENAI_COMPATIBLE}.
     */
    public static ProviderFamily fromProviderId(String providerId) {
        String id = providerId.toLowerCase(Locale.ROOT);
        for (ProviderFamily family : values()) {
            if (id.startsWith(family.prefix)) {
                return family;
            }
        }
        return OPENAI_COMPATIBLE;
    }
}
