package fr.lapetina.aitranslation.infrastructure.http;

/**
 * Plain template prompt: instructions, optional context, then the source text.
 */
public final class DefaultPromptBuilder implements PromptBuilder {

    private final String sourceLanguage;
    private final String targetLanguage;

    public DefaultPromptBuilder(String sourceLanguage, String targetLanguage) {
        this.sourceLanguage = sourceLanguage;
        this.targetLanguage = targetLanguage;
    }

    @Override
    public String build(String text, String context) {
        StringBuilder prompt = new StringBuilder()
                .append("Translate the following ").append(sourceLanguage)
                .append(" text into ").append(targetLanguage).append(".\n")
                .append("Keep important ").append(sourceLanguage)
                .append(" terms in parentheses after their translation.\n")
                .append("Reply with the translation only.\n");

        if (context != null && !context.isBlank()) {
            prompt.append("\nContext:\n").append(context.trim()).append('\n');
        }

        prompt.append("\nText:\n").append(text.trim()).append("\n\nTranslation:");
        return prompt.toString();
    }
}
