package fr.lapetina.aitranslation.infrastructure.http;

/**
 * Produces the user prompt for one translation request.
 */
@FunctionalInterface
public interface PromptBuilder {

    /**
     * @param text    source text
     * @param context optional surrounding text or glossary, may be null
     */
    String build(String text, String context);
}
