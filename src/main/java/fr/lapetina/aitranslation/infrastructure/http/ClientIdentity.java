package fr.lapetina.aitranslation.infrastructure.http;

/**
 * How the gateway identifies itself to providers that ask for it.
 *
 * @param referer   OpenRouter {@code HTTP-Referer}
 * @param title     OpenRouter {@code X-Title}
 * @param userAgent Cerebras {@code User-Agent}
 */
public record ClientIdentity(String referer, String title, String userAgent) {

    public static ClientIdentity defaults() {
        return new ClientIdentity("https://translation-gateway.local", "AI Translation Gateway",
                "AiTranslationGateway/1.0");
    }
}
