package fr.lapetina.aitranslation.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aitranslation.domain.model.ModelFamily;
import fr.lapetina.aitranslation.domain.model.ProviderDescriptor;
import fr.lapetina.aitranslation.domain.model.ProviderFamily;

import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapts one translation request to a specific provider: prompt, body and headers.
 */
public final class ProviderRequestFactory {

    private final PromptBuilder promptBuilder;
    private final ObjectMapper objectMapper;
    private final ClientIdentity identity;

    public ProviderRequestFactory(PromptBuilder promptBuilder, ObjectMapper objectMapper, ClientIdentity identity) {
        this.promptBuilder = promptBuilder;
        this.objectMapper = objectMapper;
        this.identity = identity != null ? identity : ClientIdentity.defaults();
    }

    /**
     * Base prompt plus the model family's hint, if it has one.
     */
    public String buildPrompt(ProviderDescriptor provider, String text, String context) {
        String prompt = promptBuilder.build(text, context);
        String hint = provider.getModelFamily().getPromptHint();
        if (hint == null) {
            return prompt;
        }
        return prompt + "\n\nNote: " + hint;
    }

    public Map<String, Object> buildBody(ProviderDescriptor provider, String prompt) {
        ModelFamily modelFamily = provider.getModelFamily();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", provider.getModelId());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("max_tokens", provider.getMaxTokens());
        body.put("temperature", modelFamily.getTemperature());
        body.put("stream", false);

        if (modelFamily.getTopP() != null) {
            body.put("top_p", modelFamily.getTopP());
        }
        if (modelFamily.getFrequencyPenalty() != null && provider.getFamily().supportsFrequencyPenalty()) {
            body.put("frequency_penalty", modelFamily.getFrequencyPenalty());
        }
        return body;
    }

    public Map<String, String> buildHeaders(ProviderDescriptor provider, String apiKey) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Authorization", "Bearer " + apiKey);
        headers.put("Content-Type", "application/json");

        if (provider.getFamily() == ProviderFamily.OPENROUTER) {
            headers.put("HTTP-Referer", identity.referer());
            headers.put("X-Title", identity.title());
        } else if (provider.getFamily() == ProviderFamily.CEREBRAS) {
            headers.put("User-Agent", identity.userAgent());
        }
        return headers;
    }

    /**
     * Full outbound request with an explicit timeout.
     */
    public HttpRequest buildRequest(ProviderDescriptor provider, String apiKey, String text, String context,
                                    Duration timeout) throws JsonProcessingException {
        String prompt = buildPrompt(provider, text, context);
        String body = objectMapper.writeValueAsString(buildBody(provider, prompt));

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(provider.getEndpoint())
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body));
        buildHeaders(provider, apiKey).forEach(builder::header);
        return builder.build();
    }
}
