package fr.lapetina.aitranslation.infrastructure.embedding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aitranslation.domain.consensus.EmbeddingProvider;
import fr.lapetina.aitranslation.domain.exception.EmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embeddings from an OpenAI-compatible {@code /embeddings} endpoint.
 *
 * Sends {@code {model, input:[...]}} and reads {@code data[i].embedding}.
 */
public class OpenAiEmbeddingClient implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI endpoint;
    private final String model;
    private final String apiKey;
    private final Duration requestTimeout;

    public OpenAiEmbeddingClient(URI endpoint, String model, String apiKey, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .version(HttpClient.Version.HTTP_1_1)
                        .build(),
                endpoint, model, apiKey, requestTimeout);
    }

    OpenAiEmbeddingClient(HttpClient httpClient, URI endpoint, String model, String apiKey, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.objectMapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model", model);
            body.put("input", texts);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                log.warn("Embedding request failed: endpoint={}, status={}", endpoint, response.statusCode());
                throw new EmbeddingException("Embedding endpoint returned HTTP " + response.statusCode());
            }
            return parse(response.body(), texts.size());
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding request interrupted", e);
        }
    }

    private List<float[]> parse(String body, int expected) throws IOException {
        JsonNode data = objectMapper.readTree(body).path("data");
        if (!data.isArray() || data.size() != expected) {
            throw new EmbeddingException("Expected " + expected + " embeddings in response, got "
                    + (data.isArray() ? data.size() : 0));
        }

        List<float[]> vectors = new ArrayList<>(expected);
        for (JsonNode item : data) {
            JsonNode embedding = item.path("embedding");
            float[] vector = new float[embedding.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) embedding.get(i).asDouble();
            }
            vectors.add(vector);
        }
        log.debug("Embeddings received: count={}, dimension={}", vectors.size(),
                vectors.isEmpty() ? 0 : vectors.get(0).length);
        return vectors;
    }
}
