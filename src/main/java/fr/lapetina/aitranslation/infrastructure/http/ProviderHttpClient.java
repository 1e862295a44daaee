package fr.lapetina.aitranslation.infrastructure.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.aitranslation.domain.exception.ProviderCallException;
import fr.lapetina.aitranslation.domain.model.ProviderDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * HTTP client for OpenAI-compatible chat completion endpoints.
 *
 * Every call carries its own request timeout. A failed call completes the returned
 * future exceptionally with a {@link ProviderCallException}; cancelling the returned
 * future aborts the underlying exchange.
 */
public class ProviderHttpClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHttpClient.class);

    private static final Pattern BOILERPLATE_PREFIX = Pattern.compile(
            "^\\s*(?:translation:|here's the translation:|here is the translation:)?\\s*",
            Pattern.CASE_INSENSITIVE);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProviderRequestFactory requestFactory;
    private final Duration requestTimeout;

    public ProviderHttpClient(ProviderRequestFactory requestFactory, Duration connectTimeout, Duration requestTimeout) {
        this.requestFactory = requestFactory;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = defaultObjectMapper();
    }

    /**
     * Shared mapper settings for provider payloads.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Requests a translation from one provider.
     *
     * @param apiKey key to authenticate with, taken from the descriptor or its credential pool
     */
    public CompletableFuture<ProviderReply> complete(
            ProviderDescriptor provider,
            String apiKey,
            String text,
            String context
    ) {
        HttpRequest request;
        try {
            request = requestFactory.buildRequest(provider, apiKey, text, context, requestTimeout);
        } catch (IOException e) {
            log.error("Failed to build request: providerId={}", provider.getId(), e);
            return CompletableFuture.failedFuture(
                    new ProviderCallException(provider.getId(), "failed to build request", e));
        }

        Instant start = Instant.now();
        log.debug("Sending request: providerId={}, model={}, endpoint={}",
                provider.getId(), provider.getModelId(), request.uri());

        CompletableFuture<HttpResponse<String>> exchange =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());

        CompletableFuture<ProviderReply> reply = exchange
                .handle((response, ex) -> {
                    if (ex != null) {
                        throw failure(provider, ex);
                    }
                    return handleResponse(provider, response, Duration.between(start, Instant.now()));
                });

        reply.whenComplete((r, ex) -> {
            if (reply.isCancelled()) {
                exchange.cancel(true);
                log.debug("Request cancelled: providerId={}", provider.getId());
            }
        });
        return reply;
    }

    private ProviderReply handleResponse(ProviderDescriptor provider, HttpResponse<String> response, Duration latency) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            Duration retryAfter = parseRetryAfter(response.headers().firstValue("Retry-After")).orElse(null);
            log.warn("Request failed with HTTP error: providerId={}, status={}, latencyMs={}",
                    provider.getId(), status, latency.toMillis());
            throw new ProviderCallException(provider.getId(), status, response.body(), retryAfter);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw new ProviderCallException(provider.getId(), "unparseable response", e);
        }

        String content = cleanTranslation(root.path("choices").path(0).path("message").path("content").asText(""));
        if (content.isEmpty()) {
            throw new ProviderCallException(provider.getId(), "empty completion", null);
        }
        long tokens = root.path("usage").path("total_tokens").asLong(0);

        log.info("Request successful: providerId={}, model={}, tokens={}, latencyMs={}",
                provider.getId(), provider.getModelId(), tokens, latency.toMillis());
        return new ProviderReply(provider.getId(), content, tokens, latency);
    }

    private ProviderCallException failure(ProviderDescriptor provider, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof ProviderCallException providerFailure) {
            return providerFailure;
        }
        if (cause instanceof HttpTimeoutException) {
            log.warn("Request timeout: providerId={}, error={}", provider.getId(), cause.getMessage());
            return new ProviderCallException(provider.getId(), "timeout", cause);
        }
        log.warn("Connection error: providerId={}, errorType={}, error={}",
                provider.getId(), cause.getClass().getSimpleName(), cause.getMessage());
        return new ProviderCallException(provider.getId(), String.valueOf(cause.getMessage()), cause);
    }

    /**
     * Strips "Translation:" style lead-ins and surrounding whitespace.
     */
    public static String cleanTranslation(String raw) {
        if (raw == null) {
            return "";
        }
        return BOILERPLATE_PREFIX.matcher(raw).replaceFirst("").strip();
    }

    /**
     * Parses a {@code Retry-After} value in seconds or as an HTTP date.
     */
    static Optional<Duration> parseRetryAfter(Optional<String> header) {
        if (header.isEmpty() || header.get().isBlank()) {
            return Optional.empty();
        }
        String value = header.get().trim();
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Optional.of(Duration.ofSeconds(Long.parseLong(value)));
            }
            ZonedDateTime date = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration delay = Duration.between(Instant.now(), date.toInstant());
            return Optional.of(delay.isNegative() ? Duration.ZERO : delay);
        } catch (RuntimeException e) {
            log.debug("Ignoring invalid Retry-After header: value={}", value);
            return Optional.empty();
        }
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    @Override
    public void close() {
        // HttpClient has no close() on JDK 17
    }
}
