package fr.lapetina.aitranslation.infrastructure.http;

import java.time.Duration;

/**
 * A successful chat completion, already cleaned.
 */
public record ProviderReply(String providerId, String content, long totalTokens, Duration latency) {
}
