package fr.lapetina.aitranslation.domain.model;

import java.time.Instant;

/**
 * Point-in-time view of one provider for dashboards.
 */
public record ProviderStatusSnapshot(
        String providerId,
        String modelId,
        ProviderStatus status,
        boolean available,
        Instant disabledUntil,
        String disabledReason,
        String lastError,
        long tokensUsedToday,
        long dailyTokenBudget,
        int requestsInCurrentMinute,
        int requestsPerMinute,
        long totalRequests,
        long totalFailures,
        Instant lastSuccess
) {
    private static final int MAX_ERROR_LENGTH = 100;

    /**
     * Truncates an error text for display.
     */
    public static String abbreviate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH) + "...";
    }
}
