package fr.lapetina.aitranslation.infrastructure.credential;

import fr.lapetina.aitranslation.domain.model.ProviderStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * One API key inside a credential pool.
 *
 * Not thread-safe on its own: the owning pool serializes every mutation.
 */
public final class Credential {
    private final String key;
    private final String displayName;

    private ProviderStatus status = ProviderStatus.AVAILABLE;
    private Instant resetTime;
    private String disabledReason;
    private int callsToday;
    private Instant lastUsed;

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private double averageLatencyMs;

    public Credential(String key, String displayName) {
        this.key = Objects.requireNonNull(key, "Key is required");
        this.displayName = Objects.requireNonNull(displayName, "Display name is required");
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public ProviderStatus getStatus() {
        return status;
    }

    public Instant getResetTime() {
        return resetTime;
    }

    public String getDisabledReason() {
        return disabledReason;
    }

    public int getCallsToday() {
        return callsToday;
    }

    public Instant getLastUsed() {
        return lastUsed;
    }

    public long getTotalCalls() {
        return totalCalls;
    }

    public long getSuccessfulCalls() {
        return successfulCalls;
    }

    public long getFailedCalls() {
        return failedCalls;
    }

    public double getAverageLatencyMs() {
        return averageLatencyMs;
    }

    public boolean isAvailable() {
        return status == ProviderStatus.AVAILABLE;
    }

    void markUsed(Instant now) {
        lastUsed = now;
    }

    void rateLimitUntil(Instant until) {
        status = ProviderStatus.RATE_LIMITED;
        resetTime = until;
        totalCalls++;
        failedCalls++;
    }

    void disable(String reason) {
        status = ProviderStatus.DISABLED;
        disabledReason = reason;
        resetTime = null;
        totalCalls++;
        failedCalls++;
    }

    void recordFailure() {
        totalCalls++;
        failedCalls++;
    }

    void recordSuccess(long latencyMs) {
        callsToday++;
        totalCalls++;
        successfulCalls++;
        averageLatencyMs = (averageLatencyMs * (successfulCalls - 1) + latencyMs) / successfulCalls;
    }

    /**
     * @return true when an expired cooldown flipped the key back to AVAILABLE
     */
    boolean recoverIfDue(Instant now) {
        if (status == ProviderStatus.RATE_LIMITED && resetTime != null && !now.isBefore(resetTime)) {
            status = ProviderStatus.AVAILABLE;
            resetTime = null;
            return true;
        }
        return false;
    }

    void reset() {
        status = ProviderStatus.AVAILABLE;
        resetTime = null;
        disabledReason = null;
    }

    void resetDailyCounters() {
        callsToday = 0;
    }

    /**
     * Key material is never rendered.
     */
    @Override
    public String toString() {
        return "Credential{" +
                "displayName='" + displayName + '\'' +
                ", status=" + status +
                ", callsToday=" + callsToday +
                '}';
    }
}
