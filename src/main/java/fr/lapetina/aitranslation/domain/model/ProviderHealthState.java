package fr.lapetina.aitranslation.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Mutable health of one provider.
 *
 * Every read-modify-write sequence is guarded by this object's monitor, so two
 * requests failing against the same provider cannot lose an update.
 * Invariant: {@code status == RATE_LIMITED} implies {@code disabledUntil != null}.
 */
public final class ProviderHealthState {

    private static final Duration MINUTE_WINDOW = Duration.ofMinutes(1);

    private final String providerId;

    private ProviderStatus status = ProviderStatus.AVAILABLE;
    private Instant disabledUntil;
    private String disabledReason;
    private String lastError;
    private long tokensUsedToday;
    private int requestsInCurrentMinute;
    private Instant minuteWindowStart;
    private long totalRequests;
    private long totalFailures;
    private Instant lastSuccess;

    public ProviderHealthState(String providerId) {
        this.providerId = Objects.requireNonNull(providerId, "Provider ID is required");
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * Re-evaluates an expired cooldown and reports availability.
     *
     * @return the recovery transition when this call flipped the state back to AVAILABLE, else null
     */
    public synchronized HealthTransition refresh(Instant now) {
        if (status == ProviderStatus.AVAILABLE || disabledUntil == null || now.isBefore(disabledUntil)) {
            return null;
        }
        ProviderStatus previous = status;
        String reason = disabledReason;
        status = ProviderStatus.AVAILABLE;
        disabledUntil = null;
        disabledReason = null;
        tokensUsedToday = 0;
        requestsInCurrentMinute = 0;
        minuteWindowStart = null;
        return new HealthTransition(providerId, previous, ProviderStatus.AVAILABLE,
                "cooldown expired (" + reason + ")", now);
    }

    /**
     * Disables the provider until an operator resets it.
     *
     * @return the transition, or null if it was already disabled
     */
    public synchronized HealthTransition disable(String reason, String error, Instant now) {
        totalRequests++;
        totalFailures++;
        lastError = error;
        if (status == ProviderStatus.DISABLED) {
            return null;
        }
        ProviderStatus previous = status;
        status = ProviderStatus.DISABLED;
        disabledUntil = null;
        disabledReason = reason;
        return new HealthTransition(providerId, previous, status, reason, now);
    }

    /**
     * Excludes the provider until {@code until}. Keeps the later deadline when already
     * rate limited and never downgrades a disabled provider.
     *
     * @return the transition, or null when the status did not change
     */
    public synchronized HealthTransition rateLimit(Instant until, String reason, String error, Instant now) {
        totalRequests++;
        totalFailures++;
        lastError = error;
        if (status == ProviderStatus.DISABLED) {
            return null;
        }
        if (status == ProviderStatus.RATE_LIMITED) {
            if (until.isAfter(disabledUntil)) {
                disabledUntil = until;
                disabledReason = reason;
            }
            return null;
        }
        status = ProviderStatus.RATE_LIMITED;
        disabledUntil = until;
        disabledReason = reason;
        return new HealthTransition(providerId, ProviderStatus.AVAILABLE, status, reason, now);
    }

    /**
     * Records a failure that does not change availability.
     */
    public synchronized void recordTransientFailure(String error) {
        totalRequests++;
        totalFailures++;
        lastError = error;
    }

    /**
     * Records a successful call. Never changes the status.
     */
    public synchronized void recordSuccess(long tokensUsed, Instant now) {
        totalRequests++;
        tokensUsedToday += Math.max(0, tokensUsed);
        if (minuteWindowStart == null || !now.isBefore(minuteWindowStart.plus(MINUTE_WINDOW))) {
            minuteWindowStart = now;
            requestsInCurrentMinute = 1;
        } else {
            requestsInCurrentMinute++;
        }
        lastSuccess = now;
    }

    /**
     * Operator reset back to AVAILABLE.
     *
     * @return the transition, or null if it was already available
     */
    public synchronized HealthTransition reset(Instant now) {
        if (status == ProviderStatus.AVAILABLE) {
            return null;
        }
        ProviderStatus previous = status;
        status = ProviderStatus.AVAILABLE;
        disabledUntil = null;
        disabledReason = null;
        return new HealthTransition(providerId, previous, status, "manual reset", now);
    }

    public synchronized void resetDailyCounters() {
        tokensUsedToday = 0;
    }

    public synchronized ProviderStatus getStatus() {
        return status;
    }

    public synchronized Instant getDisabledUntil() {
        return disabledUntil;
    }

    public synchronized String getDisabledReason() {
        return disabledReason;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized long getTokensUsedToday() {
        return tokensUsedToday;
    }

    /**
     * Requests counted in the current one-minute window as of {@code now}.
     */
    public synchronized int getRequestsInCurrentMinute(Instant now) {
        if (minuteWindowStart == null || !now.isBefore(minuteWindowStart.plus(MINUTE_WINDOW))) {
            return 0;
        }
        return requestsInCurrentMinute;
    }

    public synchronized long getTotalRequests() {
        return totalRequests;
    }

    public synchronized long getTotalFailures() {
        return totalFailures;
    }

    public synchronized Instant getLastSuccess() {
        return lastSuccess;
    }

    @Override
    public synchronized String toString() {
        return "ProviderHealthState{" +
                "providerId='" + providerId + '\'' +
                ", status=" + status +
                ", disabledUntil=" + disabledUntil +
                ", tokensUsedToday=" + tokensUsedToday +
                '}';
    }
}
