package fr.lapetina.aitranslation.domain.model;

/**
 * Availability status shared by providers and pooled credentials.
 *
 * AVAILABLE: eligible for selection
 * RATE_LIMITED: excluded until its cooldown expires, then re-enabled on the next query
 * DISABLED: excluded until an operator resets it
 */
public enum ProviderStatus {
    AVAILABLE,
    RATE_LIMITED,
    DISABLED;

    /**
     * Gauge value used by the metrics registry (0=DISABLED, 1=RATE_LIMITED, 2=AVAILABLE).
     */
    public int gaugeValue() {
        return switch (this) {
            case AVAILABLE -> 2;
            case RATE_LIMITED -> 1;
            case DISABLED -> 0;
        };
    }
}
