package fr.lapetina.aitranslation.domain.model;

/**
 * Failure taxonomy for a single provider call.
 */
public enum FailureKind {
    /** Invalid or revoked credentials. Disables the provider until an operator resets it. */
    AUTHENTICATION,

    /** Per-minute or daily quota hit. Excludes the provider for a computed cooldown. */
    RATE_LIMIT,

    /** Network error, timeout, 5xx, malformed or empty reply. No state change. */
    TRANSIENT
}
