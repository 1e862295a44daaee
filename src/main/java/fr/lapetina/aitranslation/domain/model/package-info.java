/**
 * Domain model of the translation gateway.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aitranslation.domain.model.ProviderDescriptor} - Immutable provider configuration</li>
 *   <li>{@link fr.lapetina.aitranslation.domain.model.ProviderHealthState} - Per-provider availability state machine</li>
 *   <li>{@link fr.lapetina.aitranslation.domain.model.CandidateResult} - One provider's translation</li>
 *   <li>{@link fr.lapetina.aitranslation.domain.model.ConsensusResult} - Reconciled answer</li>
 *   <li>{@link fr.lapetina.aitranslation.domain.model.ProviderStatus} - AVAILABLE, RATE_LIMITED, DISABLED</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Records and descriptors are immutable. {@code ProviderHealthState} serializes
 * every mutation on its own monitor.
 */
package fr.lapetina.aitranslation.domain.model;
