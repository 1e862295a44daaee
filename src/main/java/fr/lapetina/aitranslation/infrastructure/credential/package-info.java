/**
 * Rotating pools of API keys shared by providers on the same account.
 *
 * <p>A key that hits a rate limit is skipped until the retry hint in the error text expires,
 * or for the pool's default cooldown. A key that fails authentication stays out until an
 * operator resets it. Snapshots expose display names only, never key material.
 */
package fr.lapetina.aitranslation.infrastructure.credential;
