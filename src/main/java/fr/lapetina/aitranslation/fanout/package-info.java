/**
 * Concurrent provider calls for one translation request.
 *
 * <p>{@link fr.lapetina.aitranslation.fanout.TranslationFanOut} issues every call at once and waits
 * for all of them; a failed call is reported to the health tracker or credential pool and dropped.
 * {@link fr.lapetina.aitranslation.fanout.TranslationOrchestrator} wraps selection, fan-out and
 * consensus, and maps the empty outcomes to
 * {@link fr.lapetina.aitranslation.domain.exception.NoProvidersAvailableException} and
 * {@link fr.lapetina.aitranslation.domain.exception.AllProvidersFailedException}.
 */
package fr.lapetina.aitranslation.fanout;
