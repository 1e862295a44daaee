/**
 * Turns provider failures into health transitions.
 *
 * <p>{@link fr.lapetina.aitranslation.domain.classification.ErrorClassifier} holds an ordered
 * table of {@link fr.lapetina.aitranslation.domain.classification.ClassificationRule}s;
 * {@link fr.lapetina.aitranslation.domain.classification.CooldownParser} reads the retry
 * hints providers embed in their error text.</p>
 */
package fr.lapetina.aitranslation.domain.classification;
