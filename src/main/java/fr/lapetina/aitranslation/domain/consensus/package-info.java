/**
 * Agreement scoring and final answer selection.
 */
package fr.lapetina.aitranslation.domain.consensus;
