/**
 * AI Translation Gateway - multi-provider translation with consensus scoring.
 *
 * <p>Each request is sent concurrently to several hosted LLM providers (Groq, OpenRouter,
 * Cerebras and any OpenAI-compatible endpoint). The candidates are scored, compared through
 * embeddings, and merged into one answer with a confidence value. Providers that hit rate
 * limits or authentication errors are taken out of rotation and come back on their own once
 * their cooldown has passed.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aitranslation.OrchestratorFactory} - Builds the whole object graph
 *       from YAML configuration</li>
 *   <li>{@link fr.lapetina.aitranslation.TranslationGatewayApplication} - Standalone HTTP server</li>
 *   <li>{@link fr.lapetina.aitranslation.fanout.TranslationOrchestrator} - Selection, fan-out and consensus
 *       for a single request</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (OrchestratorFactory factory = OrchestratorFactory.create("config.yaml").start()) {
 *     ConsensusResult result = factory.getOrchestrator().translate(text, null, 3);
 *     System.out.println(result.translation() + " (" + result.confidence() + ")");
 * }
 * }</pre>
 *
 * @see fr.lapetina.aitranslation.OrchestratorFactory
 */
package fr.lapetina.aitranslation;
