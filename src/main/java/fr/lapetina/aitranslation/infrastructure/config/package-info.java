/**
 * Configuration loading and hot-reload support.
 *
 * <p>This package handles YAML configuration parsing and runtime configuration updates
 * without requiring application restart.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.aitranslation.infrastructure.config.TranslationConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.aitranslation.infrastructure.config.ConfigLoader} - YAML loading, validation and file watching</li>
 *   <li>{@link fr.lapetina.aitranslation.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, worker threads)</li>
 *   <li>{@code providers} - Chat-completion backends and their limits</li>
 *   <li>{@code priorityOrder} - Order in which providers are selected</li>
 *   <li>{@code credentialPools} - Named sets of interchangeable API keys</li>
 *   <li>{@code timeouts} - Request and connection timeouts</li>
 *   <li>{@code classification} - Default cooldowns for rate limits</li>
 *   <li>{@code consensus} - Boost factor, cap and embedding backend</li>
 *   <li>{@code usage} - Time zone of the daily counter reset</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * <p>Secrets are given inline or, preferably, by environment variable name
 * ({@code apiKeyEnv}, {@code keyEnv}).
 */
package fr.lapetina.aitranslation.infrastructure.config;
