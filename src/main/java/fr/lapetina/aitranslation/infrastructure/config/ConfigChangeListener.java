package fr.lapetina.aitranslation.infrastructure.config;

/**
 * Listener interface for configuration changes.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * Called after a configuration has been loaded and validated.
     *
     * @param oldConfig the previous configuration (null on initial load)
     * @param newConfig the new configuration
     */
    void onConfigChanged(TranslationConfig oldConfig, TranslationConfig newConfig);
}
