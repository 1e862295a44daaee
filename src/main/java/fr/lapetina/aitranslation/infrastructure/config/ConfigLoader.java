package fr.lapetina.aitranslation.infrastructure.config;

import fr.lapetina.aitranslation.domain.model.ProviderFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Configuration loader with hot-reload support.
 *
 * Supports:
 * - Loading from classpath or file system
 * - Validation before a configuration is published
 * - File watching for automatic reload
 * - Listener notification on changes
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<TranslationConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private WatchService watchService;
    private ScheduledExecutorService watchExecutor;
    private volatile long lastModified;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(TranslationConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return the loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public TranslationConfig load() {
        return publish(loadFromPath());
    }

    private TranslationConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private TranslationConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            lastModified = Files.getLastModifiedTime(path).toMillis();
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private TranslationConfig parse(InputStream inputStream, String source) {
        try {
            TranslationConfig config = yaml.load(inputStream);
            if (config == null) {
                throw new ConfigurationException("Configuration is empty: " + source);
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public TranslationConfig loadFromStream(InputStream inputStream) {
        return publish(parse(inputStream, "stream"));
    }

    private TranslationConfig publish(TranslationConfig config) {
        validate(config);
        TranslationConfig previous = currentConfig.getAndSet(config);
        notifyListeners(previous, config);
        return config;
    }

    /**
     * Checks the cross references a YAML schema cannot express.
     *
     * @throws ConfigurationException on the first problem found
     */
    public static void validate(TranslationConfig config) {
        Set<String> poolNames = new HashSet<>();
        for (TranslationConfig.CredentialPoolConfig pool : config.getCredentialPools()) {
            if (pool.getName() == null || pool.getName().isBlank()) {
                throw new ConfigurationException("Credential pool without a name");
            }
            if (!poolNames.add(pool.getName())) {
                throw new ConfigurationException("Duplicate credential pool: " + pool.getName());
            }
        }

        Set<String> providerIds = new HashSet<>();
        for (TranslationConfig.ProviderConfig provider : config.getProviders()) {
            if (provider.getId() == null || provider.getId().isBlank()) {
                throw new ConfigurationException("Provider without an id");
            }
            if (!providerIds.add(provider.getId())) {
                throw new ConfigurationException("Duplicate provider id: " + provider.getId());
            }
            if (provider.getModelId() == null || provider.getEndpoint() == null) {
                throw new ConfigurationException("Provider " + provider.getId() + " needs modelId and endpoint");
            }
            checkEndpoint("Provider " + provider.getId(), provider.getEndpoint());
            if (provider.getFamily() != null) {
                try {
                    ProviderFamily.fromName(provider.getFamily());
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException("Provider " + provider.getId() + ": " + e.getMessage(), e);
                }
            }
            if (provider.getCredentialPool() != null && !poolNames.contains(provider.getCredentialPool())) {
                throw new ConfigurationException("Provider " + provider.getId()
                        + " references unknown credential pool: " + provider.getCredentialPool());
            }
        }

        for (String providerId : config.getPriorityOrder()) {
            if (!providerIds.contains(providerId)) {
                log.warn("Priority order names an unknown provider: providerId={}", providerId);
            }
        }

        String embeddingType = config.getConsensus().getEmbedding().getType();
        if (!"local".equalsIgnoreCase(embeddingType) && !"openai".equalsIgnoreCase(embeddingType)) {
            throw new ConfigurationException("Unknown embedding type: " + embeddingType);
        }
        if ("openai".equalsIgnoreCase(embeddingType)) {
            checkEndpoint("Embedding", config.getConsensus().getEmbedding().getEndpoint());
        }
        try {
            Character.UnicodeScript.forName(config.getConfidence().getSourceScript());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new ConfigurationException("Unknown confidence.sourceScript: "
                    + config.getConfidence().getSourceScript(), e);
        }
        try {
            ZoneId.of(config.getUsage().getDailyResetZone());
        } catch (DateTimeException | NullPointerException e) {
            throw new ConfigurationException("Invalid usage.dailyResetZone: "
                    + config.getUsage().getDailyResetZone(), e);
        }
        if (config.getValidation().getMaxTextLength() < 1) {
            throw new ConfigurationException("validation.maxTextLength must be positive");
        }
    }

    private static void checkEndpoint(String owner, String endpoint) {
        URI uri;
        try {
            uri = URI.create(endpoint);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(owner + " has an invalid endpoint: " + endpoint, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new ConfigurationException(owner + " endpoint needs a scheme and host: " + endpoint);
        }
    }

    /**
     * Returns the current configuration.
     */
    public TranslationConfig getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Starts watching the configuration file for changes.
     */
    public void startWatching() {
        if (!Files.exists(configPath)) {
            log.warn("Config file does not exist, hot reload disabled: {}", configPath);
            return;
        }

        try {
            watchService = FileSystems.getDefault().newWatchService();
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent == null) {
                parent = Paths.get(".");
            }
            parent.register(watchService, StandardWatchEventKinds.ENTRY_MODIFY);

            watchExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "config-watcher");
                t.setDaemon(true);
                return t;
            });

            watchExecutor.scheduleWithFixedDelay(this::checkForChanges, 1, 1, TimeUnit.SECONDS);

            log.info("Configuration hot-reload enabled for: {}", configPath);

        } catch (IOException e) {
            log.error("Failed to start config watcher", e);
        }
    }

    private void checkForChanges() {
        try {
            WatchKey key = watchService.poll();
            if (key == null) {
                return;
            }

            for (WatchEvent<?> event : key.pollEvents()) {
                Path changed = (Path) event.context();
                if (changed.equals(configPath.getFileName())) {
                    // Debounce: editors emit several events per save
                    long newLastModified = Files.getLastModifiedTime(configPath).toMillis();
                    if (newLastModified > lastModified) {
                        log.info("Configuration file changed, reloading...");
                        reload();
                    }
                }
            }

            key.reset();
        } catch (Exception e) {
            log.error("Error checking for config changes", e);
        }
    }

    /**
     * Forces a configuration reload. A configuration that fails to load or validate
     * is rejected and the current one kept.
     */
    public TranslationConfig reload() {
        try {
            return load();
        } catch (Exception e) {
            log.error("Failed to reload configuration, keeping current", e);
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(TranslationConfig oldConfig, TranslationConfig newConfig) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(oldConfig, newConfig);
            } catch (Exception e) {
                log.error("Error notifying config change listener", e);
            }
        }
    }

    @Override
    public void close() {
        if (watchExecutor != null) {
            watchExecutor.shutdown();
            try {
                watchExecutor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("Error closing watch service", e);
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
