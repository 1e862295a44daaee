package fr.lapetina.aitranslation;

import fr.lapetina.aitranslation.api.HttpServer;
import fr.lapetina.aitranslation.infrastructure.config.TranslationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the AI Translation Gateway.
 */
public class TranslationGatewayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TranslationGatewayApplication.class);

    private final OrchestratorFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public TranslationGatewayApplication(String configPath) throws Exception {
        this(OrchestratorFactory.create(configPath));
    }

    TranslationGatewayApplication(OrchestratorFactory factory) throws Exception {
        log.info("Starting AI Translation Gateway...");

        this.factory = factory.start();

        TranslationConfig.ServerConfig server = factory.getConfig().getServer();
        this.httpServer = new HttpServer(
                server.getHost(),
                server.getPort(),
                server.getBacklog(),
                server.getWorkerThreads(),
                factory.getOrchestrator(),
                factory.getProviderRegistry(),
                factory.getHealthTracker(),
                factory.getSelector(),
                factory.getCredentialPools(),
                factory.getMetricsRegistry(),
                factory.getConfigLoader()
        );

        log.info("AI Translation Gateway initialized");
    }

    public void start() {
        httpServer.start();
        log.info("AI Translation Gateway started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public OrchestratorFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down AI Translation Gateway...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("AI Translation Gateway shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            TranslationGatewayApplication app = new TranslationGatewayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start AI Translation Gateway", e);
            System.exit(1);
        }
    }
}
