package fr.lapetina.aitranslation.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.aitranslation.api.dto.TranslateRequest;
import fr.lapetina.aitranslation.domain.exception.AllProvidersFailedException;
import fr.lapetina.aitranslation.domain.exception.NoProvidersAvailableException;
import fr.lapetina.aitranslation.domain.model.ConsensusResult;
import fr.lapetina.aitranslation.domain.model.ProviderDescriptor;
import fr.lapetina.aitranslation.domain.selection.ProviderSelector;
import fr.lapetina.aitranslation.fanout.TranslationOrchestrator;
import fr.lapetina.aitranslation.infrastructure.config.ConfigLoader;
import fr.lapetina.aitranslation.infrastructure.config.TranslationConfig;
import fr.lapetina.aitranslation.infrastructure.credential.CredentialPool;
import fr.lapetina.aitranslation.infrastructure.health.ProviderHealthTracker;
import fr.lapetina.aitranslation.infrastructure.health.ProviderRegistry;
import fr.lapetina.aitranslation.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/translate - Translate a text with consensus across providers
 * - GET /health - Health check endpoint
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/providers - Status of every provider
 * - GET /admin/pools - Status of every credential pool
 * - POST /admin/providers/{id}/reset - Re-enable a provider
 * - POST /admin/pools/{name}/keys/{displayName}/reset - Re-enable one pooled key
 * - POST /admin/reload - Reload configuration
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String MDC_REQUEST_ID = "requestId";
    private static final Pattern PROVIDER_RESET = Pattern.compile("^/admin/providers/([^/]+)/reset$");
    private static final Pattern KEY_RESET = Pattern.compile("^/admin/pools/([^/]+)/keys/([^/]+)/reset$");

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final TranslationOrchestrator orchestrator;
    private final ProviderRegistry providerRegistry;
    private final ProviderHealthTracker healthTracker;
    private final ProviderSelector selector;
    private final Map<String, CredentialPool> credentialPools;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;

    public HttpServer(
            String host,
            int port,
            int backlog,
            int workerThreads,
            TranslationOrchestrator orchestrator,
            ProviderRegistry providerRegistry,
            ProviderHealthTracker healthTracker,
            ProviderSelector selector,
            Map<String, CredentialPool> credentialPools,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader
    ) throws IOException {
        this.orchestrator = orchestrator;
        this.providerRegistry = providerRegistry;
        this.healthTracker = healthTracker;
        this.selector = selector;
        this.credentialPools = credentialPools;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);

        InetSocketAddress address = host == null || host.isBlank()
                ? new InetSocketAddress(port)
                : new InetSocketAddress(host, port);
        this.server = com.sun.net.httpserver.HttpServer.create(address, backlog);

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workerThreads, r -> {
            Thread t = new Thread(r, "http-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/v1/translate", new TranslateHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured: host={}, port={}, workerThreads={}", host, port, workerThreads);
    }

    public void start() {
        server.start();
        log.info("HTTP server started");
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(5);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== TRANSLATE HANDLER ====================

    private class TranslateHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = exchange.getRequestHeaders().getFirst("X-Request-ID");
            MDC.put(MDC_REQUEST_ID, requestId != null ? requestId : UUID.randomUUID().toString());

            try {
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    sendError(exchange, 405, "Method Not Allowed");
                    return;
                }

                TranslateRequest request;
                try (InputStream is = exchange.getRequestBody()) {
                    request = objectMapper.readValue(is, TranslateRequest.class);
                } catch (JsonProcessingException e) {
                    sendError(exchange, 400, "Malformed JSON body");
                    return;
                }
                if (request == null) {
                    sendError(exchange, 400, "Request body is required");
                    return;
                }
                if (request.getRequestId() != null && requestId == null) {
                    MDC.put(MDC_REQUEST_ID, request.getRequestId());
                }

                int maxProviders = request.maxProvidersOr(defaultMaxProviders());
                ConsensusResult result = orchestrator.translate(request.getText(), request.getContext(), maxProviders);
                sendJson(exchange, 200, result);

            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, e.getMessage());
            } catch (NoProvidersAvailableException e) {
                log.warn("Translation rejected: {}", e.getMessage());
                sendError(exchange, 503, e.getMessage());
            } catch (AllProvidersFailedException e) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("error", e.getMessage());
                body.put("attemptedProviders", e.getAttemptedProviders());
                sendJson(exchange, 502, body);
            } catch (Exception e) {
                log.error("Error handling translation request", e);
                sendError(exchange, 500, "Internal server error: " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        private int defaultMaxProviders() {
            TranslationConfig config = configLoader.getCurrentConfig();
            return config != null ? config.getSelection().getMaxProviders() : 3;
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            List<ProviderDescriptor> enabled = providerRegistry.getEnabled();
            long available = enabled.stream()
                    .filter(p -> selector.isSelectable(p.getId()))
                    .count();

            String status;
            if (available == 0) {
                status = "DOWN";
            } else if (available < enabled.size()) {
                status = "DEGRADED";
            } else {
                status = "UP";
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", Instant.now());
            health.put("enabledProviders", enabled.size());
            health.put("availableProviders", available);

            // DEGRADED still serves traffic
            sendJson(exchange, "DOWN".equals(status) ? 503 : 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                Matcher providerReset = PROVIDER_RESET.matcher(path);
                Matcher keyReset = KEY_RESET.matcher(path);
                if (path.equals("/admin/providers") && "GET".equals(method)) {
                    sendJson(exchange, 200, orchestrator.providerStatusSnapshot());
                } else if (path.equals("/admin/pools") && "GET".equals(method)) {
                    sendJson(exchange, 200, orchestrator.poolStatusSnapshot());
                } else if (providerReset.matches() && "POST".equals(method)) {
                    handleProviderReset(exchange, providerReset.group(1));
                } else if (keyReset.matches() && "POST".equals(method)) {
                    handleKeyReset(exchange, keyReset.group(1), keyReset.group(2));
                } else if (path.equals("/admin/reload") && "POST".equals(method)) {
                    handleReloadConfig(exchange);
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (Exception e) {
                log.error("Error in admin handler", e);
                sendError(exchange, 500, e.getMessage());
            }
        }

        private void handleProviderReset(HttpExchange exchange, String providerId) throws IOException {
            if (providerRegistry.get(providerId).isEmpty() || !healthTracker.reset(providerId)) {
                sendError(exchange, 404, "Provider not found: " + providerId);
                return;
            }
            sendJson(exchange, 200, Map.of("provider", providerId, "action", "reset"));
        }

        private void handleKeyReset(HttpExchange exchange, String poolName, String displayName) throws IOException {
            CredentialPool pool = credentialPools.get(poolName);
            if (pool == null) {
                sendError(exchange, 404, "Credential pool not found: " + poolName);
                return;
            }
            if (!pool.reset(displayName)) {
                sendError(exchange, 404, "Key not found in pool " + poolName + ": " + displayName);
                return;
            }
            sendJson(exchange, 200, Map.of("pool", poolName, "key", displayName, "action", "reset"));
        }

        private void handleReloadConfig(HttpExchange exchange) throws IOException {
            TranslationConfig newConfig = configLoader.reload();
            sendJson(exchange, 200, Map.of(
                    "message", "Configuration reloaded",
                    "providers", newConfig.getProviders().size()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "Unknown error");
        sendJson(exchange, statusCode, error);
    }
}
