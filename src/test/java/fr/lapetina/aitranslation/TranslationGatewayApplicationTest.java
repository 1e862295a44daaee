package fr.lapetina.aitranslation;

import fr.lapetina.aitranslation.integration.TestOrchestratorFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TranslationGatewayApplicationTest {

    @Test
    @DisplayName("should serve health checks on the bound port until shutdown is requested")
    void shouldStartAndStop() throws Exception {
        TranslationGatewayApplication app = new TranslationGatewayApplication(TestOrchestratorFactory.create());
        try {
            app.start();
            assertThat(app.getPort()).isPositive();

            HttpResponse<String> response = HttpClient.newHttpClient().send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + app.getPort() + "/health")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("\"status\":\"UP\"");

            CompletableFuture<Void> waiting = CompletableFuture.runAsync(() -> {
                try {
                    app.awaitShutdown();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            app.requestShutdown();
            waiting.get(5, TimeUnit.SECONDS);
            assertThat(waiting).isDone();
        } finally {
            app.close();
        }
    }
}
