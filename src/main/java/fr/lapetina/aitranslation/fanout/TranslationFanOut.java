package fr.lapetina.aitranslation.fanout;

import fr.lapetina.aitranslation.domain.classification.Classification;
import fr.lapetina.aitranslation.domain.classification.ErrorClassifier;
import fr.lapetina.aitranslation.domain.confidence.CandidateConfidenceEstimator;
import fr.lapetina.aitranslation.domain.exception.ProviderCallException;
import fr.lapetina.aitranslation.domain.model.CandidateResult;
import fr.lapetina.aitranslation.domain.model.FailureKind;
import fr.lapetina.aitranslation.domain.model.ProviderDescriptor;
import fr.lapetina.aitranslation.infrastructure.credential.Credential;
import fr.lapetina.aitranslation.infrastructure.credential.CredentialPool;
import fr.lapetina.aitranslation.infrastructure.health.ProviderHealthTracker;
import fr.lapetina.aitranslation.infrastructure.health.ProviderRegistry;
import fr.lapetina.aitranslation.infrastructure.http.ProviderHttpClient;
import fr.lapetina.aitranslation.infrastructure.http.ProviderReply;
import fr.lapetina.aitranslation.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Calls every selected provider concurrently and collects the successful candidates.
 *
 * One provider's failure never fails the batch: it is classified, reported to the
 * health tracker (or to the credential pool for pooled providers) and dropped.
 * Cancellation aborts the calls still running and keeps the candidates already received.
 */
public final class TranslationFanOut {

    private static final Logger log = LoggerFactory.getLogger(TranslationFanOut.class);

    private final ProviderRegistry registry;
    private final ProviderHealthTracker healthTracker;
    private final Map<String, CredentialPool> pools;
    private final ErrorClassifier classifier;
    private final ProviderHttpClient httpClient;
    private final CandidateConfidenceEstimator confidenceEstimator;
    private final MetricsRegistry metrics;

    public TranslationFanOut(
            ProviderRegistry registry,
            ProviderHealthTracker healthTracker,
            Map<String, CredentialPool> pools,
            ErrorClassifier classifier,
            ProviderHttpClient httpClient,
            CandidateConfidenceEstimator confidenceEstimator,
            MetricsRegistry metrics
    ) {
        this.registry = registry;
        this.healthTracker = healthTracker;
        this.pools = pools;
        this.classifier = classifier;
        this.httpClient = httpClient;
        this.confidenceEstimator = confidenceEstimator;
        this.metrics = metrics;
    }

    public List<CandidateResult> translateAll(String text, String context, List<String> providerIds) {
        return translateAll(text, context, providerIds, CancellationToken.none());
    }

    /**
     * @return successful candidates, in the order of {@code providerIds}
     */
    public List<CandidateResult> translateAll(
            String text,
            String context,
            List<String> providerIds,
            CancellationToken token
    ) {
        if (providerIds == null || providerIds.isEmpty()) {
            return List.of();
        }
        if (token.isCancelled()) {
            log.debug("Fan-out skipped, request already cancelled");
            return List.of();
        }

        List<CompletableFuture<ProviderReply>> inFlight = new ArrayList<>();
        List<CompletableFuture<CandidateResult>> candidates = new ArrayList<>();
        for (String providerId : providerIds) {
            Optional<ProviderDescriptor> descriptor = registry.get(providerId);
            if (descriptor.isEmpty()) {
                log.warn("Selected provider is not registered: providerId={}", providerId);
                continue;
            }
            startCall(descriptor.get(), text, context, token, inFlight, candidates);
        }

        Runnable cancelAll = () -> {
            log.info("Cancelling in-flight provider calls: count={}", inFlight.size());
            inFlight.forEach(future -> future.cancel(true));
        };
        token.onCancel(cancelAll);
        try {
            CompletableFuture.allOf(candidates.toArray(new CompletableFuture[0])).join();
        } finally {
            token.removeCallback(cancelAll);
        }

        List<CandidateResult> successful = candidates.stream()
                .map(CompletableFuture::join)
                .filter(CandidateResult::isUsable)
                .toList();

        log.info("Fan-out complete: selected={}, successful={}", providerIds.size(), successful.size());
        return successful;
    }

    private void startCall(
            ProviderDescriptor provider,
            String text,
            String context,
            CancellationToken token,
            List<CompletableFuture<ProviderReply>> inFlight,
            List<CompletableFuture<CandidateResult>> candidates
    ) {
        CredentialPool pool = null;
        Credential credential = null;
        String apiKey = provider.getApiKey();

        if (provider.usesCredentialPool()) {
            pool = pools.get(provider.getCredentialPool());
            Optional<Credential> next = pool != null ? pool.nextAvailable() : Optional.empty();
            if (next.isEmpty()) {
                log.warn("No credential available, skipping provider: providerId={}, pool={}",
                        provider.getId(), provider.getCredentialPool());
                return;
            }
            credential = next.get();
            apiKey = credential.getKey();
        }

        CompletableFuture<ProviderReply> call;
        try {
            call = httpClient.complete(provider, apiKey, text, context);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        inFlight.add(call);

        CredentialPool callPool = pool;
        Credential callCredential = credential;
        candidates.add(call.handle((reply, ex) -> ex == null
                ? onSuccess(provider, callPool, callCredential, reply)
                : onFailure(provider, callPool, callCredential, ex, token)));
    }

    private CandidateResult onSuccess(ProviderDescriptor provider, CredentialPool pool, Credential credential,
                                      ProviderReply reply) {
        healthTracker.recordSuccess(provider.getId(), reply.totalTokens());
        if (pool != null) {
            pool.recordSuccess(credential, reply.latency().toMillis());
        }
        metrics.incrementProviderCall(provider.getId(), "success");
        metrics.recordProviderLatency(provider.getId(), reply.latency());

        double confidence = confidenceEstimator.estimate(reply.content(), provider.getModelFamily(), reply.latency());
        return new CandidateResult(reply.content(), confidence, provider.getId(), provider.getModelId(),
                reply.totalTokens(), reply.latency());
    }

    private CandidateResult onFailure(ProviderDescriptor provider, CredentialPool pool, Credential credential,
                                      Throwable ex, CancellationToken token) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;

        if (cause instanceof CancellationException || token.isCancelled()) {
            log.debug("Provider call cancelled: providerId={}", provider.getId());
            metrics.incrementProviderCall(provider.getId(), "cancelled");
            return CandidateResult.failed(provider.getId(), provider.getModelId());
        }

        ProviderCallException failure = cause instanceof ProviderCallException providerFailure
                ? providerFailure
                : new ProviderCallException(provider.getId(), String.valueOf(cause.getMessage()), cause);

        Classification classification = classifier.classify(provider.getFamily(), failure);
        String error = failure.getMessage();
        metrics.incrementProviderCall(provider.getId(), "failure");
        metrics.incrementProviderFailure(provider.getId(), classification.kind());

        if (pool != null && classification.kind() != FailureKind.TRANSIENT) {
            if (classification.kind() == FailureKind.AUTHENTICATION) {
                pool.markDisabled(credential, classification.reason());
            } else {
                pool.markRateLimited(credential, failure.getResponseBody());
            }
        } else {
            if (pool != null) {
                pool.recordFailure(credential);
            }
            healthTracker.recordFailure(provider.getId(), classification, error);
        }

        log.warn("Provider call failed: providerId={}, status={}, kind={}, error={}",
                provider.getId(), failure.getStatusCode(), classification.kind(), abbreviate(error));
        return CandidateResult.failed(provider.getId(), provider.getModelId());
    }

    private static String abbreviate(String error) {
        if (error == null || error.length() <= 200) {
            return error;
        }
        return error.substring(0, 200) + "...";
    }
}
