package fr.lapetina.aitranslation.domain.exception;

import java.time.Duration;

/**
 * A single provider call that did not produce a usable completion.
 *
 * Carries the raw material the error classifier works from: the HTTP status
 * (0 when no response was received), the free-form error body and the
 * {@code Retry-After} header when the provider sent one.
 */
public class ProviderCallException extends RuntimeException {

    private final String providerId;
    private final int statusCode;
    private final String responseBody;
    private final Duration retryAfter;

    public ProviderCallException(String providerId, int statusCode, String responseBody, Duration retryAfter) {
        super(providerId + " API error: " + statusCode + " " + (responseBody != null ? responseBody : ""));
        this.providerId = providerId;
        this.statusCode = statusCode;
        this.responseBody = responseBody != null ? responseBody : "";
        this.retryAfter = retryAfter;
    }

    /**
     * Failure without an HTTP response (connection refused, timeout, parse error).
     */
    public ProviderCallException(String providerId, String message, Throwable cause) {
        super(providerId + " call failed: " + message, cause);
        this.providerId = providerId;
        this.statusCode = 0;
        this.responseBody = message != null ? message : "";
        this.retryAfter = null;
    }

    public String getProviderId() {
        return providerId;
    }

    /**
     * HTTP status, or 0 when the call never got a response.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    /**
     * Parsed {@code Retry-After} header, or null.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean hasResponse() {
        return statusCode > 0;
    }
}
