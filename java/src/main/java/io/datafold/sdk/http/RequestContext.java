package io.datafold.sdk.http;

import io.datafold.sdk.HttpMethod;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-request state shared by the interceptors of one {@link SignedHttpClient} call. Not thread-safe; a context
 * never outlives its request.
 */
public final class RequestContext {

    private final HttpMethod method;
    private final String endpoint;
    private final long startNanos;
    private final boolean willBeSigned;
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private boolean signed;
    private String correlationId;

    RequestContext(HttpMethod method, String endpoint, boolean willBeSigned) {
        this.method = Objects.requireNonNull(method, "method");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.willBeSigned = willBeSigned;
        this.startNanos = System.nanoTime();
    }

    public HttpMethod method() {
        return method;
    }

    /**
     * @return the path the caller passed, before it was resolved against the base URL.
     */
    public String endpoint() {
        return endpoint;
    }

    public boolean willBeSigned() {
        return willBeSigned;
    }

    /**
     * @return whether signature headers were actually attached.
     */
    public boolean signed() {
        return signed;
    }

    public Optional<String> correlationId() {
        return Optional.ofNullable(correlationId);
    }

    public void correlationId(String correlationId) {
        this.correlationId = correlationId;
        if (correlationId != null) {
            metadata.put("correlation_id", correlationId);
        }
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public double elapsedMillis() {
        return (System.nanoTime() - startNanos) / 1_000_000d;
    }

    void markSigned() {
        this.signed = true;
    }
}
