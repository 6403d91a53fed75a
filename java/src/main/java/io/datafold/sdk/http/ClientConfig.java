package io.datafold.sdk.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link SignedHttpClient} instances.
 */
public final class ClientConfig {

    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "DataFold-Java-SDK/1.0.0";

    private final String baseUrl;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final SigningMode signingMode;
    private final Map<String, EndpointSigningConfig> endpointSigning;
    private final Map<String, String> defaultHeaders;
    private final String userAgent;
    private final boolean verifyResponses;
    private final String responsePolicy;
    private final boolean requireValidResponses;

    private ClientConfig(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.signingMode = builder.signingMode;
        this.endpointSigning = Collections.unmodifiableMap(new LinkedHashMap<>(builder.endpointSigning));
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders));
        this.userAgent = builder.userAgent;
        this.verifyResponses = builder.verifyResponses;
        this.responsePolicy = builder.responsePolicy;
        this.requireValidResponses = builder.requireValidResponses;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ClientConfig withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(baseUrl);

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .build();
        }

        String resolvedUserAgent = Optional.ofNullable(userAgent)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_USER_AGENT);

        String resolvedPolicy = Optional.ofNullable(responsePolicy)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(null);

        Builder resolved = new Builder()
            .baseUrl(resolvedBaseUrl)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .signingMode(Optional.ofNullable(signingMode).orElse(SigningMode.AUTO))
            .defaultHeaders(defaultHeaders)
            .userAgent(resolvedUserAgent)
            .verifyResponses(verifyResponses || requireValidResponses)
            .responsePolicy(resolvedPolicy)
            .requireValidResponses(requireValidResponses);
        endpointSigning.forEach(resolved::endpoint);
        return resolved.buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Base URL cannot be empty");
        }
        try {
            URI uri = new URI(trimmed);
            String scheme = uri.getScheme();
            if (scheme == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw new IllegalArgumentException("Invalid base URL format: " + trimmed);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    static String normalizeEndpoint(String endpoint) {
        String trimmed = Objects.requireNonNull(endpoint, "endpoint").trim();
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public SigningMode getSigningMode() {
        return signingMode;
    }

    /**
     * @return per-endpoint signing overrides keyed by path, each starting with {@code /}.
     */
    public Map<String, EndpointSigningConfig> getEndpointSigning() {
        return endpointSigning;
    }

    public Optional<EndpointSigningConfig> endpointSigning(String endpoint) {
        return Optional.ofNullable(endpointSigning.get(normalizeEndpoint(endpoint)));
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public boolean isVerifyResponses() {
        return verifyResponses;
    }

    /**
     * @return the policy used for response verification, or {@code null} for the verifier's default policy.
     */
    public String getResponsePolicy() {
        return responsePolicy;
    }

    public boolean isRequireValidResponses() {
        return requireValidResponses;
    }

    public static final class Builder {
        private String baseUrl;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private SigningMode signingMode;
        private final Map<String, EndpointSigningConfig> endpointSigning = new LinkedHashMap<>();
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private String userAgent;
        private boolean verifyResponses;
        private String responsePolicy;
        private boolean requireValidResponses;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder signingMode(SigningMode signingMode) {
            this.signingMode = signingMode;
            return this;
        }

        public Builder endpoint(String endpoint, EndpointSigningConfig config) {
            endpointSigning.put(normalizeEndpoint(endpoint), Objects.requireNonNull(config, "config"));
            return this;
        }

        public Builder defaultHeaders(Map<String, String> headers) {
            defaultHeaders.clear();
            if (headers != null) {
                headers.forEach(this::defaultHeader);
            }
            return this;
        }

        public Builder defaultHeader(String name, String value) {
            Objects.requireNonNull(name, "name");
            defaultHeaders.put(name.trim().toLowerCase(Locale.ROOT), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder verifyResponses(boolean verifyResponses) {
            this.verifyResponses = verifyResponses;
            return this;
        }

        public Builder responsePolicy(String responsePolicy) {
            this.responsePolicy = responsePolicy;
            return this;
        }

        /**
         * Rejects responses whose signature does not verify. Implies {@link #verifyResponses(boolean)}.
         */
        public Builder requireValidResponses(boolean requireValidResponses) {
            this.requireValidResponses = requireValidResponses;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this).withDefaults();
        }

        private ClientConfig buildInternal() {
            return new ClientConfig(this);
        }
    }
}
