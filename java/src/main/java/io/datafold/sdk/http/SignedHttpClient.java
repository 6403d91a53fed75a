package io.datafold.sdk.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.datafold.sdk.HttpMethod;
import io.datafold.sdk.SignableMessage;
import io.datafold.sdk.internal.ApiErrorDecoder;
import io.datafold.sdk.internal.Json;
import io.datafold.sdk.signing.SignatureResult;
import io.datafold.sdk.signing.Signer;
import io.datafold.sdk.signing.SigningException;
import io.datafold.sdk.signing.SigningOptions;
import io.datafold.sdk.verification.VerificationErrorCode;
import io.datafold.sdk.verification.VerificationException;
import io.datafold.sdk.verification.VerificationResult;
import io.datafold.sdk.verification.Verifier;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * <p>
 * HTTP client that signs outgoing requests and optionally verifies signed responses. Wraps a
 * {@link java.net.http.HttpClient}; connection pooling, TLS and retries stay that client's business.
 * </p>
 *
 * <h2>Request pipeline</h2>
 * <ol>
 *   <li>Default headers, the user agent and the caller's headers are merged into a {@link SignableMessage}.</li>
 *   <li>{@link RequestInterceptor}s run in registration order.</li>
 *   <li>The {@link Signer} attaches signature headers when the {@link SigningMode} and the endpoint's
 *       {@link EndpointSigningConfig} call for it. A failure on a required endpoint aborts the request; otherwise it
 *       is logged and the request goes out unsigned.</li>
 *   <li>The response is verified with the {@link Verifier} when enabled, then {@link ResponseInterceptor}s run.</li>
 * </ol>
 * <p>
 * The interceptor chains are fixed at construction. Instances are thread-safe.
 * </p>
 */
public final class SignedHttpClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SignedHttpClient.class.getName());

    static final String USER_AGENT_HEADER = "user-agent";
    private static final String CONTENT_TYPE_JSON = "application/json";
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final ClientConfig config;
    private final HttpClient httpClient;
    private final Signer signer;
    private final Verifier verifier;
    private final List<RequestInterceptor> requestInterceptors;
    private final List<ResponseInterceptor> responseInterceptors;

    private SignedHttpClient(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config").withDefaults();
        this.httpClient = this.config.getHttpClient();
        this.signer = builder.signer;
        this.verifier = builder.verifier;
        this.requestInterceptors = List.copyOf(builder.requestInterceptors);
        this.responseInterceptors = List.copyOf(builder.responseInterceptors);
        if (this.config.isVerifyResponses() && this.verifier == null) {
            throw new IllegalArgumentException("response verification requires a Verifier");
        }
    }

    public static Builder builder(ClientConfig config) {
        return new Builder(config);
    }

    public ClientConfig config() {
        return config;
    }

    public boolean isSigningEnabled() {
        return signer != null && config.getSigningMode() != SigningMode.DISABLED;
    }

    public SignedResponse get(String endpoint) throws HttpClientException, VerificationException {
        return send(HttpMethod.GET, endpoint, Map.of(), null);
    }

    public SignedResponse delete(String endpoint) throws HttpClientException, VerificationException {
        return send(HttpMethod.DELETE, endpoint, Map.of(), null);
    }

    public SignedResponse post(String endpoint, Map<String, String> headers, byte[] body)
        throws HttpClientException, VerificationException {
        return send(HttpMethod.POST, endpoint, headers, body);
    }

    /**
     * Serialises {@code payload} with the SDK's JSON mapper, sends it and decodes a successful answer into
     * {@code responseType}.
     *
     * @throws HttpClientException if the request fails, the server answers with an error status or the answer cannot
     *                             be decoded
     */
    public <T> T sendJson(HttpMethod method, String endpoint, Object payload, Class<T> responseType)
        throws HttpClientException, VerificationException {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("accept", CONTENT_TYPE_JSON);
        byte[] body = null;
        if (payload != null) {
            try {
                body = Json.mapper().writeValueAsBytes(payload);
            } catch (JsonProcessingException ex) {
                throw new HttpClientException(HttpErrorCode.REQUEST_FAILED, "encode request: " + ex.getMessage(), ex);
            }
            headers.put("content-type", CONTENT_TYPE_JSON);
        }

        SignedResponse response = send(method, endpoint, headers, body);
        if (response.statusCode() >= 400) {
            ApiErrorDecoder.ApiError error = ApiErrorDecoder.decode(response.statusCode(), response.body());
            String message = error.message() == null || error.message().isBlank()
                ? "HTTP " + response.statusCode()
                : error.message();
            throw new HttpClientException(HttpErrorCode.SERVER_ERROR, "Server request failed: " + message,
                response.statusCode(), error.code(), null);
        }
        return response.json(responseType);
    }

    /**
     * Runs the full request pipeline for one call.
     *
     * @param endpoint path (and optional query) relative to the configured base URL
     * @throws HttpClientException   if the request cannot be sent or required signing fails
     * @throws VerificationException if {@link ClientConfig#isRequireValidResponses()} is set and the response signature
     *                               does not verify
     */
    public SignedResponse send(HttpMethod method, String endpoint, Map<String, String> headers, byte[] body)
        throws HttpClientException, VerificationException {
        Objects.requireNonNull(method, "method");
        String path = ClientConfig.normalizeEndpoint(endpoint);
        SigningDecision decision = signingDecision(path);
        RequestContext context = new RequestContext(method, path, decision.sign());

        SignableMessage.Builder messageBuilder = SignableMessage.builder(method, config.getBaseUrl() + path)
            .headers(config.getDefaultHeaders())
            .header(USER_AGENT_HEADER, config.getUserAgent())
            .headers(headers);
        if (body != null) {
            messageBuilder.body(body);
        }
        SignableMessage request;
        try {
            request = messageBuilder.build();
        } catch (IllegalArgumentException ex) {
            throw new HttpClientException(HttpErrorCode.REQUEST_FAILED, "build request: " + ex.getMessage(), ex);
        }

        request = applyRequestInterceptors(request, context);
        if (context.willBeSigned()) {
            request = sign(request, decision, context);
        }

        HttpResponse<byte[]> raw = execute(request);
        SignedResponse response = new SignedResponse(raw.statusCode(), flatten(raw), raw.body(), request, null);

        if (config.isVerifyResponses()) {
            response = verify(response);
        }
        return applyResponseInterceptors(response, context);
    }

    SigningDecision signingDecision(String endpoint) {
        if (!isSigningEnabled()) {
            return new SigningDecision(false, false, SigningOptions.none());
        }
        return config.endpointSigning(endpoint)
            .map(cfg -> new SigningDecision(cfg.enabled(), cfg.required(), cfg.options()))
            .orElseGet(() -> new SigningDecision(config.getSigningMode() == SigningMode.AUTO, false,
                SigningOptions.none()));
    }

    private SignableMessage applyRequestInterceptors(SignableMessage request, RequestContext context) {
        SignableMessage current = request;
        for (RequestInterceptor interceptor : requestInterceptors) {
            try {
                SignableMessage next = interceptor.intercept(current, context);
                if (next != null) {
                    current = next;
                }
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, ex, () -> "[datafold-sdk] request interceptor failed for "
                    + context.endpoint() + ": " + ex.getMessage());
            }
        }
        return current;
    }

    private SignedResponse applyResponseInterceptors(SignedResponse response, RequestContext context) {
        SignedResponse current = response;
        for (ResponseInterceptor interceptor : responseInterceptors) {
            try {
                SignedResponse next = interceptor.intercept(current, context);
                if (next != null) {
                    current = next;
                }
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, ex, () -> "[datafold-sdk] response interceptor failed for "
                    + context.endpoint() + ": " + ex.getMessage());
            }
        }
        return current;
    }

    private SignableMessage sign(SignableMessage request, SigningDecision decision, RequestContext context)
        throws HttpClientException {
        try {
            SignatureResult result = signer.sign(request, decision.options());
            context.markSigned();
            LOGGER.fine(() -> "[datafold-sdk] signed " + request.method() + " " + context.endpoint());
            return request.withHeaders(result.headers());
        } catch (SigningException ex) {
            if (decision.required()) {
                throw new HttpClientException(HttpErrorCode.SIGNING_REQUIRED_FAILED,
                    "Required signing failed for " + context.endpoint() + ": " + ex.getMessage(), ex);
            }
            LOGGER.warning(() -> "[datafold-sdk] optional signing failed for " + context.endpoint() + ": "
                + ex.getMessage() + "; sending unsigned");
            return request;
        }
    }

    private HttpResponse<byte[]> execute(SignableMessage request) throws HttpClientException {
        HttpRequest.Builder builder;
        try {
            builder = HttpRequest.newBuilder()
                .uri(URI.create(request.url()))
                .timeout(config.getHttpTimeout());
            for (Map.Entry<String, String> header : request.headers().entrySet()) {
                if (!RESTRICTED_HEADERS.contains(header.getKey())) {
                    builder.header(header.getKey(), header.getValue());
                }
            }
        } catch (IllegalArgumentException ex) {
            throw new HttpClientException(HttpErrorCode.REQUEST_FAILED, "build request: " + ex.getMessage(), ex);
        }
        if (request.hasBody()) {
            builder.method(request.method().name(), HttpRequest.BodyPublishers.ofByteArray(request.bodyBytes()));
        } else {
            builder.method(request.method().name(), HttpRequest.BodyPublishers.noBody());
        }

        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new HttpClientException(HttpErrorCode.REQUEST_INTERRUPTED,
                "perform request interrupted", ex);
        } catch (IOException ex) {
            throw new HttpClientException(HttpErrorCode.REQUEST_FAILED,
                "perform request: " + ex.getMessage(), ex);
        }
    }

    private SignedResponse verify(SignedResponse response) throws VerificationException {
        VerificationResult result = verifier.verify(response.toSignableMessage(), response.headers(),
            config.getResponsePolicy());
        if (config.isRequireValidResponses() && !result.isValid()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("status", result.status().wireName());
            details.put("statusCode", response.statusCode());
            result.errorDetails().ifPresent(error -> details.put("cause", error.code()));
            throw new VerificationException(
                VerificationErrorCode.RESPONSE_VERIFICATION_FAILED,
                "Response signature verification failed: " + result.status().wireName(),
                details
            );
        }
        return response.withVerification(result);
    }

    private static Map<String, String> flatten(HttpResponse<?> response) {
        Map<String, String> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> {
            if (!name.startsWith(":")) {
                headers.put(name, String.join(", ", values));
            }
        });
        return headers;
    }

    @Override
    public void close() {
        // httpClient is managed externally; nothing to close.
    }

    record SigningDecision(boolean sign, boolean required, SigningOptions options) {
    }

    public static final class Builder {
        private final ClientConfig config;
        private Signer signer;
        private Verifier verifier;
        private final List<RequestInterceptor> requestInterceptors = new ArrayList<>();
        private final List<ResponseInterceptor> responseInterceptors = new ArrayList<>();

        private Builder(ClientConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        public Builder signer(Signer signer) {
            this.signer = signer;
            return this;
        }

        public Builder verifier(Verifier verifier) {
            this.verifier = verifier;
            return this;
        }

        public Builder addRequestInterceptor(RequestInterceptor interceptor) {
            requestInterceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        public Builder addResponseInterceptor(ResponseInterceptor interceptor) {
            responseInterceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        public SignedHttpClient build() {
            return new SignedHttpClient(this);
        }
    }
}
