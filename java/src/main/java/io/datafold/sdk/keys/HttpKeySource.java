package io.datafold.sdk.keys;

import com.fasterxml.jackson.databind.JsonNode;
import io.datafold.sdk.internal.ApiErrorDecoder;
import io.datafold.sdk.internal.Ed25519;
import io.datafold.sdk.internal.Hex;
import io.datafold.sdk.internal.Json;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Fetches public keys from a key service: {@code GET {baseUrl}/{keyId}} answering
 * {@code {"key_id": "...", "public_key": "<base64 or hex>"}}. A 404 means the service does not know the key.
 */
public final class HttpKeySource implements KeySource {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final String name;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpKeySource(HttpClient httpClient, String baseUrl) {
        this("http:" + baseUrl, httpClient, baseUrl, DEFAULT_TIMEOUT);
    }

    public HttpKeySource(String name, HttpClient httpClient, String baseUrl, Duration requestTimeout) {
        this.name = Objects.requireNonNull(name, "name");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        Objects.requireNonNull(baseUrl, "baseUrl");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout == null ? DEFAULT_TIMEOUT : requestTimeout;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<Optional<byte[]>> retrieve(String keyId) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/" + URLEncoder.encode(keyId, StandardCharsets.UTF_8).replace("+", "%20")))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
            .thenApply(response -> {
                try {
                    return decode(keyId, response.statusCode(), response.body());
                } catch (KeyServiceException ex) {
                    throw new CompletionException(ex);
                }
            });
    }

    static Optional<byte[]> decode(String keyId, int statusCode, byte[] body) throws KeyServiceException {
        if (statusCode == 404) {
            return Optional.empty();
        }
        if (statusCode >= 400) {
            ApiErrorDecoder.ApiError error = ApiErrorDecoder.decode(statusCode, body);
            throw new KeyServiceException(statusCode, error.code(), error.message());
        }

        JsonNode node;
        try {
            node = Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw new KeyServiceException(KeyErrorCode.INVALID_KEY_RESPONSE, statusCode, null,
                "decode key response: " + ex.getMessage(), ex);
        }
        String returnedId = node.path("key_id").asText("");
        if (!returnedId.isEmpty() && !returnedId.equals(keyId)) {
            throw new KeyServiceException(KeyErrorCode.INVALID_KEY_RESPONSE, statusCode, null,
                "key service returned key " + returnedId + " for " + keyId, null);
        }
        String encoded = node.path("public_key").asText("");
        if (encoded.isBlank()) {
            throw new KeyServiceException(KeyErrorCode.INVALID_KEY_RESPONSE, statusCode, null,
                "key response missing public_key", null);
        }
        byte[] key = parseKey(encoded.trim(), statusCode);
        if (!Ed25519.isValidKeyLength(key)) {
            throw new KeyServiceException(KeyErrorCode.INVALID_KEY_RESPONSE, statusCode, null,
                "public key must be " + Ed25519.KEY_LENGTH + " bytes", null);
        }
        return Optional.of(key);
    }

    private static byte[] parseKey(String encoded, int statusCode) throws KeyServiceException {
        if (encoded.length() == Ed25519.KEY_LENGTH * 2 && Hex.isHex(encoded)) {
            return Hex.decode(encoded);
        }
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException ex) {
            throw new KeyServiceException(KeyErrorCode.INVALID_KEY_RESPONSE, statusCode, null,
                "public_key is neither hex nor base64", ex);
        }
    }
}
