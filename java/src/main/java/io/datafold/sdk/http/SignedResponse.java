package io.datafold.sdk.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.datafold.sdk.SignableMessage;
import io.datafold.sdk.internal.Json;
import io.datafold.sdk.verification.VerificationResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Response of a {@link SignedHttpClient} call together with the outcome of response signature verification, when
 * that is enabled.
 */
public final class SignedResponse {

    private final int statusCode;
    private final Map<String, String> headers;
    private final byte[] body;
    private final SignableMessage request;
    private final VerificationResult verification;

    public SignedResponse(int statusCode, Map<String, String> headers, byte[] body, SignableMessage request,
                          VerificationResult verification) {
        this.statusCode = statusCode;
        Map<String, String> normalized = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
        }
        this.headers = Collections.unmodifiableMap(normalized);
        this.body = body == null ? new byte[0] : body.clone();
        this.request = Objects.requireNonNull(request, "request");
        this.verification = verification;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * @return response headers keyed by lowercase name; repeated headers are joined with {@code ", "}.
     */
    public Map<String, String> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }

    public byte[] body() {
        return body.clone();
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * @return the request as it was signed and sent.
     */
    public SignableMessage request() {
        return request;
    }

    public Optional<VerificationResult> verification() {
        return Optional.ofNullable(verification);
    }

    public SignedResponse withVerification(VerificationResult result) {
        return new SignedResponse(statusCode, headers, body, request, result);
    }

    public JsonNode json() throws HttpClientException {
        try {
            return Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw new HttpClientException(HttpErrorCode.INVALID_RESPONSE,
                "decode response: " + ex.getMessage(), statusCode, null, ex);
        }
    }

    public <T> T json(Class<T> type) throws HttpClientException {
        try {
            return Json.mapper().readValue(body, type);
        } catch (IOException ex) {
            throw new HttpClientException(HttpErrorCode.INVALID_RESPONSE,
                "decode response: " + ex.getMessage(), statusCode, null, ex);
        }
    }

    /**
     * Message view of this response, carrying the originating method and URL, for signature verification.
     */
    public SignableMessage toSignableMessage() {
        return SignableMessage.builder(request.method(), request.url())
            .headers(headers)
            .body(body.length == 0 ? null : body)
            .status(statusCode)
            .build();
    }

    @Override
    public String toString() {
        return "SignedResponse{status=" + statusCode + ", bodySize=" + body.length
            + ", verified=" + (verification == null ? "n/a" : verification.status().wireName()) + '}';
    }
}
