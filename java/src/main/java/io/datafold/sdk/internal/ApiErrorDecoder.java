package io.datafold.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding {@code {"code": ..., "message": ...}} error payloads. Payloads nesting the pair under an
 * {@code "error"} object are accepted too.
 */
public final class ApiErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();

    private ApiErrorDecoder() {
    }

    public static ApiError decode(int statusCode, byte[] body) {
        if (body == null || body.length == 0) {
            return new ApiError(statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(body);
            if (node.has("error") && node.get("error").isObject()) {
                node = node.get("error");
            }
            String code = node.hasNonNull("code") ? node.get("code").asText() : null;
            String message = node.hasNonNull("message") ? node.get("message").asText() : null;
            return new ApiError(statusCode, code, message);
        } catch (IOException ex) {
            String fallback = new String(body, StandardCharsets.UTF_8);
            return new ApiError(statusCode, null, fallback);
        }
    }

    /**
     * @param code    remote error code, or {@code null}
     * @param message remote error message or raw body, or {@code null}
     */
    public record ApiError(int statusCode, String code, String message) {
    }
}
