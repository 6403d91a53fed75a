package io.datafold.sdk;

import java.util.Locale;

/**
 * Standard HTTP verbs understood by the signer and verifier.
 */
public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE,
    OPTIONS;

    /**
     * Parses a method name case-insensitively.
     *
     * @throws IllegalArgumentException if the verb is not supported
     */
    public static HttpMethod of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("HTTP method is required");
        }
        try {
            return HttpMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("unsupported HTTP method " + value, ex);
        }
    }
}
