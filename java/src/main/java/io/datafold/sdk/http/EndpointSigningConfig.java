package io.datafold.sdk.http;

import io.datafold.sdk.signing.SigningOptions;

import java.util.Objects;

/**
 * Per-endpoint override of the client's {@link SigningMode}.
 *
 * @param enabled  whether requests to the endpoint are signed
 * @param required whether a signing failure aborts the request instead of sending it unsigned
 * @param options  signing options applied to the endpoint's requests
 */
public record EndpointSigningConfig(boolean enabled, boolean required, SigningOptions options) {

    public EndpointSigningConfig {
        Objects.requireNonNull(options, "options");
    }

    public static EndpointSigningConfig signed() {
        return new EndpointSigningConfig(true, false, SigningOptions.none());
    }

    public static EndpointSigningConfig mandatory() {
        return new EndpointSigningConfig(true, true, SigningOptions.none());
    }

    public static EndpointSigningConfig disabled() {
        return new EndpointSigningConfig(false, false, SigningOptions.none());
    }

    public EndpointSigningConfig withOptions(SigningOptions options) {
        return new EndpointSigningConfig(enabled, required, options);
    }
}
