package io.datafold.sdk.http;

/**
 * When {@link SignedHttpClient} signs outgoing requests.
 */
public enum SigningMode {
    /** Sign every request unless its endpoint is configured otherwise. */
    AUTO,
    /** Sign only endpoints with an enabled {@link EndpointSigningConfig}. */
    MANUAL,
    /** Never sign. */
    DISABLED
}
