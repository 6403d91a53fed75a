package io.datafold.sdk;

/**
 * Broad classes of failure raised by the SDK.
 */
public enum ErrorCategory {
    CONFIGURATION,
    FORMAT,
    VALIDATION,
    CRYPTOGRAPHIC,
    KEY_RESOLUTION,
    TRANSPORT
}
