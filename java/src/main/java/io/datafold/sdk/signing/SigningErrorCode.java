package io.datafold.sdk.signing;

import io.datafold.sdk.ErrorCategory;
import io.datafold.sdk.ErrorCode;

/**
 * Failures raised on the signing path.
 */
public enum SigningErrorCode implements ErrorCode {
    INVALID_CONFIG(ErrorCategory.CONFIGURATION),
    INVALID_PRIVATE_KEY(ErrorCategory.CONFIGURATION),
    INVALID_KEY_ID(ErrorCategory.CONFIGURATION),
    INVALID_SIGNATURE_COMPONENTS(ErrorCategory.CONFIGURATION),
    UNKNOWN_PROFILE(ErrorCategory.CONFIGURATION),
    INVALID_URL(ErrorCategory.VALIDATION),
    INVALID_NONCE(ErrorCategory.VALIDATION),
    INVALID_TIMESTAMP(ErrorCategory.VALIDATION),
    MISSING_REQUIRED_HEADER(ErrorCategory.VALIDATION),
    CANONICAL_MESSAGE_FAILED(ErrorCategory.FORMAT),
    DIGEST_CALCULATION_FAILED(ErrorCategory.CRYPTOGRAPHIC),
    CRYPTOGRAPHY_UNAVAILABLE(ErrorCategory.CRYPTOGRAPHIC),
    SIGNING_FAILED(ErrorCategory.CRYPTOGRAPHIC);

    private final ErrorCategory category;

    SigningErrorCode(ErrorCategory category) {
        this.category = category;
    }

    @Override
    public String code() {
        return name();
    }

    @Override
    public ErrorCategory category() {
        return category;
    }
}
