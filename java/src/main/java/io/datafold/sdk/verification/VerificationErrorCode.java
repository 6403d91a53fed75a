package io.datafold.sdk.verification;

import io.datafold.sdk.ErrorCategory;
import io.datafold.sdk.ErrorCode;

/**
 * Failures raised or reported on the verification path.
 */
public enum VerificationErrorCode implements ErrorCode {
    INVALID_CONFIG(ErrorCategory.CONFIGURATION),
    INVALID_POLICY(ErrorCategory.CONFIGURATION),
    UNKNOWN_POLICY(ErrorCategory.CONFIGURATION),
    INVALID_PUBLIC_KEY(ErrorCategory.CONFIGURATION),
    MISSING_SIGNATURE_INPUT(ErrorCategory.FORMAT),
    MISSING_SIGNATURE(ErrorCategory.FORMAT),
    INVALID_SIGNATURE_FORMAT(ErrorCategory.FORMAT),
    INVALID_SIGNATURE_INPUT_FORMAT(ErrorCategory.FORMAT),
    SIGNATURE_ID_MISMATCH(ErrorCategory.FORMAT),
    INVALID_CONTENT_DIGEST_FORMAT(ErrorCategory.FORMAT),
    CANONICAL_MESSAGE_RECONSTRUCTION_FAILED(ErrorCategory.FORMAT),
    PUBLIC_KEY_NOT_FOUND(ErrorCategory.KEY_RESOLUTION),
    KEY_RETRIEVAL_FAILED(ErrorCategory.KEY_RESOLUTION),
    VERIFICATION_FAILED(ErrorCategory.VALIDATION),
    BATCH_VERIFICATION_ERROR(ErrorCategory.VALIDATION),
    RESPONSE_VERIFICATION_FAILED(ErrorCategory.VALIDATION);

    private final ErrorCategory category;

    VerificationErrorCode(ErrorCategory category) {
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
