package io.datafold.sdk.verification;

import io.datafold.sdk.DataFoldException;

import java.util.Map;

/**
 * Raised by extraction, policy lookup and key resolution. {@link Verifier#verify} converts these into
 * {@link VerificationStatus#ERROR} results instead of propagating them.
 */
public class VerificationException extends DataFoldException {

    private static final long serialVersionUID = 1L;

    public VerificationException(VerificationErrorCode code, String message) {
        super(code, message);
    }

    public VerificationException(VerificationErrorCode code, String message, Map<String, ?> details) {
        super(code, message, details);
    }

    public VerificationException(VerificationErrorCode code, String message, Map<String, ?> details, Throwable cause) {
        super(code, message, details, cause);
    }

    @Override
    public VerificationErrorCode getErrorCode() {
        return (VerificationErrorCode) super.getErrorCode();
    }
}
