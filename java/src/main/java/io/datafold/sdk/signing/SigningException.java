package io.datafold.sdk.signing;

import io.datafold.sdk.DataFoldException;

import java.util.Map;

/**
 * Raised when a message cannot be signed. These indicate caller or configuration mistakes rather than adversarial
 * input.
 */
public class SigningException extends DataFoldException {

    private static final long serialVersionUID = 1L;

    public SigningException(SigningErrorCode code, String message) {
        super(code, message);
    }

    public SigningException(SigningErrorCode code, String message, Map<String, ?> details) {
        super(code, message, details);
    }

    public SigningException(SigningErrorCode code, String message, Map<String, ?> details, Throwable cause) {
        super(code, message, details, cause);
    }

    @Override
    public SigningErrorCode getErrorCode() {
        return (SigningErrorCode) super.getErrorCode();
    }
}
