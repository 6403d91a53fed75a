package io.datafold.sdk.verification;

import io.datafold.sdk.DataFoldException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error attached to a {@link VerificationStatus#ERROR} result.
 */
public record ResultError(String code, String message, Map<String, Object> details) {

    public ResultError {
        message = message == null ? "" : message;
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    static ResultError from(DataFoldException ex) {
        return new ResultError(ex.getCode(), ex.getMessage(), ex.getDetails());
    }
}
