package io.datafold.sdk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base exception thrown by the DataFold Java SDK.
 */
public class DataFoldException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final transient Map<String, Object> details;

    public DataFoldException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public DataFoldException(ErrorCode errorCode, String message, Map<String, ?> details) {
        this(errorCode, message, details, null);
    }

    public DataFoldException(ErrorCode errorCode, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode");
        this.details = details == null || details.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return shorthand for {@code getErrorCode().code()}.
     */
    public String getCode() {
        return errorCode.code();
    }

    public ErrorCategory getCategory() {
        return errorCode.category();
    }

    /**
     * @return structured context for the failure; never {@code null}.
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
