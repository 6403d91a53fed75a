package io.datafold.sdk;

import java.util.Map;

/**
 * Raised when SDK configuration or an external policy source is invalid.
 */
public class ConfigurationException extends DataFoldException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(ConfigErrorCode code, String message) {
        super(code, message);
    }

    public ConfigurationException(ConfigErrorCode code, String message, Map<String, ?> details) {
        super(code, message, details);
    }

    public ConfigurationException(ConfigErrorCode code, String message, Map<String, ?> details, Throwable cause) {
        super(code, message, details, cause);
    }
}
