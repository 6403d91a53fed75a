package io.datafold.sdk.keys;

import io.datafold.sdk.DataFoldException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised when a remote key service answers with an error or an unusable payload.
 */
public class KeyServiceException extends DataFoldException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String remoteCode;

    public KeyServiceException(int statusCode, String remoteCode, String message) {
        this(KeyErrorCode.KEY_SERVICE_ERROR, statusCode, remoteCode, message, null);
    }

    public KeyServiceException(KeyErrorCode code, int statusCode, String remoteCode, String message, Throwable cause) {
        super(code, buildMessage(statusCode, remoteCode, message), details(statusCode, remoteCode), cause);
        this.statusCode = statusCode;
        this.remoteCode = remoteCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the error code reported by the key service, if any.
     */
    public String getRemoteCode() {
        return remoteCode;
    }

    private static String buildMessage(int statusCode, String remoteCode, String message) {
        StringBuilder sb = new StringBuilder();
        sb.append("key service error (status ").append(statusCode).append(')');
        if (remoteCode != null && !remoteCode.isBlank()) {
            sb.append(" code=").append(remoteCode);
        }
        if (message != null && !message.isBlank()) {
            sb.append(": ").append(message);
        }
        return sb.toString();
    }

    private static Map<String, Object> details(int statusCode, String remoteCode) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("statusCode", statusCode);
        if (remoteCode != null) {
            details.put("remoteCode", remoteCode);
        }
        return details;
    }
}
