package io.datafold.sdk.http;

import io.datafold.sdk.DataFoldException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raised by {@link SignedHttpClient} when a request cannot be sent, a required signature cannot be produced or the
 * server answers with an error.
 */
public class HttpClientException extends DataFoldException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String remoteCode;

    public HttpClientException(HttpErrorCode code, String message, Throwable cause) {
        this(code, message, 0, null, cause);
    }

    public HttpClientException(HttpErrorCode code, String message, int statusCode, String remoteCode, Throwable cause) {
        super(code, message, details(statusCode, remoteCode), cause);
        this.statusCode = statusCode;
        this.remoteCode = remoteCode;
    }

    /**
     * @return the HTTP status, or {@code 0} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getRemoteCode() {
        return remoteCode;
    }

    private static Map<String, Object> details(int statusCode, String remoteCode) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (statusCode > 0) {
            details.put("statusCode", statusCode);
        }
        if (remoteCode != null) {
            details.put("remoteCode", remoteCode);
        }
        return details;
    }
}
