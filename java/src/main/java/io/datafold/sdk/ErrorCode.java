package io.datafold.sdk;

/**
 * Machine-readable error code carried by every {@link DataFoldException}.
 * Each subsystem contributes its own enum.
 */
public interface ErrorCode {

    /**
     * @return stable identifier, e.g. {@code INVALID_NONCE}.
     */
    String code();

    ErrorCategory category();
}
