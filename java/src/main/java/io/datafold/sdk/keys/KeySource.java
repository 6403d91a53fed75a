package io.datafold.sdk.keys;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous public key lookup consulted by the verifier when a key is neither supplied nor registered locally.
 * Sources are tried in order; an empty result, a failure or a timeout moves on to the next source.
 */
public interface KeySource {

    String name();

    /**
     * @return the raw 32-byte public key, or empty when this source does not know {@code keyId}.
     */
    CompletableFuture<Optional<byte[]>> retrieve(String keyId);
}
