package io.datafold.sdk.verification;

/**
 * Records nonces that have been accepted so a replayed signature can be refused.
 * <p>
 * Implementations backed by a shared store protect every instance that uses the store; {@link InMemoryReplayGuard}
 * only protects the current process and forgets everything on restart.
 */
public interface ReplayGuard {

    /**
     * Records {@code nonce}.
     *
     * @param created the signature's {@code created} parameter, usable for expiry
     * @return {@code true} if the nonce had not been seen before
     */
    boolean register(String nonce, long created);

    boolean contains(String nonce);

    void clear();
}
