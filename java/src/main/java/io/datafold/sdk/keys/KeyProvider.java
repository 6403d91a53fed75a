package io.datafold.sdk.keys;

import io.datafold.sdk.DataFoldException;

import java.util.Optional;

/**
 * Supplies raw 32-byte Ed25519 keys by identifier. Storage, rotation and derivation live behind this interface.
 */
public interface KeyProvider {

    /**
     * @return the private key for signing, or empty when unknown.
     */
    Optional<byte[]> privateKey(String keyId) throws DataFoldException;

    /**
     * @return the public key for verification, or empty when unknown.
     */
    Optional<byte[]> publicKey(String keyId) throws DataFoldException;
}
