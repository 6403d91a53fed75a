package io.datafold.sdk.keys;

import io.datafold.sdk.internal.Ed25519;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe key provider backed by maps. Keys are copied on the way in and out.
 */
public final class InMemoryKeyProvider implements KeyProvider {

    private final Map<String, byte[]> privateKeys = new ConcurrentHashMap<>();
    private final Map<String, byte[]> publicKeys = new ConcurrentHashMap<>();

    public InMemoryKeyProvider putKeyPair(String keyId, Ed25519.RawKeyPair pair) {
        Objects.requireNonNull(pair, "pair");
        putPrivateKey(keyId, pair.privateKey());
        return putPublicKey(keyId, pair.publicKey());
    }

    public InMemoryKeyProvider putPrivateKey(String keyId, byte[] key) {
        privateKeys.put(requireKeyId(keyId), requireKey(key));
        return this;
    }

    public InMemoryKeyProvider putPublicKey(String keyId, byte[] key) {
        publicKeys.put(requireKeyId(keyId), requireKey(key));
        return this;
    }

    public void remove(String keyId) {
        if (keyId == null) {
            return;
        }
        privateKeys.remove(keyId);
        publicKeys.remove(keyId);
    }

    public Set<String> publicKeyIds() {
        return Set.copyOf(publicKeys.keySet());
    }

    @Override
    public Optional<byte[]> privateKey(String keyId) {
        return lookup(privateKeys, keyId);
    }

    @Override
    public Optional<byte[]> publicKey(String keyId) {
        return lookup(publicKeys, keyId);
    }

    private static Optional<byte[]> lookup(Map<String, byte[]> keys, String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        byte[] key = keys.get(keyId);
        return key == null ? Optional.empty() : Optional.of(key.clone());
    }

    private static String requireKeyId(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("keyId must be non-empty");
        }
        return keyId;
    }

    private static byte[] requireKey(byte[] key) {
        if (!Ed25519.isValidKeyLength(key)) {
            throw new IllegalArgumentException("Ed25519 keys must be " + Ed25519.KEY_LENGTH + " bytes");
        }
        return key.clone();
    }
}
