package io.datafold.sdk.verification;

import io.datafold.sdk.internal.Ed25519;
import io.datafold.sdk.keys.KeySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves the public key for a signature: an explicit key first, then locally registered keys, then each
 * {@link KeySource} in order. A source that fails, times out or returns a malformed key is skipped.
 */
public final class PublicKeyResolver {

    private static final Logger LOGGER = Logger.getLogger(PublicKeyResolver.class.getName());

    private final Map<String, byte[]> localKeys = new ConcurrentHashMap<>();
    private final List<KeySource> sources;
    private final Duration sourceTimeout;

    public PublicKeyResolver(Map<String, byte[]> localKeys, List<KeySource> sources, Duration sourceTimeout) {
        if (localKeys != null) {
            localKeys.forEach(this::addKey);
        }
        this.sources = List.copyOf(sources == null ? List.of() : sources);
        this.sourceTimeout = Objects.requireNonNull(sourceTimeout, "sourceTimeout");
    }

    /**
     * @throws IllegalArgumentException if {@code publicKey} is not 32 bytes
     */
    public void addKey(String keyId, byte[] publicKey) {
        Objects.requireNonNull(keyId, "keyId");
        if (!Ed25519.isValidKeyLength(publicKey)) {
            throw new IllegalArgumentException("public key must be " + Ed25519.KEY_LENGTH + " bytes");
        }
        localKeys.put(keyId, publicKey.clone());
    }

    public boolean removeKey(String keyId) {
        return keyId != null && localKeys.remove(keyId) != null;
    }

    public boolean hasLocalKey(String keyId) {
        return keyId != null && localKeys.containsKey(keyId);
    }

    public List<KeySource> sources() {
        return sources;
    }

    /**
     * @param explicitKey      caller-supplied key, used as is when present
     * @param skipRetrieval    whether to stop after the local keys
     * @return a future completing with the raw key, or exceptionally with a {@link VerificationException}
     */
    public CompletableFuture<byte[]> resolve(String keyId, Optional<byte[]> explicitKey, boolean skipRetrieval) {
        if (explicitKey.isPresent()) {
            byte[] key = explicitKey.get();
            if (!Ed25519.isValidKeyLength(key)) {
                return CompletableFuture.failedFuture(new VerificationException(
                    VerificationErrorCode.INVALID_PUBLIC_KEY,
                    "Public key must be " + Ed25519.KEY_LENGTH + " bytes",
                    Map.of("actualLength", key.length)
                ));
            }
            return CompletableFuture.completedFuture(key);
        }
        byte[] local = keyId == null ? null : localKeys.get(keyId);
        if (local != null) {
            return CompletableFuture.completedFuture(local.clone());
        }
        if (skipRetrieval || sources.isEmpty()) {
            return CompletableFuture.failedFuture(notFound(keyId, skipRetrieval));
        }
        return tryFrom(0, keyId);
    }

    private CompletableFuture<byte[]> tryFrom(int index, String keyId) {
        if (index >= sources.size()) {
            return CompletableFuture.failedFuture(notFound(keyId, false));
        }
        KeySource source = sources.get(index);
        CompletableFuture<Optional<byte[]>> attempt;
        try {
            attempt = source.retrieve(keyId);
        } catch (RuntimeException ex) {
            attempt = CompletableFuture.failedFuture(ex);
        }
        if (attempt == null) {
            attempt = CompletableFuture.failedFuture(new IllegalStateException("key source returned no future"));
        }
        CompletableFuture<Optional<byte[]>> pending = attempt;
        return pending.copy()
            .orTimeout(sourceTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((key, error) -> {
                if (error != null) {
                    Throwable cause = unwrap(error);
                    if (cause instanceof TimeoutException) {
                        pending.cancel(true);
                        LOGGER.warning(() -> "[datafold-sdk] key source " + source.name() + " timed out after "
                            + sourceTimeout.toMillis() + "ms for key " + keyId);
                    } else {
                        LOGGER.log(Level.WARNING, cause, () -> "[datafold-sdk] key source " + source.name()
                            + " failed for key " + keyId + ": " + cause.getMessage());
                    }
                    return tryFrom(index + 1, keyId);
                }
                if (key == null || key.isEmpty()) {
                    return tryFrom(index + 1, keyId);
                }
                if (!Ed25519.isValidKeyLength(key.get())) {
                    LOGGER.warning(() -> "[datafold-sdk] key source " + source.name() + " returned a "
                        + key.get().length + "-byte key for " + keyId);
                    return tryFrom(index + 1, keyId);
                }
                return CompletableFuture.completedFuture(key.get().clone());
            })
            .thenCompose(next -> next);
    }

    private VerificationException notFound(String keyId, boolean skipped) {
        return new VerificationException(
            VerificationErrorCode.PUBLIC_KEY_NOT_FOUND,
            "Public key not found for key ID: " + keyId,
            Map.of("keyId", String.valueOf(keyId), "sourcesTried", skipped ? 0 : sources.size())
        );
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
