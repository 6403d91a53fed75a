package io.datafold.sdk.keys;

import io.datafold.sdk.DataFoldException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Exposes the public half of a {@link KeyProvider} as a {@link KeySource}.
 */
public final class KeyProviderSource implements KeySource {

    private final String name;
    private final KeyProvider provider;

    public KeyProviderSource(String name, KeyProvider provider) {
        this.name = Objects.requireNonNull(name, "name");
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletableFuture<Optional<byte[]>> retrieve(String keyId) {
        try {
            return CompletableFuture.completedFuture(provider.publicKey(keyId));
        } catch (DataFoldException | RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }
}
