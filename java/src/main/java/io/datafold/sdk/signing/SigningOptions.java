package io.datafold.sdk.signing;

import java.util.Optional;

/**
 * Per-call overrides applied on top of a {@link SigningConfig}. Pinning both nonce and timestamp makes signing
 * deterministic.
 */
public final class SigningOptions {

    private static final SigningOptions NONE = new Builder().build();

    private final String nonce;
    private final Long timestamp;
    private final DigestAlgorithm digestAlgorithm;
    private final SignatureComponents components;

    private SigningOptions(Builder builder) {
        this.nonce = builder.nonce;
        this.timestamp = builder.timestamp;
        this.digestAlgorithm = builder.digestAlgorithm;
        this.components = builder.components;
    }

    public static SigningOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> nonce() {
        return Optional.ofNullable(nonce);
    }

    public Optional<Long> timestamp() {
        return Optional.ofNullable(timestamp);
    }

    public Optional<DigestAlgorithm> digestAlgorithm() {
        return Optional.ofNullable(digestAlgorithm);
    }

    public Optional<SignatureComponents> components() {
        return Optional.ofNullable(components);
    }

    /**
     * @return whether the nonce or timestamp is pinned, which makes the result unsuitable for caching.
     */
    public boolean pinsParameters() {
        return nonce != null || timestamp != null;
    }

    public static final class Builder {
        private String nonce;
        private Long timestamp;
        private DigestAlgorithm digestAlgorithm;
        private SignatureComponents components;

        private Builder() {
        }

        public Builder nonce(String nonce) {
            this.nonce = nonce;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder digestAlgorithm(DigestAlgorithm digestAlgorithm) {
            this.digestAlgorithm = digestAlgorithm;
            return this;
        }

        public Builder components(SignatureComponents components) {
            this.components = components;
            return this;
        }

        public SigningOptions build() {
            return new SigningOptions(this);
        }
    }
}
