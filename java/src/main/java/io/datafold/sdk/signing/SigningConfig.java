package io.datafold.sdk.signing;

import io.datafold.sdk.DataFoldException;
import io.datafold.sdk.internal.Ed25519;
import io.datafold.sdk.keys.KeyProvider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Immutable configuration for a {@link RequestSigner}. Built through {@link #builder()}; the builder validates the key,
 * the key id and the component selection, and copies everything so later builder mutations have no effect.
 */
public final class SigningConfig {

    public static final String DEFAULT_SIGNATURE_LABEL = "sig1";
    public static final Duration DEFAULT_PERFORMANCE_TARGET = Duration.ofMillis(10);

    private final SignatureAlgorithm algorithm;
    private final String keyId;
    private final byte[] privateKey;
    private final SignatureComponents components;
    private final DigestAlgorithm digestAlgorithm;
    private final boolean strictHeaders;
    private final List<String> requiredHeaders;
    private final boolean allowCustomNonces;
    private final Supplier<String> nonceGenerator;
    private final LongSupplier timestampGenerator;
    private final String signatureLabel;
    private final Duration performanceTarget;

    private SigningConfig(Builder builder, byte[] privateKey) {
        this.algorithm = builder.algorithm;
        this.keyId = builder.keyId.trim();
        this.privateKey = privateKey.clone();
        this.components = builder.components.build();
        this.digestAlgorithm = builder.digestAlgorithm;
        this.strictHeaders = builder.strictHeaders;
        this.requiredHeaders = List.copyOf(builder.requiredHeaders);
        this.allowCustomNonces = builder.allowCustomNonces;
        this.nonceGenerator = builder.nonceGenerator;
        this.timestampGenerator = builder.timestampGenerator;
        this.signatureLabel = builder.signatureLabel;
        this.performanceTarget = builder.performanceTarget;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for a configuration that applies the named profile.
     */
    public static SigningConfig fromProfile(SecurityProfile profile, String keyId, byte[] privateKey) throws SigningException {
        return builder().profile(profile).keyId(keyId).privateKey(privateKey).build();
    }

    public SignatureAlgorithm algorithm() {
        return algorithm;
    }

    public String keyId() {
        return keyId;
    }

    /**
     * @return a copy of the raw private key.
     */
    public byte[] privateKey() {
        return privateKey.clone();
    }

    public SignatureComponents components() {
        return components;
    }

    public DigestAlgorithm digestAlgorithm() {
        return digestAlgorithm;
    }

    public boolean strictHeaders() {
        return strictHeaders;
    }

    public List<String> requiredHeaders() {
        return requiredHeaders;
    }

    public boolean allowCustomNonces() {
        return allowCustomNonces;
    }

    public Supplier<String> nonceGenerator() {
        return nonceGenerator;
    }

    public LongSupplier timestampGenerator() {
        return timestampGenerator;
    }

    public String signatureLabel() {
        return signatureLabel;
    }

    public Duration performanceTarget() {
        return performanceTarget;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .algorithm(algorithm)
            .keyId(keyId)
            .privateKey(privateKey)
            .components(components)
            .digestAlgorithm(digestAlgorithm)
            .strictHeaders(strictHeaders)
            .requiredHeaders(requiredHeaders)
            .allowCustomNonces(allowCustomNonces)
            .signatureLabel(signatureLabel)
            .performanceTarget(performanceTarget);
        builder.nonceGenerator = nonceGenerator;
        builder.timestampGenerator = timestampGenerator;
        return builder;
    }

    @Override
    public String toString() {
        return "SigningConfig{keyId=" + keyId + ", algorithm=" + algorithm.wireName() + ", components=" + components
            + ", digest=" + digestAlgorithm.wireName() + ", strictHeaders=" + strictHeaders + '}';
    }

    public static final class Builder {
        private SignatureAlgorithm algorithm = SignatureAlgorithm.ED25519;
        private String keyId;
        private byte[] privateKey;
        private KeyProvider keyProvider;
        private SignatureComponents.Builder components = SecurityProfile.STANDARD.components().toBuilder();
        private DigestAlgorithm digestAlgorithm = DigestAlgorithm.SHA_256;
        private boolean strictHeaders;
        private final List<String> requiredHeaders = new ArrayList<>();
        private boolean allowCustomNonces = true;
        private Supplier<String> nonceGenerator = SignatureParamsGenerator::randomNonce;
        private LongSupplier timestampGenerator = () -> System.currentTimeMillis() / 1000L;
        private String signatureLabel = DEFAULT_SIGNATURE_LABEL;
        private Duration performanceTarget = DEFAULT_PERFORMANCE_TARGET;

        private Builder() {
        }

        public Builder algorithm(SignatureAlgorithm algorithm) {
            this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
            return this;
        }

        public Builder keyId(String keyId) {
            this.keyId = keyId;
            return this;
        }

        public Builder privateKey(byte[] privateKey) {
            this.privateKey = privateKey == null ? null : privateKey.clone();
            this.keyProvider = null;
            return this;
        }

        /**
         * Resolves the private key from {@code provider} at build time using the configured key id.
         */
        public Builder privateKey(KeyProvider provider) {
            this.keyProvider = Objects.requireNonNull(provider, "provider");
            this.privateKey = null;
            return this;
        }

        public Builder components(SignatureComponents components) {
            this.components = Objects.requireNonNull(components, "components").toBuilder();
            return this;
        }

        public Builder method(boolean enabled) {
            components.method(enabled);
            return this;
        }

        public Builder targetUri(boolean enabled) {
            components.targetUri(enabled);
            return this;
        }

        public Builder headers(List<String> headers) {
            components.headers(headers);
            return this;
        }

        public Builder addHeader(String header) {
            components.addHeader(header);
            return this;
        }

        public Builder contentDigest(boolean enabled) {
            components.contentDigest(enabled);
            return this;
        }

        public Builder digestAlgorithm(DigestAlgorithm digestAlgorithm) {
            this.digestAlgorithm = Objects.requireNonNull(digestAlgorithm, "digestAlgorithm");
            return this;
        }

        /**
         * Fails signing when any configured header is absent instead of skipping it.
         */
        public Builder strictHeaders(boolean strict) {
            this.strictHeaders = strict;
            return this;
        }

        /**
         * Headers that must be present whenever they are covered, regardless of {@link #strictHeaders(boolean)}.
         */
        public Builder requiredHeaders(List<String> headers) {
            requiredHeaders.clear();
            if (headers != null) {
                requiredHeaders.addAll(headers);
            }
            return this;
        }

        public Builder allowCustomNonces(boolean allow) {
            this.allowCustomNonces = allow;
            return this;
        }

        public Builder nonceGenerator(Supplier<String> generator) {
            this.nonceGenerator = Objects.requireNonNull(generator, "generator");
            return this;
        }

        public Builder timestampGenerator(LongSupplier generator) {
            this.timestampGenerator = Objects.requireNonNull(generator, "generator");
            return this;
        }

        public Builder signatureLabel(String label) {
            this.signatureLabel = label;
            return this;
        }

        public Builder performanceTarget(Duration target) {
            this.performanceTarget = target;
            return this;
        }

        public Builder profile(SecurityProfile profile) {
            Objects.requireNonNull(profile, "profile");
            this.components = profile.components().toBuilder();
            this.digestAlgorithm = profile.digestAlgorithm();
            this.allowCustomNonces = profile.allowCustomNonces();
            return this;
        }

        public Builder profile(String profileName) throws SigningException {
            return profile(SecurityProfile.fromName(profileName));
        }

        public SigningConfig build() throws SigningException {
            if (keyId == null || keyId.isBlank()) {
                throw new SigningException(SigningErrorCode.INVALID_KEY_ID, "Key ID is required");
            }
            byte[] resolvedKey = resolvePrivateKey();
            if (!Ed25519.isUsablePrivateKey(resolvedKey)) {
                throw new SigningException(
                    SigningErrorCode.INVALID_PRIVATE_KEY,
                    "Invalid private key format",
                    Map.of("expectedLength", Ed25519.KEY_LENGTH,
                        "actualLength", resolvedKey == null ? 0 : resolvedKey.length)
                );
            }
            if (components.build().isEmpty()) {
                throw new SigningException(
                    SigningErrorCode.INVALID_SIGNATURE_COMPONENTS,
                    "At least one signature component must be enabled"
                );
            }
            if (signatureLabel == null || signatureLabel.isBlank()
                || !signatureLabel.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '-' || c == '_')) {
                throw new SigningException(
                    SigningErrorCode.INVALID_CONFIG,
                    "Signature label must be a non-empty token",
                    Map.of("label", String.valueOf(signatureLabel))
                );
            }
            if (performanceTarget == null || performanceTarget.isNegative() || performanceTarget.isZero()) {
                performanceTarget = DEFAULT_PERFORMANCE_TARGET;
            }
            return new SigningConfig(this, resolvedKey);
        }

        private byte[] resolvePrivateKey() throws SigningException {
            if (keyProvider == null) {
                return privateKey;
            }
            Optional<byte[]> key;
            try {
                key = keyProvider.privateKey(keyId.trim());
            } catch (DataFoldException ex) {
                throw new SigningException(
                    SigningErrorCode.INVALID_PRIVATE_KEY,
                    "Private key lookup failed for " + keyId + ": " + ex.getMessage(),
                    Map.of("keyId", keyId),
                    ex
                );
            }
            return key.orElseThrow(() -> new SigningException(
                SigningErrorCode.INVALID_PRIVATE_KEY,
                "No private key available for " + keyId,
                Map.of("keyId", keyId)
            ));
        }
    }
}
