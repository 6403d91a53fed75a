package io.datafold.sdk.verification;

import io.datafold.sdk.SignableMessage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One message to verify together with the per-call verification options.
 */
public final class VerificationRequest {

    private final SignableMessage message;
    private final Map<String, String> headers;
    private final String policyName;
    private final byte[] publicKey;
    private final String keyIdOverride;
    private final boolean skipKeyRetrieval;

    private VerificationRequest(Builder builder) {
        this.message = Objects.requireNonNull(builder.message, "message");
        this.headers = builder.headers == null
            ? message.headers()
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.policyName = builder.policyName;
        this.publicKey = builder.publicKey == null ? null : builder.publicKey.clone();
        this.keyIdOverride = builder.keyIdOverride;
        this.skipKeyRetrieval = builder.skipKeyRetrieval;
    }

    public static Builder builder(SignableMessage message) {
        return new Builder().message(message);
    }

    public static VerificationRequest of(SignableMessage message, Map<String, String> headers) {
        return builder(message).headers(headers).build();
    }

    public SignableMessage message() {
        return message;
    }

    /**
     * @return the headers carrying the signature; the message's own headers unless set explicitly.
     */
    public Map<String, String> headers() {
        return headers;
    }

    public Optional<String> policyName() {
        return Optional.ofNullable(policyName);
    }

    public Optional<byte[]> publicKey() {
        return Optional.ofNullable(publicKey).map(byte[]::clone);
    }

    public Optional<String> keyIdOverride() {
        return Optional.ofNullable(keyIdOverride);
    }

    public boolean skipKeyRetrieval() {
        return skipKeyRetrieval;
    }

    public static final class Builder {
        private SignableMessage message;
        private Map<String, String> headers;
        private String policyName;
        private byte[] publicKey;
        private String keyIdOverride;
        private boolean skipKeyRetrieval;

        private Builder() {
        }

        public Builder message(SignableMessage message) {
            this.message = message;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder policy(String policyName) {
            this.policyName = policyName;
            return this;
        }

        public Builder publicKey(byte[] publicKey) {
            this.publicKey = publicKey == null ? null : publicKey.clone();
            return this;
        }

        public Builder keyId(String keyId) {
            this.keyIdOverride = keyId;
            return this;
        }

        /**
         * Disables the external key source chain; only explicit and locally registered keys are used.
         */
        public Builder skipKeyRetrieval(boolean skip) {
            this.skipKeyRetrieval = skip;
            return this;
        }

        public VerificationRequest build() {
            return new VerificationRequest(this);
        }
    }
}
