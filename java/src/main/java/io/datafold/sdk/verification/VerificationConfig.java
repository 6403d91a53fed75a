package io.datafold.sdk.verification;

import io.datafold.sdk.ConfigErrorCode;
import io.datafold.sdk.ConfigurationException;
import io.datafold.sdk.internal.Ed25519;
import io.datafold.sdk.keys.KeySource;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration used to bootstrap {@link Verifier} instances.
 */
public final class VerificationConfig {

    public static final String DEFAULT_POLICY = "standard";
    public static final Duration DEFAULT_KEY_RETRIEVAL_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_RULE_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_VERIFICATION_TIME = Duration.ofMillis(50);

    private final String defaultPolicy;
    private final PolicyRegistry policies;
    private final PolicyRegistry builtInPolicies;
    private final Map<String, byte[]> publicKeys;
    private final List<KeySource> keySources;
    private final Duration keyRetrievalTimeout;
    private final Duration ruleTimeout;
    private final Duration maxVerificationTime;
    private final ReplayGuard replayGuard;
    private final Clock clock;

    private VerificationConfig(Builder builder) {
        this.defaultPolicy = builder.defaultPolicy;
        this.policies = builder.policies;
        this.builtInPolicies = builder.builtInPolicies;
        Map<String, byte[]> keys = new LinkedHashMap<>();
        builder.publicKeys.forEach((id, key) -> keys.put(id, key.clone()));
        this.publicKeys = Collections.unmodifiableMap(keys);
        this.keySources = List.copyOf(builder.keySources);
        this.keyRetrievalTimeout = builder.keyRetrievalTimeout;
        this.ruleTimeout = builder.ruleTimeout;
        this.maxVerificationTime = builder.maxVerificationTime;
        this.replayGuard = builder.replayGuard;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fills in defaults and validates. Without explicit built-in policies the bundled policy document is loaded with
     * its nonce rules bound to this configuration's {@link ReplayGuard}.
     *
     * @throws ConfigurationException if the bundled policies cannot be loaded or a setting is invalid
     */
    public VerificationConfig withDefaults() throws ConfigurationException {
        ReplayGuard resolvedGuard = Optional.ofNullable(replayGuard).orElseGet(InMemoryReplayGuard::new);
        PolicyRegistry resolvedBuiltIns = builtInPolicies != null
            ? builtInPolicies
            : PolicyRegistry.defaults(RuleCatalog.defaults(resolvedGuard));
        PolicyRegistry resolvedPolicies = Optional.ofNullable(policies).orElseGet(PolicyRegistry::empty);

        String resolvedDefault = Optional.ofNullable(defaultPolicy)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .orElse(DEFAULT_POLICY);
        if (!resolvedPolicies.contains(resolvedDefault) && !resolvedBuiltIns.contains(resolvedDefault)) {
            throw new ConfigurationException(
                ConfigErrorCode.INVALID_CONFIG,
                "Default policy not found: " + resolvedDefault,
                Map.of("defaultPolicy", resolvedDefault)
            );
        }

        for (Map.Entry<String, byte[]> entry : publicKeys.entrySet()) {
            if (!Ed25519.isValidKeyLength(entry.getValue())) {
                throw new ConfigurationException(
                    ConfigErrorCode.INVALID_CONFIG,
                    "Public key for " + entry.getKey() + " must be " + Ed25519.KEY_LENGTH + " bytes",
                    Map.of("keyId", entry.getKey(), "actualLength", entry.getValue().length)
                );
            }
        }

        return new Builder()
            .defaultPolicy(resolvedDefault)
            .policies(resolvedPolicies)
            .builtInPolicies(resolvedBuiltIns)
            .publicKeys(publicKeys)
            .keySources(keySources)
            .keyRetrievalTimeout(positiveOr(keyRetrievalTimeout, DEFAULT_KEY_RETRIEVAL_TIMEOUT))
            .ruleTimeout(positiveOr(ruleTimeout, DEFAULT_RULE_TIMEOUT))
            .maxVerificationTime(positiveOr(maxVerificationTime, DEFAULT_MAX_VERIFICATION_TIME))
            .replayGuard(resolvedGuard)
            .clock(Optional.ofNullable(clock).orElseGet(Clock::systemUTC))
            .build();
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        if (value == null || value.isNegative() || value.isZero()) {
            return fallback;
        }
        return value;
    }

    public String getDefaultPolicy() {
        return defaultPolicy;
    }

    /**
     * @return caller-supplied policies; consulted before the built-in ones.
     */
    public PolicyRegistry getPolicies() {
        return policies;
    }

    public PolicyRegistry getBuiltInPolicies() {
        return builtInPolicies;
    }

    public Map<String, byte[]> getPublicKeys() {
        return publicKeys;
    }

    public List<KeySource> getKeySources() {
        return keySources;
    }

    public Duration getKeyRetrievalTimeout() {
        return keyRetrievalTimeout;
    }

    public Duration getRuleTimeout() {
        return ruleTimeout;
    }

    public Duration getMaxVerificationTime() {
        return maxVerificationTime;
    }

    public ReplayGuard getReplayGuard() {
        return replayGuard;
    }

    public Clock getClock() {
        return clock;
    }

    public static final class Builder {
        private String defaultPolicy;
        private PolicyRegistry policies;
        private PolicyRegistry builtInPolicies;
        private final Map<String, byte[]> publicKeys = new LinkedHashMap<>();
        private final List<KeySource> keySources = new ArrayList<>();
        private Duration keyRetrievalTimeout;
        private Duration ruleTimeout;
        private Duration maxVerificationTime;
        private ReplayGuard replayGuard;
        private Clock clock;

        private Builder() {
        }

        public Builder defaultPolicy(String defaultPolicy) {
            this.defaultPolicy = defaultPolicy;
            return this;
        }

        public Builder policies(PolicyRegistry policies) {
            this.policies = policies;
            return this;
        }

        public Builder addPolicy(VerificationPolicy policy) {
            this.policies = Optional.ofNullable(policies).orElseGet(PolicyRegistry::empty).with(policy);
            return this;
        }

        /**
         * Replaces the bundled strict, standard, lenient and legacy policies.
         */
        public Builder builtInPolicies(PolicyRegistry builtInPolicies) {
            this.builtInPolicies = builtInPolicies;
            return this;
        }

        public Builder publicKeys(Map<String, byte[]> keys) {
            publicKeys.clear();
            if (keys != null) {
                keys.forEach(this::publicKey);
            }
            return this;
        }

        public Builder publicKey(String keyId, byte[] key) {
            publicKeys.put(Objects.requireNonNull(keyId, "keyId"), Objects.requireNonNull(key, "key").clone());
            return this;
        }

        public Builder keySources(List<KeySource> sources) {
            keySources.clear();
            if (sources != null) {
                sources.forEach(this::addKeySource);
            }
            return this;
        }

        public Builder addKeySource(KeySource source) {
            keySources.add(Objects.requireNonNull(source, "source"));
            return this;
        }

        /**
         * Upper bound for each key source; a slower source is cancelled and the next one is tried.
         */
        public Builder keyRetrievalTimeout(Duration timeout) {
            this.keyRetrievalTimeout = timeout;
            return this;
        }

        public Builder ruleTimeout(Duration timeout) {
            this.ruleTimeout = timeout;
            return this;
        }

        public Builder maxVerificationTime(Duration maxTime) {
            this.maxVerificationTime = maxTime;
            return this;
        }

        public Builder replayGuard(ReplayGuard replayGuard) {
            this.replayGuard = replayGuard;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public VerificationConfig build() {
            return new VerificationConfig(this);
        }
    }
}
