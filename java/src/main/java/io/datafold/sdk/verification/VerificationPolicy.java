package io.datafold.sdk.verification;

import io.datafold.sdk.ConfigErrorCode;
import io.datafold.sdk.ConfigurationException;
import io.datafold.sdk.signing.SignatureAlgorithm;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Named, declarative set of checks a signature must satisfy.
 */
public final class VerificationPolicy {

    private final String name;
    private final String description;
    private final boolean verifyTimestamp;
    private final Duration maxTimestampAge;
    private final boolean verifyNonce;
    private final boolean verifyContentDigest;
    private final List<String> requiredComponents;
    private final List<String> allowedAlgorithms;
    private final boolean forbidExtraComponents;
    private final List<VerificationRule> customRules;

    private VerificationPolicy(Builder builder) {
        this.name = builder.name.trim();
        this.description = builder.description.trim();
        this.verifyTimestamp = builder.verifyTimestamp;
        this.maxTimestampAge = builder.maxTimestampAge;
        this.verifyNonce = builder.verifyNonce;
        this.verifyContentDigest = builder.verifyContentDigest;
        this.requiredComponents = List.copyOf(builder.requiredComponents);
        this.allowedAlgorithms = List.copyOf(builder.allowedAlgorithms);
        this.forbidExtraComponents = builder.forbidExtraComponents;
        this.customRules = List.copyOf(builder.customRules);
    }

    public static Builder builder(String name) {
        return new Builder().name(name);
    }

    /**
     * Combines two policies: scalar settings and non-empty lists come from {@code override}, custom rules from both.
     */
    public static VerificationPolicy merge(VerificationPolicy base, VerificationPolicy override) throws ConfigurationException {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(override, "override");
        List<VerificationRule> rules = new ArrayList<>(base.customRules);
        rules.addAll(override.customRules);
        return new Builder()
            .name(override.name)
            .description(override.description.isEmpty() ? base.description : override.description)
            .verifyTimestamp(override.verifyTimestamp)
            .maxTimestampAge(override.maxTimestampAge != null ? override.maxTimestampAge : base.maxTimestampAge)
            .verifyNonce(override.verifyNonce)
            .verifyContentDigest(override.verifyContentDigest)
            .requiredComponents(override.requiredComponents.isEmpty() ? base.requiredComponents : override.requiredComponents)
            .allowedAlgorithms(override.allowedAlgorithms.isEmpty() ? base.allowedAlgorithms : override.allowedAlgorithms)
            .forbidExtraComponents(override.forbidExtraComponents)
            .customRules(rules)
            .build();
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public boolean verifyTimestamp() {
        return verifyTimestamp;
    }

    public Optional<Duration> maxTimestampAge() {
        return Optional.ofNullable(maxTimestampAge);
    }

    public boolean verifyNonce() {
        return verifyNonce;
    }

    public boolean verifyContentDigest() {
        return verifyContentDigest;
    }

    public List<String> requiredComponents() {
        return requiredComponents;
    }

    public List<String> allowedAlgorithms() {
        return allowedAlgorithms;
    }

    public boolean allowsAlgorithm(String algorithm) {
        return algorithm != null && allowedAlgorithms.contains(algorithm.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @return whether covered components outside {@link #requiredComponents()} fail the coverage check.
     */
    public boolean forbidExtraComponents() {
        return forbidExtraComponents;
    }

    public List<VerificationRule> customRules() {
        return customRules;
    }

    public Builder toBuilder() {
        return new Builder()
            .name(name)
            .description(description)
            .verifyTimestamp(verifyTimestamp)
            .maxTimestampAge(maxTimestampAge)
            .verifyNonce(verifyNonce)
            .verifyContentDigest(verifyContentDigest)
            .requiredComponents(requiredComponents)
            .allowedAlgorithms(allowedAlgorithms)
            .forbidExtraComponents(forbidExtraComponents)
            .customRules(customRules);
    }

    @Override
    public String toString() {
        return "VerificationPolicy{" + name + ", required=" + requiredComponents + ", rules="
            + customRules.stream().map(VerificationRule::name).toList() + '}';
    }

    public static final class Builder {
        private String name;
        private String description = "";
        private boolean verifyTimestamp = true;
        private Duration maxTimestampAge;
        private boolean verifyNonce = true;
        private boolean verifyContentDigest = true;
        private final List<String> requiredComponents = new ArrayList<>();
        private final List<String> allowedAlgorithms = new ArrayList<>(List.of(SignatureAlgorithm.ED25519.wireName()));
        private boolean forbidExtraComponents;
        private final List<VerificationRule> customRules = new ArrayList<>();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description == null ? "" : description;
            return this;
        }

        public Builder verifyTimestamp(boolean verify) {
            this.verifyTimestamp = verify;
            return this;
        }

        public Builder maxTimestampAge(Duration maxAge) {
            this.maxTimestampAge = maxAge;
            return this;
        }

        public Builder maxTimestampAgeSeconds(long seconds) {
            return maxTimestampAge(Duration.ofSeconds(seconds));
        }

        public Builder verifyNonce(boolean verify) {
            this.verifyNonce = verify;
            return this;
        }

        public Builder verifyContentDigest(boolean verify) {
            this.verifyContentDigest = verify;
            return this;
        }

        public Builder requiredComponents(List<String> components) {
            requiredComponents.clear();
            if (components != null) {
                components.stream()
                    .filter(Objects::nonNull)
                    .map(c -> c.trim().toLowerCase(Locale.ROOT))
                    .filter(c -> !c.isEmpty())
                    .distinct()
                    .forEach(requiredComponents::add);
            }
            return this;
        }

        public Builder allowedAlgorithms(List<String> algorithms) {
            allowedAlgorithms.clear();
            if (algorithms != null) {
                algorithms.stream()
                    .filter(Objects::nonNull)
                    .map(a -> a.trim().toLowerCase(Locale.ROOT))
                    .filter(a -> !a.isEmpty())
                    .distinct()
                    .forEach(allowedAlgorithms::add);
            }
            return this;
        }

        public Builder forbidExtraComponents(boolean forbid) {
            this.forbidExtraComponents = forbid;
            return this;
        }

        public Builder customRules(List<VerificationRule> rules) {
            customRules.clear();
            if (rules != null) {
                rules.forEach(this::addRule);
            }
            return this;
        }

        public Builder addRule(VerificationRule rule) {
            customRules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public VerificationPolicy build() throws ConfigurationException {
            if (name == null || name.isBlank()) {
                throw invalid("Policy name must be a non-empty string");
            }
            if (description == null || description.isBlank()) {
                throw invalid("Policy description must be a non-empty string");
            }
            if (allowedAlgorithms.isEmpty()) {
                throw invalid("Policy must specify at least one allowed algorithm");
            }
            if (maxTimestampAge != null && (maxTimestampAge.isNegative() || maxTimestampAge.isZero())) {
                throw invalid("Maximum timestamp age must be positive");
            }
            return new VerificationPolicy(this);
        }

        private ConfigurationException invalid(String message) {
            return new ConfigurationException(ConfigErrorCode.INVALID_POLICY, message, Map.of("policy", String.valueOf(name)));
        }
    }
}
