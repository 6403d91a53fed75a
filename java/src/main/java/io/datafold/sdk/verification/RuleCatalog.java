package io.datafold.sdk.verification;

import io.datafold.sdk.ConfigErrorCode;
import io.datafold.sdk.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Maps rule names used in policy documents to rule factories. Immutable; {@link #with} returns a new catalog.
 */
public final class RuleCatalog {

    private final Map<String, Supplier<VerificationRule>> factories;

    private RuleCatalog(Map<String, Supplier<VerificationRule>> factories) {
        this.factories = Map.copyOf(factories);
    }

    public static RuleCatalog empty() {
        return new RuleCatalog(Map.of());
    }

    /**
     * Catalog of the stateless library rules plus the nonce rules bound to {@code replayGuard}.
     */
    public static RuleCatalog defaults(ReplayGuard replayGuard) {
        Objects.requireNonNull(replayGuard, "replayGuard");
        Map<String, Supplier<VerificationRule>> factories = new LinkedHashMap<>();
        factories.put(VerificationRules.REPLAY_PROTECTION, () -> VerificationRules.replayProtection(replayGuard));
        factories.put(VerificationRules.BASIC_REPLAY_PROTECTION, VerificationRules::basicReplayProtection);
        factories.put(VerificationRules.ALGORITHM_STRENGTH, VerificationRules::algorithmStrength);
        factories.put(VerificationRules.CONTENT_TYPE_CONSISTENCY, VerificationRules::contentTypeConsistency);
        factories.put(VerificationRules.NONCE_UNIQUENESS, () -> VerificationRules.nonceUniqueness(replayGuard));
        return new RuleCatalog(factories);
    }

    public RuleCatalog with(String name, Supplier<VerificationRule> factory) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rule name must be non-empty");
        }
        Objects.requireNonNull(factory, "factory");
        Map<String, Supplier<VerificationRule>> copy = new LinkedHashMap<>(factories);
        copy.put(name, factory);
        return new RuleCatalog(copy);
    }

    public RuleCatalog with(VerificationRule rule) {
        Objects.requireNonNull(rule, "rule");
        return with(rule.name(), () -> rule);
    }

    public boolean contains(String name) {
        return factories.containsKey(name);
    }

    public Set<String> names() {
        return factories.keySet();
    }

    public VerificationRule resolve(String name) throws ConfigurationException {
        Supplier<VerificationRule> factory = factories.get(name);
        if (factory == null) {
            throw new ConfigurationException(
                ConfigErrorCode.UNKNOWN_RULE,
                "Unknown verification rule: " + name,
                Map.of("rule", String.valueOf(name), "availableRules", names().stream().sorted().toList())
            );
        }
        return factory.get();
    }
}
