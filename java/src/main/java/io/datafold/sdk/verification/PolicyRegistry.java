package io.datafold.sdk.verification;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.datafold.sdk.ConfigErrorCode;
import io.datafold.sdk.ConfigurationException;
import io.datafold.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Immutable name to {@link VerificationPolicy} mapping. Load once at startup and hand it to
 * {@link VerificationConfig}; nothing here is global.
 */
public final class PolicyRegistry {

    private static final Logger LOGGER = Logger.getLogger(PolicyRegistry.class.getName());

    public static final String DEFAULT_POLICIES_RESOURCE = "/io/datafold/sdk/verification/default-policies.json";

    private final Map<String, VerificationPolicy> policies;

    private PolicyRegistry(Map<String, VerificationPolicy> policies) {
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
    }

    public static PolicyRegistry empty() {
        return new PolicyRegistry(Map.of());
    }

    public static PolicyRegistry of(List<VerificationPolicy> policies) {
        Map<String, VerificationPolicy> map = new LinkedHashMap<>();
        for (VerificationPolicy policy : Objects.requireNonNull(policies, "policies")) {
            map.put(policy.name(), policy);
        }
        return new PolicyRegistry(map);
    }

    /**
     * Loads the bundled strict, standard, lenient and legacy policies.
     *
     * @throws ConfigurationException if the bundled document is missing or invalid
     */
    public static PolicyRegistry defaults(RuleCatalog catalog) throws ConfigurationException {
        try (InputStream in = PolicyRegistry.class.getResourceAsStream(DEFAULT_POLICIES_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException(
                    ConfigErrorCode.POLICY_SOURCE_MISSING,
                    "Default policy source not found: " + DEFAULT_POLICIES_RESOURCE,
                    Map.of("resource", DEFAULT_POLICIES_RESOURCE)
                );
            }
            return load(in, catalog, DEFAULT_POLICIES_RESOURCE);
        } catch (IOException ex) {
            throw new ConfigurationException(
                ConfigErrorCode.INVALID_POLICY_SOURCE,
                "Read default policies: " + ex.getMessage(),
                Map.of("resource", DEFAULT_POLICIES_RESOURCE),
                ex
            );
        }
    }

    public static PolicyRegistry load(InputStream in, RuleCatalog catalog) throws ConfigurationException {
        return load(in, catalog, "stream");
    }

    private static PolicyRegistry load(InputStream in, RuleCatalog catalog, String source) throws ConfigurationException {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(catalog, "catalog");
        PolicyDocument document;
        try {
            document = Json.mapper().readValue(in, PolicyDocument.class);
        } catch (IOException ex) {
            throw new ConfigurationException(
                ConfigErrorCode.INVALID_POLICY_SOURCE,
                "Decode policy document: " + ex.getMessage(),
                Map.of("source", source),
                ex
            );
        }
        if (document == null || document.policies() == null || document.policies().isEmpty()) {
            throw new ConfigurationException(
                ConfigErrorCode.INVALID_POLICY_SOURCE,
                "Policy document defines no policies",
                Map.of("source", source)
            );
        }

        Map<String, VerificationPolicy> policies = new LinkedHashMap<>();
        for (PolicyDefinition definition : document.policies()) {
            VerificationPolicy policy = definition.toPolicy(catalog);
            if (policies.putIfAbsent(policy.name(), policy) != null) {
                throw new ConfigurationException(
                    ConfigErrorCode.INVALID_POLICY_SOURCE,
                    "Duplicate policy name: " + policy.name(),
                    Map.of("source", source, "policy", policy.name())
                );
            }
        }
        LOGGER.info(() -> "[datafold-sdk] loaded " + policies.size() + " verification policies from " + source);
        return new PolicyRegistry(policies);
    }

    public Optional<VerificationPolicy> get(String name) {
        return Optional.ofNullable(name == null ? null : policies.get(name));
    }

    public boolean contains(String name) {
        return name != null && policies.containsKey(name);
    }

    public Set<String> names() {
        return policies.keySet();
    }

    public int size() {
        return policies.size();
    }

    /**
     * @return a registry with {@code policy} added, replacing any policy of the same name.
     */
    public PolicyRegistry with(VerificationPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        Map<String, VerificationPolicy> copy = new LinkedHashMap<>(policies);
        copy.put(policy.name(), policy);
        return new PolicyRegistry(copy);
    }

    record PolicyDocument(@JsonProperty("policies") List<PolicyDefinition> policies) {
    }

    record PolicyDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("verifyTimestamp") Boolean verifyTimestamp,
        @JsonProperty("maxTimestampAge") Long maxTimestampAge,
        @JsonProperty("verifyNonce") Boolean verifyNonce,
        @JsonProperty("verifyContentDigest") Boolean verifyContentDigest,
        @JsonProperty("requiredComponents") List<String> requiredComponents,
        @JsonProperty("allowedAlgorithms") List<String> allowedAlgorithms,
        @JsonProperty("forbidExtraComponents") Boolean forbidExtraComponents,
        @JsonProperty("customRules") List<String> customRules
    ) {

        VerificationPolicy toPolicy(RuleCatalog catalog) throws ConfigurationException {
            VerificationPolicy.Builder builder = VerificationPolicy.builder(name)
                .description(description)
                .verifyTimestamp(verifyTimestamp == null || verifyTimestamp)
                .verifyNonce(verifyNonce == null || verifyNonce)
                .verifyContentDigest(verifyContentDigest == null || verifyContentDigest)
                .requiredComponents(requiredComponents)
                .forbidExtraComponents(forbidExtraComponents != null && forbidExtraComponents);
            if (maxTimestampAge != null) {
                builder.maxTimestampAgeSeconds(maxTimestampAge);
            }
            if (allowedAlgorithms != null) {
                builder.allowedAlgorithms(allowedAlgorithms);
            }
            List<VerificationRule> rules = new ArrayList<>();
            if (customRules != null) {
                for (String rule : customRules) {
                    rules.add(catalog.resolve(rule));
                }
            }
            return builder.customRules(rules).build();
        }
    }
}
