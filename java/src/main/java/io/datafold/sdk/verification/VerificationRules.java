package io.datafold.sdk.verification;

import io.datafold.sdk.signing.SignatureAlgorithm;
import io.datafold.sdk.signing.SignatureParamsGenerator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Library of reusable {@link VerificationRule}s. The names returned by {@link VerificationRule#name()} are the ones
 * referenced from policy documents through {@link RuleCatalog}.
 */
public final class VerificationRules {

    public static final String REPLAY_PROTECTION = "replay-protection";
    public static final String BASIC_REPLAY_PROTECTION = "basic-replay-protection";
    public static final String ALGORITHM_STRENGTH = "algorithm-strength";
    public static final String CONTENT_TYPE_CONSISTENCY = "content-type-consistency";
    public static final String NONCE_UNIQUENESS = "nonce-uniqueness";

    /** Future timestamps up to this many seconds are accepted as clock skew. */
    public static final long CLOCK_SKEW_SECONDS = 60L;

    private static final Set<String> STRONG_ALGORITHMS = Set.of(SignatureAlgorithm.ED25519.wireName());

    private VerificationRules() {
    }

    /**
     * Requires a UUIDv4 nonce that {@code guard} has not seen. Nonces are only recorded for signatures that verified,
     * so forged requests cannot burn legitimate nonces.
     */
    public static VerificationRule replayProtection(ReplayGuard guard) {
        Objects.requireNonNull(guard, "guard");
        return VerificationRule.of(REPLAY_PROTECTION, "Ensure nonce is fresh and not reused", context -> {
            String nonce = context.signature().params().nonce();
            if (!SignatureParamsGenerator.isValidNonce(nonce)) {
                return VerificationRuleResult.fail("Invalid nonce format", Map.of("nonce", String.valueOf(nonce)));
            }
            return recordNonce(guard, context, "Nonce validation passed");
        });
    }

    public static VerificationRule basicReplayProtection() {
        return VerificationRule.of(BASIC_REPLAY_PROTECTION, "Basic nonce format validation", context -> {
            String nonce = context.signature().params().nonce();
            if (!SignatureParamsGenerator.isValidNonce(nonce)) {
                return VerificationRuleResult.fail("Invalid nonce format", Map.of("nonce", String.valueOf(nonce)));
            }
            return VerificationRuleResult.pass("Nonce format validated");
        });
    }

    public static VerificationRule algorithmStrength() {
        return VerificationRule.of(ALGORITHM_STRENGTH, "Ensure strong cryptographic algorithm", context -> {
            String algorithm = context.signature().params().algorithm();
            String normalized = algorithm == null ? "" : algorithm.toLowerCase(Locale.ROOT);
            if (!STRONG_ALGORITHMS.contains(normalized)) {
                return VerificationRuleResult.fail(
                    "Weak algorithm detected: " + algorithm,
                    Map.of("algorithm", String.valueOf(algorithm), "strongAlgorithms", List.copyOf(STRONG_ALGORITHMS))
                );
            }
            return VerificationRuleResult.pass("Algorithm strength validated");
        });
    }

    public static VerificationRule timestampFreshness(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge");
        return timestampFreshness(maxAge.getSeconds());
    }

    public static VerificationRule timestampFreshness(long maxAgeSeconds) {
        if (maxAgeSeconds <= 0) {
            throw new IllegalArgumentException("maxAgeSeconds must be positive");
        }
        return VerificationRule.of(
            "timestamp-freshness",
            "Ensure timestamp is within " + maxAgeSeconds + " seconds",
            context -> {
                long age = context.ageSeconds();
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("age", age);
                details.put("created", context.signature().params().created());
                details.put("now", context.verifiedAt().getEpochSecond());
                if (age > maxAgeSeconds) {
                    details.put("maxAge", maxAgeSeconds);
                    return VerificationRuleResult.fail("Timestamp too old: " + age + "s > " + maxAgeSeconds + "s", details);
                }
                if (age < -CLOCK_SKEW_SECONDS) {
                    return VerificationRuleResult.fail("Timestamp from future: " + age + "s", details);
                }
                return VerificationRuleResult.pass("Timestamp is fresh: " + age + "s old");
            }
        );
    }

    public static VerificationRule requiredHeaders(List<String> headers) {
        List<String> required = normalize(headers);
        return VerificationRule.of(
            "required-headers",
            "Ensure required headers are present: " + String.join(", ", required),
            context -> {
                List<String> covered = context.signature().coveredComponents();
                List<String> missing = new ArrayList<>();
                for (String header : required) {
                    if (covered.stream().noneMatch(header::equalsIgnoreCase)) {
                        missing.add(header);
                    }
                }
                if (!missing.isEmpty()) {
                    return VerificationRuleResult.fail(
                        "Missing required headers: " + String.join(", ", missing),
                        Map.of("missing", missing, "required", required, "covered", covered)
                    );
                }
                return VerificationRuleResult.pass("All required headers present");
            }
        );
    }

    public static VerificationRule keyIdAllowList(List<String> allowedKeyIds) {
        Objects.requireNonNull(allowedKeyIds, "allowedKeyIds");
        Set<String> allowed = Set.copyOf(allowedKeyIds);
        return VerificationRule.of("key-id-validation", "Validate key ID against allowed list", context -> {
            String keyId = context.signature().params().keyId();
            if (!allowed.contains(keyId)) {
                return VerificationRuleResult.fail(
                    "Invalid key ID: " + keyId,
                    Map.of("keyId", String.valueOf(keyId), "validKeyIds", allowed.stream().sorted().collect(Collectors.toList()))
                );
            }
            return VerificationRuleResult.pass("Key ID validated");
        });
    }

    public static VerificationRule contentTypeConsistency() {
        return VerificationRule.of(
            CONTENT_TYPE_CONSISTENCY,
            "Ensure content-type is covered when body is present",
            context -> {
                boolean hasBody = context.message().hasBody();
                boolean coversContentType = context.signature().coveredComponents().stream()
                    .anyMatch("content-type"::equalsIgnoreCase);
                if (hasBody && !coversContentType) {
                    return VerificationRuleResult.fail(
                        "Content-type should be covered when body is present",
                        Map.of("hasBody", true, "hasContentType", false)
                    );
                }
                return VerificationRuleResult.pass("Content-type coverage is appropriate");
            }
        );
    }

    /**
     * Like {@link #replayProtection(ReplayGuard)} without the nonce shape check.
     */
    public static VerificationRule nonceUniqueness(ReplayGuard guard) {
        Objects.requireNonNull(guard, "guard");
        return VerificationRule.of(NONCE_UNIQUENESS, "Ensure nonce has not been used before",
            context -> recordNonce(guard, context, "Nonce is unique"));
    }

    private static VerificationRuleResult recordNonce(ReplayGuard guard, VerificationContext context, String passMessage) {
        String nonce = context.signature().params().nonce();
        if (!context.cryptographicallyValid()) {
            return VerificationRuleResult.fail(
                "Signature did not verify; nonce not recorded",
                Map.of("nonce", String.valueOf(nonce))
            );
        }
        if (!guard.register(nonce, context.signature().params().created())) {
            if (guard.contains(nonce)) {
                return VerificationRuleResult.fail("Nonce already used: " + nonce, Map.of("nonce", nonce));
            }
            return VerificationRuleResult.fail("Nonce could not be recorded: replay guard is full",
                Map.of("nonce", nonce));
        }
        return VerificationRuleResult.pass(passMessage);
    }

    private static List<String> normalize(List<String> headers) {
        Objects.requireNonNull(headers, "headers");
        return headers.stream()
            .filter(Objects::nonNull)
            .map(h -> h.trim().toLowerCase(Locale.ROOT))
            .filter(h -> !h.isEmpty())
            .distinct()
            .collect(Collectors.toList());
    }
}
