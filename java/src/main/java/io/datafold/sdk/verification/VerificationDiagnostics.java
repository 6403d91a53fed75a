package io.datafold.sdk.verification;

import java.util.List;
import java.util.Objects;

/**
 * Structured facts gathered while verifying, independent of the pass/fail verdict.
 */
public record VerificationDiagnostics(
    SignatureAnalysis signature,
    ContentAnalysis content,
    PolicyCompliance policy,
    SecurityAnalysis security
) {

    public VerificationDiagnostics {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(security, "security");
    }

    /**
     * Diagnostics of a run that failed before any facts could be gathered.
     */
    public static VerificationDiagnostics empty() {
        return new VerificationDiagnostics(
            new SignatureAnalysis("", "", 0L, 0L, "", List.of()),
            new ContentAnalysis(false, null, 0L, null),
            new PolicyCompliance("", List.of(), List.of(), List.of()),
            new SecurityAnalysis(SecurityLevel.LOW, 0, List.of(), List.of())
        );
    }

    /**
     * @param ageSeconds seconds between {@code created} and verification; negative for future timestamps
     */
    public record SignatureAnalysis(
        String algorithm,
        String keyId,
        long created,
        long ageSeconds,
        String nonce,
        List<String> coveredComponents
    ) {
        public SignatureAnalysis {
            coveredComponents = List.copyOf(coveredComponents);
        }
    }

    /**
     * @param digestAlgorithm wire name of the digest algorithm, or {@code null} without a digest
     * @param contentType     the message's content type, or {@code null}
     */
    public record ContentAnalysis(boolean hasContentDigest, String digestAlgorithm, long contentSize, String contentType) {
    }

    public record PolicyCompliance(
        String policyName,
        List<String> missingRequiredComponents,
        List<String> extraComponents,
        List<VerificationRuleResult> customRuleResults
    ) {
        public PolicyCompliance {
            missingRequiredComponents = List.copyOf(missingRequiredComponents);
            extraComponents = List.copyOf(extraComponents);
            customRuleResults = List.copyOf(customRuleResults);
        }
    }

    public record SecurityAnalysis(SecurityLevel level, int score, List<String> concerns, List<String> recommendations) {
        public SecurityAnalysis {
            Objects.requireNonNull(level, "level");
            concerns = List.copyOf(concerns);
            recommendations = List.copyOf(recommendations);
        }
    }
}
