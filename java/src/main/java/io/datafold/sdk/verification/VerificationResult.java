package io.datafold.sdk.verification;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable outcome of a verification run.
 *
 * @param status         {@link VerificationStatus#VALID} iff every check passed
 * @param signatureValid format and cryptographic checks passed, regardless of policy checks
 * @param checks         individual check outcomes in evaluation order
 * @param diagnostics    facts gathered along the way
 * @param performance    total and per-step timings
 * @param error          set only for {@link VerificationStatus#ERROR} results
 */
public record VerificationResult(
    VerificationStatus status,
    boolean signatureValid,
    Map<VerificationCheck, Boolean> checks,
    VerificationDiagnostics diagnostics,
    PerformanceMetrics performance,
    ResultError error
) {

    public VerificationResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(diagnostics, "diagnostics");
        Objects.requireNonNull(performance, "performance");
        EnumMap<VerificationCheck, Boolean> copy = new EnumMap<>(VerificationCheck.class);
        for (VerificationCheck check : VerificationCheck.values()) {
            copy.put(check, checks != null && Boolean.TRUE.equals(checks.get(check)));
        }
        checks = Collections.unmodifiableMap(copy);
    }

    static VerificationResult error(ResultError error, PerformanceMetrics performance) {
        return new VerificationResult(
            VerificationStatus.ERROR,
            false,
            Map.of(),
            VerificationDiagnostics.empty(),
            performance,
            Objects.requireNonNull(error, "error")
        );
    }

    public boolean isValid() {
        return status == VerificationStatus.VALID;
    }

    public boolean passed(VerificationCheck check) {
        return checks.get(check);
    }

    public Optional<ResultError> errorDetails() {
        return Optional.ofNullable(error);
    }

    /**
     * @return the checks keyed by their wire names, e.g. {@code cryptographic_valid}.
     */
    public Map<String, Boolean> checksByName() {
        Map<String, Boolean> byName = new LinkedHashMap<>();
        checks.forEach((check, passed) -> byName.put(check.key(), passed));
        return Collections.unmodifiableMap(byName);
    }
}
