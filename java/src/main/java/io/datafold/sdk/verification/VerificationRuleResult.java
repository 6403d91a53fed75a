package io.datafold.sdk.verification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a single custom rule.
 *
 * @param rule    name of the rule that produced the result; filled in by the verifier when a rule leaves it empty
 * @param passed  whether the rule accepted the signature
 * @param message human readable explanation
 * @param details structured context
 */
public record VerificationRuleResult(String rule, boolean passed, String message, Map<String, Object> details) {

    public VerificationRuleResult {
        message = message == null ? "" : message;
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static VerificationRuleResult pass(String message) {
        return new VerificationRuleResult(null, true, message, Map.of());
    }

    public static VerificationRuleResult fail(String message) {
        return new VerificationRuleResult(null, false, message, Map.of());
    }

    public static VerificationRuleResult fail(String message, Map<String, Object> details) {
        return new VerificationRuleResult(null, false, message, details);
    }

    public VerificationRuleResult withRule(String ruleName) {
        return new VerificationRuleResult(ruleName, passed, message, details);
    }
}
