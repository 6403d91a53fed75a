package io.datafold.sdk.verification;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Policy-attached predicate evaluated after the built-in checks. A rule that throws or completes exceptionally counts
 * as failed.
 */
public interface VerificationRule {

    String name();

    String description();

    CompletableFuture<VerificationRuleResult> evaluate(VerificationContext context);

    /**
     * Synchronous rule body.
     */
    @FunctionalInterface
    interface Validator {
        VerificationRuleResult validate(VerificationContext context) throws Exception;
    }

    static VerificationRule of(String name, String description, Validator validator) {
        Objects.requireNonNull(validator, "validator");
        return new FunctionalVerificationRule(name, description, context -> {
            try {
                return CompletableFuture.completedFuture(validator.validate(context));
            } catch (Exception ex) {
                return CompletableFuture.failedFuture(ex);
            }
        });
    }

    static VerificationRule async(String name, String description,
                                  Function<VerificationContext, CompletableFuture<VerificationRuleResult>> body) {
        return new FunctionalVerificationRule(name, description, body);
    }
}
