package io.datafold.sdk.verification;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

final class FunctionalVerificationRule implements VerificationRule {

    private final String name;
    private final String description;
    private final Function<VerificationContext, CompletableFuture<VerificationRuleResult>> body;

    FunctionalVerificationRule(String name, String description,
                               Function<VerificationContext, CompletableFuture<VerificationRuleResult>> body) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rule name must be non-empty");
        }
        this.name = name;
        this.description = description == null ? "" : description;
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public CompletableFuture<VerificationRuleResult> evaluate(VerificationContext context) {
        CompletableFuture<VerificationRuleResult> result = body.apply(context);
        if (result == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("rule " + name + " returned no result"));
        }
        return result;
    }

    @Override
    public String toString() {
        return "VerificationRule{" + name + '}';
    }
}
