package io.datafold.sdk.inspect;

import io.datafold.sdk.verification.ComponentSecurity;

import java.util.List;
import java.util.Objects;

/**
 * @param missingRecommended recommended components ({@code @method}, {@code @target-uri}) that are not covered
 */
public record ComponentAnalysis(
    List<String> validComponents,
    List<ComponentIssue> invalidComponents,
    List<String> missingRecommended,
    ComponentSecurity.Assessment security
) {

    public ComponentAnalysis {
        validComponents = List.copyOf(validComponents);
        invalidComponents = List.copyOf(invalidComponents);
        missingRecommended = List.copyOf(missingRecommended);
        Objects.requireNonNull(security, "security");
    }
}
