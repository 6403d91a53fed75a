package io.datafold.sdk.inspect;

import io.datafold.sdk.verification.ComponentSecurity;

import java.util.List;

/**
 * Combined component and parameter view returned by {@link SignatureInspector#analyzeSecurity}.
 */
public record SecurityReport(
    ComponentSecurity.Assessment componentSecurity,
    boolean parametersValid,
    List<String> parameterInsights,
    List<String> validComponents,
    List<ComponentIssue> invalidComponents,
    List<String> missingRecommended
) {

    public SecurityReport {
        parameterInsights = List.copyOf(parameterInsights);
        validComponents = List.copyOf(validComponents);
        invalidComponents = List.copyOf(invalidComponents);
        missingRecommended = List.copyOf(missingRecommended);
    }
}
