package io.datafold.sdk.inspect;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @param rfc9421Compliant whether no {@link Severity#ERROR} issue was found
 * @param signatureHeaders lowercase names of the signature headers present
 * @param signatureIds     signature labels found in {@code Signature-Input}
 */
public record FormatAnalysis(
    boolean rfc9421Compliant,
    List<FormatIssue> issues,
    List<String> signatureHeaders,
    List<String> signatureIds
) {

    public FormatAnalysis {
        issues = List.copyOf(issues);
        signatureHeaders = List.copyOf(signatureHeaders);
        signatureIds = List.copyOf(signatureIds);
    }

    public List<FormatIssue> issues(Severity severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).collect(Collectors.toList());
    }

    public boolean hasIssue(String code) {
        return issues.stream().anyMatch(issue -> issue.code().equals(code));
    }
}
