package io.datafold.sdk.inspect;

import java.util.Objects;

/**
 * One finding of {@link SignatureInspector#inspectFormat}.
 *
 * @param component the header, parameter or component list the finding refers to
 */
public record FormatIssue(Severity severity, String code, String message, String component) {

    public FormatIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
    }
}
