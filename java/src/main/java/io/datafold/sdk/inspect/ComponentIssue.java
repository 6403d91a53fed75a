package io.datafold.sdk.inspect;

/**
 * A covered component that is not a known pseudo-component or a valid header name.
 */
public record ComponentIssue(String component, String type, String message) {
}
