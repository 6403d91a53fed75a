package io.datafold.sdk;

/**
 * Error codes raised while assembling configuration and policy sources.
 */
public enum ConfigErrorCode implements ErrorCode {
    INVALID_CONFIG,
    INVALID_POLICY,
    POLICY_SOURCE_MISSING,
    INVALID_POLICY_SOURCE,
    UNKNOWN_RULE,
    UNKNOWN_PROFILE;

    @Override
    public String code() {
        return name();
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFIGURATION;
    }
}
