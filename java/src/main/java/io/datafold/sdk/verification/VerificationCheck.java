package io.datafold.sdk.verification;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The individually recorded checks of a verification run, in evaluation order.
 */
public enum VerificationCheck {
    FORMAT("format_valid", "Format Valid"),
    CRYPTOGRAPHIC("cryptographic_valid", "Cryptographic Valid"),
    TIMESTAMP("timestamp_valid", "Timestamp Valid"),
    NONCE("nonce_valid", "Nonce Valid"),
    CONTENT_DIGEST("content_digest_valid", "Content Digest Valid"),
    COMPONENT_COVERAGE("component_coverage_valid", "Component Coverage Valid"),
    CUSTOM_RULES("custom_rules_valid", "Custom Rules Valid");

    private final String key;
    private final String label;

    VerificationCheck(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    /**
     * @return the key used for this check in {@link PerformanceMetrics#stepTimings()}.
     */
    public String timingKey() {
        return key.substring(0, key.length() - "_valid".length()) + "_check";
    }
}
