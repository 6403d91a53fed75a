package io.datafold.sdk.verification;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SecurityLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static SecurityLevel fromScore(int score) {
        if (score >= 80) {
            return HIGH;
        }
        if (score >= 50) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
