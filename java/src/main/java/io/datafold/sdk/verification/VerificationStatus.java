package io.datafold.sdk.verification;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VerificationStatus {
    VALID,
    INVALID,
    UNKNOWN,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
