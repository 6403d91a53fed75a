package io.datafold.sdk.signing;

import java.util.Locale;
import java.util.Optional;

/**
 * Signature algorithms that can appear in the {@code alg} parameter.
 */
public enum SignatureAlgorithm {
    ED25519("ed25519");

    private final String wireName;

    SignatureAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<SignatureAlgorithm> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SignatureAlgorithm candidate : values()) {
            if (candidate.wireName.equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
