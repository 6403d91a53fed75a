package io.datafold.sdk.signing;

import java.util.Locale;
import java.util.Optional;

/**
 * Hash algorithms supported for {@code Content-Digest}.
 */
public enum DigestAlgorithm {
    SHA_256("sha-256", "SHA-256"),
    SHA_512("sha-512", "SHA-512");

    private final String wireName;
    private final String jcaName;

    DigestAlgorithm(String wireName, String jcaName) {
        this.wireName = wireName;
        this.jcaName = jcaName;
    }

    /**
     * @return the token used on the wire, e.g. {@code sha-256}.
     */
    public String wireName() {
        return wireName;
    }

    String jcaName() {
        return jcaName;
    }

    public static Optional<DigestAlgorithm> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DigestAlgorithm candidate : values()) {
            if (candidate.wireName.equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
