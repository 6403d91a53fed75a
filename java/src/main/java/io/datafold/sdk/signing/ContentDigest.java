package io.datafold.sdk.signing;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A content digest as carried in the {@code Content-Digest} header: {@code <algorithm>=:<base64>:}.
 *
 * @param algorithm wire token of the hash algorithm, e.g. {@code sha-256}
 * @param value     base64 encoding of the raw digest bytes
 */
public record ContentDigest(String algorithm, String value) {

    private static final Pattern HEADER_PATTERN = Pattern.compile("^([^=\\s]+)=:([A-Za-z0-9+/]+=*):$");

    public ContentDigest {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(value, "value");
    }

    public static ContentDigest of(DigestAlgorithm algorithm, String base64Value) {
        return new ContentDigest(algorithm.wireName(), base64Value);
    }

    /**
     * Parses a {@code Content-Digest} header value.
     *
     * @return the digest, or empty when the value is not of the form {@code alg=:base64:}
     */
    public static Optional<ContentDigest> parse(String headerValue) {
        if (headerValue == null) {
            return Optional.empty();
        }
        Matcher matcher = HEADER_PATTERN.matcher(headerValue.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ContentDigest(matcher.group(1), matcher.group(2)));
    }

    public String headerValue() {
        return algorithm + "=:" + value + ":";
    }

    /**
     * @return the algorithm when it is one this SDK can recompute.
     */
    public Optional<DigestAlgorithm> digestAlgorithm() {
        return DigestAlgorithm.fromWireName(algorithm);
    }
}
