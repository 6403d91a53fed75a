package io.datafold.sdk.signing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

/**
 * Computes and checks body digests. An absent body digests the empty byte string.
 */
public final class ContentDigests {

    private ContentDigests() {
    }

    public static ContentDigest compute(byte[] body, DigestAlgorithm algorithm) throws SigningException {
        DigestAlgorithm resolved = algorithm == null ? DigestAlgorithm.SHA_256 : algorithm;
        byte[] hash = hash(body == null ? new byte[0] : body, resolved);
        return ContentDigest.of(resolved, Base64.getEncoder().encodeToString(hash));
    }

    public static ContentDigest compute(String body, DigestAlgorithm algorithm) throws SigningException {
        return compute(body == null ? null : body.getBytes(StandardCharsets.UTF_8), algorithm);
    }

    /**
     * Recomputes the digest over {@code body} and compares it with {@code expected} in constant time.
     *
     * @return {@code false} when the values differ or the algorithm is not supported
     */
    public static boolean matches(byte[] body, ContentDigest expected) {
        if (expected == null) {
            return false;
        }
        Optional<DigestAlgorithm> algorithm = expected.digestAlgorithm();
        if (algorithm.isEmpty()) {
            return false;
        }
        byte[] claimed;
        try {
            claimed = Base64.getDecoder().decode(expected.value());
        } catch (IllegalArgumentException ex) {
            return false;
        }
        try {
            byte[] actual = hash(body == null ? new byte[0] : body, algorithm.get());
            return MessageDigest.isEqual(actual, claimed);
        } catch (SigningException ex) {
            return false;
        }
    }

    private static byte[] hash(byte[] body, DigestAlgorithm algorithm) throws SigningException {
        try {
            return MessageDigest.getInstance(algorithm.jcaName()).digest(body);
        } catch (NoSuchAlgorithmException ex) {
            throw new SigningException(
                SigningErrorCode.DIGEST_CALCULATION_FAILED,
                "digest algorithm unavailable: " + algorithm.wireName(),
                Map.of("algorithm", algorithm.wireName()),
                ex
            );
        }
    }
}
