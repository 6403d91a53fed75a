package io.datafold.sdk.verification;

import io.datafold.sdk.SignableMessage;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a custom rule may inspect.
 *
 * @param message               the message being verified
 * @param headers               the headers carrying the signature
 * @param signature             extracted signature data
 * @param policy                the active policy
 * @param publicKey             the resolved raw public key
 * @param keyId                 the key id used for resolution
 * @param cryptographicallyValid whether the signature verified against {@code publicKey}
 * @param verifiedAt            the instant the verification started
 */
public record VerificationContext(
    SignableMessage message,
    Map<String, String> headers,
    ExtractedSignatureData signature,
    VerificationPolicy policy,
    byte[] publicKey,
    String keyId,
    boolean cryptographicallyValid,
    Instant verifiedAt
) {

    public VerificationContext {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(policy, "policy");
        Objects.requireNonNull(verifiedAt, "verifiedAt");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        publicKey = publicKey == null ? null : publicKey.clone();
    }

    @Override
    public byte[] publicKey() {
        return publicKey == null ? null : publicKey.clone();
    }

    /**
     * @return seconds between {@code created} and {@link #verifiedAt()}; negative for future timestamps.
     */
    public long ageSeconds() {
        return verifiedAt.getEpochSecond() - signature.params().created();
    }
}
