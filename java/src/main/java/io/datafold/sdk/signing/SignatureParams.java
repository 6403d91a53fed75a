package io.datafold.sdk.signing;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The {@code created}/{@code keyid}/{@code alg}/{@code nonce} tuple attached to every signature.
 * <p>
 * Values taken from the wire are kept verbatim, including an algorithm this SDK does not implement, so that policy
 * checks can reject them explicitly.
 */
public record SignatureParams(long created, String keyId, String algorithm, String nonce) {

    public SignatureParams {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(nonce, "nonce");
    }

    public static SignatureParams of(long created, String keyId, SignatureAlgorithm algorithm, String nonce) {
        return new SignatureParams(created, keyId, algorithm.wireName(), nonce);
    }

    /**
     * Serialises the component list and parameters as used both in {@code Signature-Input} and in the
     * {@code @signature-params} line, e.g.
     * {@code ("@method" "@target-uri");created=1700000000;keyid="key-1";alg="ed25519";nonce="..."}.
     */
    public String serialize(List<String> coveredComponents) {
        String components = coveredComponents.stream()
            .map(name -> "\"" + name + "\"")
            .collect(Collectors.joining(" "));
        return "(" + components + ");created=" + created
            + ";keyid=\"" + keyId + "\""
            + ";alg=\"" + algorithm + "\""
            + ";nonce=\"" + nonce + "\"";
    }
}
