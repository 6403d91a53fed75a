package io.datafold.sdk.verification;

import io.datafold.sdk.internal.Hex;
import io.datafold.sdk.signing.ContentDigest;
import io.datafold.sdk.signing.SignatureComponents;
import io.datafold.sdk.signing.SignatureParams;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Signature facts parsed from wire headers. Nothing here is trusted until verified.
 *
 * @param label              signature label shared by {@code Signature-Input} and {@code Signature}
 * @param signatureHex       signature value as carried on the wire
 * @param coveredComponents  covered component names in wire order
 * @param params             signature parameters
 * @param contentDigest      the {@code Content-Digest} header, or {@code null} when absent
 */
public record ExtractedSignatureData(
    String label,
    String signatureHex,
    List<String> coveredComponents,
    SignatureParams params,
    ContentDigest contentDigest
) {

    public ExtractedSignatureData {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(signatureHex, "signatureHex");
        Objects.requireNonNull(params, "params");
        coveredComponents = List.copyOf(coveredComponents);
    }

    public Optional<ContentDigest> digest() {
        return Optional.ofNullable(contentDigest);
    }

    public boolean covers(String component) {
        return coveredComponents.contains(component);
    }

    public boolean coversContentDigest() {
        return covers(SignatureComponents.CONTENT_DIGEST);
    }

    /**
     * @throws IllegalArgumentException if the wire value is not hex
     */
    public byte[] signatureBytes() {
        return Hex.decode(signatureHex);
    }
}
