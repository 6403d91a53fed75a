package io.datafold.sdk.signing;

import java.util.Map;

/**
 * Output of a signing operation.
 *
 * @param signatureInput   full {@code Signature-Input} header value
 * @param signature        full {@code Signature} header value
 * @param headers          every header to attach, keyed by lowercase name
 * @param canonicalMessage the exact message that was signed
 */
public record SignatureResult(String signatureInput, String signature, Map<String, String> headers,
                              CanonicalMessage canonicalMessage) {

    public static final String SIGNATURE_INPUT_HEADER = "signature-input";
    public static final String SIGNATURE_HEADER = "signature";
    public static final String CONTENT_DIGEST_HEADER = "content-digest";
    public static final String CONTENT_TYPE_HEADER = "content-type";

    public SignatureResult {
        headers = Map.copyOf(headers);
    }
}
