package io.datafold.sdk.verification;

import io.datafold.sdk.HttpMethod;
import io.datafold.sdk.SignableMessage;
import io.datafold.sdk.signing.CanonicalMessage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignatureExtractorTest {

    private static final String INPUT = "sig1=(\"@method\" \"@target-uri\" \"content-digest\");created=1700000000;"
        + "keyid=\"client-1\";alg=\"ed25519\";nonce=\"123e4567-e89b-42d3-a456-426614174000\"";
    private static final String SIGNATURE = "sig1=:" + "ab".repeat(64) + ":";

    @Test
    void extractsParametersAndDigest() throws Exception {
        ExtractedSignatureData data = SignatureExtractor.extract(Map.of(
            "Signature-Input", INPUT,
            "SIGNATURE", SIGNATURE,
            "Content-Digest", "sha-256=:YWJj:"
        ));

        assertEquals("sig1", data.label());
        assertEquals(List.of("@method", "@target-uri", "content-digest"), data.coveredComponents());
        assertEquals(1_700_000_000L, data.params().created());
        assertEquals("client-1", data.params().keyId());
        assertEquals("ed25519", data.params().algorithm());
        assertEquals("123e4567-e89b-42d3-a456-426614174000", data.params().nonce());
        assertEquals("YWJj", data.digest().orElseThrow().value());
        assertTrue(data.coversContentDigest());
        assertEquals(64, data.signatureBytes().length);
    }

    @Test
    void keepsUnknownAlgorithmVerbatim() throws Exception {
        ExtractedSignatureData data = SignatureExtractor.extract(Map.of(
            "signature-input", INPUT.replace("ed25519", "rsa-pss-sha512"),
            "signature", SIGNATURE
        ));

        assertEquals("rsa-pss-sha512", data.params().algorithm());
        assertTrue(data.digest().isEmpty());
    }

    @Test
    void reportsMissingAndMalformedHeaders() {
        assertCode(VerificationErrorCode.MISSING_SIGNATURE_INPUT, Map.of("signature", SIGNATURE));
        assertCode(VerificationErrorCode.MISSING_SIGNATURE, Map.of("signature-input", INPUT));
        assertCode(VerificationErrorCode.INVALID_SIGNATURE_INPUT_FORMAT,
            Map.of("signature-input", "sig1=\"@method\"", "signature", SIGNATURE));
        assertCode(VerificationErrorCode.INVALID_SIGNATURE_INPUT_FORMAT,
            Map.of("signature-input", INPUT.replace(";keyid=\"client-1\"", ""), "signature", SIGNATURE));
        assertCode(VerificationErrorCode.INVALID_SIGNATURE_INPUT_FORMAT,
            Map.of("signature-input", INPUT.replace("created=1700000000", "created=soon"), "signature", SIGNATURE));
        assertCode(VerificationErrorCode.INVALID_SIGNATURE_FORMAT,
            Map.of("signature-input", INPUT, "signature", "sig1=" + "ab".repeat(64)));
        assertCode(VerificationErrorCode.SIGNATURE_ID_MISMATCH,
            Map.of("signature-input", INPUT, "signature", SIGNATURE.replace("sig1", "sig2")));
    }

    @Test
    void reconstructsCanonicalMessageInWireOrder() throws Exception {
        SignableMessage message = SignableMessage.builder(HttpMethod.DELETE, "https://example.com/items/7").build();
        ExtractedSignatureData data = SignatureExtractor.extract(Map.of(
            "signature-input", INPUT.replace("(\"@method\" \"@target-uri\" \"content-digest\")", "(\"@target-uri\" \"@method\")"),
            "signature", SIGNATURE
        ));

        CanonicalMessage canonical = SignatureExtractor.reconstruct(message, data);

        assertEquals("\"@target-uri\": /items/7", canonical.lines().get(0));
        assertEquals("\"@method\": DELETE", canonical.lines().get(1));
        assertTrue(canonical.lines().get(2).startsWith("\"@signature-params\": (\"@target-uri\" \"@method\");created="));
    }

    @Test
    void reconstructionFailsWhenCoveredHeaderIsMissing() throws Exception {
        SignableMessage message = SignableMessage.builder(HttpMethod.GET, "https://example.com/").build();
        ExtractedSignatureData data = SignatureExtractor.extract(Map.of(
            "signature-input", INPUT.replace("\"content-digest\"", "\"x-api-key\""),
            "signature", SIGNATURE
        ));

        VerificationException ex = assertThrows(VerificationException.class,
            () -> SignatureExtractor.reconstruct(message, data));
        assertEquals(VerificationErrorCode.CANONICAL_MESSAGE_RECONSTRUCTION_FAILED, ex.getErrorCode());
    }

    private static void assertCode(VerificationErrorCode expected, Map<String, String> headers) {
        VerificationException ex = assertThrows(VerificationException.class, () -> SignatureExtractor.extract(headers));
        assertEquals(expected, ex.getErrorCode());
    }
}
