package io.datafold.sdk.inspect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datafold.sdk.HttpMethod;
import io.datafold.sdk.SignableMessage;
import io.datafold.sdk.internal.Ed25519;
import io.datafold.sdk.internal.Json;
import io.datafold.sdk.signing.RequestSigner;
import io.datafold.sdk.signing.SignatureParams;
import io.datafold.sdk.signing.SignatureResult;
import io.datafold.sdk.signing.SigningConfig;
import io.datafold.sdk.signing.SigningOptions;
import io.datafold.sdk.verification.ExtractedSignatureData;
import io.datafold.sdk.verification.SecurityLevel;
import io.datafold.sdk.verification.SignatureExtractor;
import io.datafold.sdk.verification.VerificationConfig;
import io.datafold.sdk.verification.VerificationResult;
import io.datafold.sdk.verification.Verifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SignatureInspectorTest {

    private static final long CREATED = 1_700_000_000L;
    private static final String NONCE = "123e4567-e89b-42d3-a456-426614174000";

    private SignatureInspector inspector;
    private Ed25519.RawKeyPair keyPair;
    private SignableMessage message;
    private SignatureResult signed;

    @BeforeEach
    void setUp() throws Exception {
        inspector = new SignatureInspector(Clock.fixed(Instant.ofEpochSecond(CREATED + 7200), ZoneOffset.UTC));
        keyPair = Ed25519.generateKeyPair();
        RequestSigner signer = new RequestSigner(SigningConfig.builder()
            .keyId("client-1")
            .privateKey(keyPair.privateKey())
            .build());
        message = SignableMessage.builder(HttpMethod.POST, "https://api.example.com/items")
            .header("content-type", "application/json")
            .body("{\"a\":1}")
            .build();
        signed = signer.sign(message, SigningOptions.builder().timestamp(CREATED).build());
    }

    @Test
    void signerOutputIsCompliant() {
        FormatAnalysis analysis = inspector.inspectFormat(signed.headers());

        assertTrue(analysis.rfc9421Compliant());
        assertTrue(analysis.issues().isEmpty());
        assertEquals(List.of("signature-input", "signature", "content-digest"), analysis.signatureHeaders());
        assertEquals(List.of("sig1"), analysis.signatureIds());
        assertTrue(inspector.isCompliant(signed.headers()));
    }

    @Test
    void reportsMissingAndMalformedHeaders() {
        FormatAnalysis empty = inspector.inspectFormat(Map.of());
        assertFalse(empty.rfc9421Compliant());
        assertEquals(List.of("MISSING_SIGNATURE_INPUT", "MISSING_SIGNATURE"), codes(empty));

        FormatAnalysis broken = inspector.inspectFormat(Map.of(
            "Signature-Input", "sig1=(@method @target-uri);created=12;keyid=\"k\";alg=\"hmac\";nonce=\"n\"",
            "Signature", "sig1=:abcd:",
            "Content-Digest", "md5=:YWJj:"
        ));
        List<String> codes = codes(broken);
        assertFalse(broken.rfc9421Compliant());
        assertTrue(codes.containsAll(List.of("UNQUOTED_COMPONENTS", "INVALID_TIMESTAMP", "INVALID_NONCE_FORMAT",
            "UNSUPPORTED_ALGORITHM", "NO_COMPONENTS", "UNEXPECTED_SIGNATURE_LENGTH", "UNSUPPORTED_DIGEST_ALGORITHM")));
        assertFalse(codes.contains("INVALID_CONTENT_DIGEST_FORMAT"));

        FormatAnalysis unparsable = inspector.inspectFormat(Map.of("signature-input", "garbage", "signature", "nope"));
        assertEquals(List.of("INVALID_SIGNATURE_INPUT_FORMAT", "INVALID_SIGNATURE_FORMAT"), codes(unparsable));
        assertTrue(unparsable.issues().get(0).message().startsWith("Failed to parse signature-input: "));
    }

    @Test
    void flagsUnverifiableComponentsAndBadHeaderNames() {
        FormatAnalysis analysis = inspector.inspectFormat(Map.of(
            "signature-input", "sig1=(\"@authority\" \"@foo\" \"bad header\" \"Content-Type\");created=1700000000;"
                + "keyid=\"k\";alg=\"ed25519\";nonce=\"" + NONCE + "\"",
            "signature", "sig1=:" + "0".repeat(128) + ":"
        ));

        assertEquals(List.of("UNSUPPORTED_PSEUDO_COMPONENT", "UNKNOWN_PSEUDO_COMPONENT", "INVALID_HEADER_NAME",
            "NON_LOWERCASE_COMPONENT"), codes(analysis));
        assertTrue(analysis.issues().stream().allMatch(issue -> issue.severity() == Severity.ERROR));
        assertFalse(analysis.rfc9421Compliant());
    }

    @Test
    void pseudoComponentsOutsideVerifiableSetAreNotCompliant() {
        for (String component : List.of("@authority", "@scheme", "@request-target")) {
            Map<String, String> headers = Map.of(
                "signature-input", "sig1=(\"@method\" \"" + component + "\");created=1700000000;keyid=\"k\";"
                    + "alg=\"ed25519\";nonce=\"" + NONCE + "\"",
                "signature", "sig1=:" + "0".repeat(128) + ":"
            );
            assertFalse(inspector.isCompliant(headers), component);
        }
    }

    @Test
    void uppercaseSignatureHexIsFormatError() {
        Map<String, String> headers = new HashMap<>(signed.headers());
        headers.put("signature", headers.get("signature").toUpperCase(Locale.ROOT).replace("SIG1=", "sig1="));

        FormatAnalysis analysis = inspector.inspectFormat(headers);

        assertFalse(analysis.rfc9421Compliant());
        assertEquals(List.of("INVALID_SIGNATURE_FORMAT"), codes(analysis));
    }

    @Test
    void analyzesComponentsAndParameters() throws Exception {
        ExtractedSignatureData data = SignatureExtractor.extract(signed.headers());

        ComponentAnalysis components = inspector.analyzeComponents(data);
        assertEquals(List.of("@method", "@target-uri", "content-type", "content-digest"), components.validComponents());
        assertTrue(components.missingRecommended().isEmpty());
        assertEquals(SecurityLevel.HIGH, components.security().level());

        ParameterValidation parameters = inspector.validateParameters(data.params());
        assertTrue(parameters.allValid());
        assertEquals(List.of("Timestamp is 120 minutes old"), parameters.insights());

        ParameterValidation bad = inspector.validateParameters(new SignatureParams(5L, " ", "rsa", "x"));
        assertFalse(bad.allValid());
        assertFalse(bad.parameters().get("created").valid());
        assertFalse(bad.parameters().get("keyid").valid());
        assertEquals("Unsupported algorithm: rsa", bad.parameters().get("alg").message());
        assertFalse(bad.parameters().get("nonce").valid());

        SecurityReport report = inspector.analyzeSecurity(data);
        assertTrue(report.parametersValid());
        assertEquals(components.security(), report.componentSecurity());
    }

    @Test
    void componentAnalysisListsMissingRecommendations() throws Exception {
        ExtractedSignatureData data = SignatureExtractor.extract(Map.of(
            "signature-input", "sig1=(\"x-custom\" \"@path\");created=1700000000;keyid=\"k\";alg=\"ed25519\";nonce=\"" + NONCE + "\"",
            "signature", "sig1=:" + "0".repeat(128) + ":"
        ));

        ComponentAnalysis analysis = inspector.analyzeComponents(data);

        assertEquals(List.of("x-custom"), analysis.validComponents());
        assertEquals("@path", analysis.invalidComponents().get(0).component());
        assertEquals("format", analysis.invalidComponents().get(0).type());
        assertEquals(List.of("@method", "@target-uri"), analysis.missingRecommended());
        assertEquals(SecurityLevel.LOW, analysis.security().level());
    }

    @Test
    void quickDiagnosticSummarizesIssues() {
        String clean = inspector.quickDiagnostic(signed.headers());
        assertTrue(clean.startsWith("=== Quick Signature Diagnostic ===\nRFC 9421 Compliant: YES"));
        assertFalse(clean.contains("Issues Found:"));

        String broken = inspector.quickDiagnostic(Map.of("signature", "sig1=:abcd:"));
        assertTrue(broken.contains("RFC 9421 Compliant: NO"));
        assertTrue(broken.contains("Issues Found:"));
        assertTrue(broken.contains("❌ Signature-Input header is required"));
        assertTrue(broken.contains("⚠️ Signature length is 4 hex chars, expected 128 for Ed25519"));
    }

    @Test
    void reportAndJsonDescribeVerificationResult() throws Exception {
        Verifier verifier = new Verifier(VerificationConfig.builder()
            .clock(Clock.fixed(Instant.ofEpochSecond(CREATED + 5), ZoneOffset.UTC))
            .build());
        VerificationResult result = verifier.verify(message, signed.headers(), "standard", keyPair.publicKey());

        String report = inspector.generateDiagnosticReport(result);
        assertTrue(report.startsWith("=== RFC 9421 Signature Verification Report ==="));
        assertTrue(report.contains("Overall Status: VALID"));
        assertTrue(report.contains("✓ Cryptographic Valid"));
        assertTrue(report.contains("Created: 2023-11-14 22:13:20 UTC"));
        assertTrue(report.contains("Age: 5 seconds"));
        assertTrue(report.contains("Digest Algorithm: sha-256"));
        assertTrue(report.contains("✓ Nonce format validated"));
        assertFalse(report.contains("=== Error Details ==="));

        ObjectNode json = inspector.toJsonNode(result);
        assertEquals("valid", json.get("status").asText());
        assertTrue(json.get("signature_valid").asBoolean());
        assertTrue(json.get("checks").get("cryptographic_valid").asBoolean());
        assertEquals("client-1", json.at("/diagnostics/signature_analysis/key_id").asText());
        assertEquals("basic-replay-protection", json.at("/diagnostics/policy_compliance/rule_results/0/rule").asText());
        assertEquals("high", json.at("/diagnostics/security_analysis/security_level").asText());
        assertTrue(json.at("/performance/step_timings").has("extraction"));
        assertFalse(json.has("error"));

        JsonNode parsed = Json.mapper().readTree(inspector.toJson(result));
        assertEquals("valid", parsed.get("status").asText());
        assertEquals(List.of("@method", "@target-uri", "content-type", "content-digest").size(),
            parsed.at("/diagnostics/signature_analysis/covered_components").size());
    }

    @Test
    void reportIncludesErrorDetails() throws Exception {
        Verifier verifier = Verifier.withDefaults();
        VerificationResult result = verifier.verify(message, Map.of());

        String report = inspector.generateDiagnosticReport(result);

        assertTrue(report.contains("Overall Status: ERROR"));
        assertFalse(report.contains("Created:"));
        assertTrue(report.contains("=== Error Details ===\nCode: MISSING_SIGNATURE_INPUT"));
        assertEquals("MISSING_SIGNATURE_INPUT", inspector.toJsonNode(result).at("/error/code").asText());
    }

    private static List<String> codes(FormatAnalysis analysis) {
        return analysis.issues().stream().map(FormatIssue::code).collect(Collectors.toList());
    }
}
