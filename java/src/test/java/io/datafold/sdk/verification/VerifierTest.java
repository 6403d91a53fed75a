package io.datafold.sdk.verification;

import io.datafold.sdk.ConfigurationException;
import io.datafold.sdk.HttpMethod;
import io.datafold.sdk.SignableMessage;
import io.datafold.sdk.internal.Ed25519;
import io.datafold.sdk.internal.Hex;
import io.datafold.sdk.keys.InMemoryKeyProvider;
import io.datafold.sdk.keys.KeyProviderSource;
import io.datafold.sdk.keys.KeySource;
import io.datafold.sdk.signing.CanonicalMessage;
import io.datafold.sdk.signing.CanonicalMessageBuilder;
import io.datafold.sdk.signing.RequestSigner;
import io.datafold.sdk.signing.SignatureComponents;
import io.datafold.sdk.signing.SignatureParams;
import io.datafold.sdk.signing.SignatureResult;
import io.datafold.sdk.signing.SigningConfig;
import io.datafold.sdk.signing.SigningOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class VerifierTest {

    private static final long CREATED = 1_700_000_000L;
    private static final String KEY_ID = "client-1";

    private Ed25519.RawKeyPair keyPair;
    private RequestSigner signer;

    @BeforeEach
    void setUp() throws Exception {
        keyPair = Ed25519.generateKeyPair();
        signer = new RequestSigner(SigningConfig.builder()
            .keyId(KEY_ID)
            .privateKey(keyPair.privateKey())
            .build());
    }

    @Test
    void signedMessageVerifies() throws Exception {
        SignableMessage message = post("{\"a\":1}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));

        VerificationResult result = verifierAt(CREATED + 10).verify(message, signed.headers(), "standard", keyPair.publicKey());

        assertEquals(VerificationStatus.VALID, result.status());
        assertTrue(result.isValid());
        assertTrue(result.signatureValid());
        assertTrue(result.checks().values().stream().allMatch(Boolean::booleanValue));
        assertTrue(result.errorDetails().isEmpty());
        assertEquals(KEY_ID, result.diagnostics().signature().keyId());
        assertEquals(10L, result.diagnostics().signature().ageSeconds());
        assertTrue(result.diagnostics().content().hasContentDigest());
        assertEquals("sha-256", result.diagnostics().content().digestAlgorithm());
        assertEquals(List.of("content-type", "content-digest"), result.diagnostics().policy().extraComponents());
        assertEquals(SecurityLevel.HIGH, result.diagnostics().security().level());
    }

    @Test
    void flippedSignatureFailsCryptographicCheck() throws Exception {
        SignableMessage message = post("{\"a\":1}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        Map<String, String> headers = new HashMap<>(signed.headers());
        String signature = headers.get("signature");
        char first = signature.charAt(6);
        headers.put("signature", signature.substring(0, 6) + (first == '0' ? '1' : '0') + signature.substring(7));

        VerificationResult result = verifierAt(CREATED).verify(message, headers, "standard", keyPair.publicKey());

        assertEquals(VerificationStatus.INVALID, result.status());
        assertFalse(result.passed(VerificationCheck.CRYPTOGRAPHIC));
        assertTrue(result.passed(VerificationCheck.FORMAT));
        assertFalse(result.signatureValid());
        assertTrue(result.diagnostics().security().concerns().contains("Cryptographic signature verification failed"));
    }

    @Test
    void uppercasedSignatureHexIsRejected() throws Exception {
        SignableMessage message = post("{\"a\":1}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        Map<String, String> headers = new HashMap<>(signed.headers());
        String signature = headers.get("signature");
        int letter = -1;
        for (int i = "sig1=:".length(); i < signature.length() - 1; i++) {
            if (Character.isLetter(signature.charAt(i))) {
                letter = i;
                break;
            }
        }
        assertTrue(letter > 0);
        headers.put("signature", signature.substring(0, letter)
            + Character.toUpperCase(signature.charAt(letter)) + signature.substring(letter + 1));

        VerificationResult result = verifierAt(CREATED).verify(message, headers, "standard", keyPair.publicKey());

        assertFalse(result.isValid());
        assertFalse(result.signatureValid());
        assertEquals(VerificationStatus.ERROR, result.status());
        assertEquals("INVALID_SIGNATURE_FORMAT", result.error().code());
    }

    @Test
    void recasedCoveredComponentFailsCryptographicCheck() throws Exception {
        SignableMessage message = post("{\"a\":1}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        Map<String, String> headers = new HashMap<>(signed.headers());
        headers.put("signature-input", headers.get("signature-input").replace("\"content-type\"", "\"Content-type\""));

        VerificationResult result = verifierAt(CREATED).verify(message, headers, "standard", keyPair.publicKey());

        assertFalse(result.passed(VerificationCheck.CRYPTOGRAPHIC));
        assertFalse(result.signatureValid());
        assertEquals(VerificationStatus.INVALID, result.status());
    }

    @Test
    void changedCoveredHeaderFailsCryptographicCheck() throws Exception {
        SignableMessage message = post("{\"a\":1}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        SignableMessage tampered = message.toBuilder().header("content-type", "text/plain").build();

        VerificationResult result = verifierAt(CREATED).verify(tampered, signed.headers(), "standard", keyPair.publicKey());

        assertFalse(result.passed(VerificationCheck.CRYPTOGRAPHIC));
        assertTrue(result.passed(VerificationCheck.CONTENT_DIGEST));
        assertEquals(VerificationStatus.INVALID, result.status());
    }

    @Test
    void changedBodyFailsDigestButNotSignature() throws Exception {
        SignableMessage message = post("{\"a\":1}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        SignableMessage tampered = message.toBuilder().body("{\"a\":2}").build();

        VerificationResult result = verifierAt(CREATED).verify(tampered, signed.headers(), "standard", keyPair.publicKey());

        assertFalse(result.passed(VerificationCheck.CONTENT_DIGEST));
        assertTrue(result.signatureValid());
        assertEquals(VerificationStatus.INVALID, result.status());
    }

    @Test
    void staleTimestampFailsOnlyTimestampCheck() throws Exception {
        SignableMessage message = post("{}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));

        VerificationResult result = verifierAt(CREATED + 1000).verify(message, signed.headers(), "standard", keyPair.publicKey());

        assertFalse(result.passed(VerificationCheck.TIMESTAMP));
        assertTrue(result.signatureValid());
        assertEquals(VerificationStatus.INVALID, result.status());

        VerificationResult lenient = verifierAt(CREATED + 1000).verify(message, signed.headers(), "lenient", keyPair.publicKey());
        assertTrue(lenient.passed(VerificationCheck.TIMESTAMP));
    }

    @Test
    void futureTimestampToleratesOnlyClockSkew() throws Exception {
        SignableMessage message = post("{}");

        VerificationResult nearFuture = verifierAt(CREATED - 30)
            .verify(message, signer.sign(message, pinned(CREATED)).headers(), "standard", keyPair.publicKey());
        VerificationResult farFuture = verifierAt(CREATED - 120)
            .verify(message, signer.sign(message, pinned(CREATED)).headers(), "standard", keyPair.publicKey());

        assertTrue(nearFuture.passed(VerificationCheck.TIMESTAMP));
        assertFalse(farFuture.passed(VerificationCheck.TIMESTAMP));
    }

    @Test
    void policyWithoutMaxAgeAcceptsAnyValidTimestamp() throws Exception {
        SignableMessage message = post("{}");
        VerificationPolicy unbounded = VerificationPolicy.builder("unbounded")
            .description("timestamp shape only")
            .build();
        Verifier verifier = new Verifier(VerificationConfig.builder()
            .clock(fixedClock(CREATED - 3600))
            .addPolicy(unbounded)
            .build());

        VerificationResult result = verifier.verify(message, signer.sign(message, pinned(CREATED)).headers(),
            "unbounded", keyPair.publicKey());

        assertTrue(result.passed(VerificationCheck.TIMESTAMP));
        assertTrue(Verifier.checkTimestamp(new SignatureParams(CREATED, KEY_ID, "ed25519", "n"), unbounded,
            Instant.ofEpochSecond(CREATED - 3600)));
        assertFalse(Verifier.checkTimestamp(new SignatureParams(5L, KEY_ID, "ed25519", "n"), unbounded,
            Instant.ofEpochSecond(CREATED)));
    }

    @Test
    void missingRequiredComponentFailsCoverage() throws Exception {
        SignableMessage message = SignableMessage.builder(HttpMethod.GET, "https://api.example.com/items").build();
        SigningOptions options = SigningOptions.builder()
            .timestamp(CREATED)
            .components(SignatureComponents.builder().method(false).build())
            .build();
        SignatureResult signed = signer.sign(message, options);

        VerificationResult result = verifierAt(CREATED).verify(message, signed.headers(), "standard", keyPair.publicKey());

        assertFalse(result.passed(VerificationCheck.COMPONENT_COVERAGE));
        assertTrue(result.passed(VerificationCheck.CRYPTOGRAPHIC));
        assertEquals(List.of("@method"), result.diagnostics().policy().missingRequiredComponents());
        assertEquals(VerificationStatus.INVALID, result.status());
    }

    @Test
    void strictPolicyRejectsExtraComponents() throws Exception {
        SignableMessage message = post("{}").toBuilder().header("x-trace", "abc").build();
        SigningOptions options = SigningOptions.builder()
            .timestamp(CREATED)
            .components(SignatureComponents.builder()
                .headers(List.of("content-type", "x-trace"))
                .contentDigest(true)
                .build())
            .build();
        SignatureResult signed = signer.sign(message, options);

        VerificationResult result = verifierAt(CREATED).verify(message, signed.headers(), "strict", keyPair.publicKey());

        assertFalse(result.passed(VerificationCheck.COMPONENT_COVERAGE));
        assertEquals(List.of("x-trace"), result.diagnostics().policy().extraComponents());
    }

    @Test
    void malformedNonceFailsNonceCheck() throws Exception {
        SignableMessage message = SignableMessage.builder(HttpMethod.GET, "https://api.example.com/items").build();
        SignatureParams params = new SignatureParams(CREATED, KEY_ID, "ed25519", "not-a-uuid");
        CanonicalMessage canonical = CanonicalMessageBuilder.lenient()
            .build(message, SignatureComponents.builder().build(), params, null);
        String signature = Hex.encode(Ed25519.sign(Ed25519.privateKey(keyPair.privateKey()), canonical.bytes()));
        Map<String, String> headers = Map.of(
            "Signature-Input", "sig1=" + canonical.signatureParams(),
            "Signature", "sig1=:" + signature + ":"
        );

        VerificationResult result = verifierAt(CREATED).verify(message, headers, "standard", keyPair.publicKey());

        assertFalse(result.passed(VerificationCheck.NONCE));
        assertTrue(result.passed(VerificationCheck.CRYPTOGRAPHIC));
        assertFalse(result.passed(VerificationCheck.CUSTOM_RULES));
        assertEquals("basic-replay-protection", result.diagnostics().policy().customRuleResults().get(0).rule());
        assertEquals(VerificationStatus.INVALID, result.status());
    }

    @Test
    void replayedNonceIsRejectedUntilStateCleared() throws Exception {
        SignableMessage message = post("{}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        Verifier verifier = verifierAt(CREATED);

        VerificationResult first = verifier.verify(message, signed.headers(), "strict", keyPair.publicKey());
        VerificationResult replay = verifier.verify(message, signed.headers(), "strict", keyPair.publicKey());

        assertEquals(VerificationStatus.VALID, first.status());
        assertEquals(VerificationStatus.INVALID, replay.status());
        assertFalse(replay.passed(VerificationCheck.CUSTOM_RULES));
        assertTrue(replay.signatureValid());

        verifier.clearReplayState();
        assertEquals(VerificationStatus.VALID,
            verifier.verify(message, signed.headers(), "strict", keyPair.publicKey()).status());
    }

    @Test
    void forgedSignatureDoesNotBurnNonce() throws Exception {
        SignableMessage message = post("{}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        Verifier verifier = verifierAt(CREATED);
        byte[] otherKey = Ed25519.generateKeyPair().publicKey();

        VerificationResult forged = verifier.verify(message, signed.headers(), "strict", otherKey);
        VerificationResult genuine = verifier.verify(message, signed.headers(), "strict", keyPair.publicKey());

        assertEquals(VerificationStatus.INVALID, forged.status());
        assertEquals(VerificationStatus.VALID, genuine.status());
    }

    @Test
    void errorsAreReportedNotThrown() throws Exception {
        SignableMessage message = post("{}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        Verifier verifier = verifierAt(CREATED);

        VerificationResult unknownPolicy = verifier.verify(message, signed.headers(), "paranoid", keyPair.publicKey());
        assertEquals(VerificationStatus.ERROR, unknownPolicy.status());
        assertEquals("UNKNOWN_POLICY", unknownPolicy.error().code());
        assertFalse(unknownPolicy.signatureValid());

        VerificationResult noHeaders = verifier.verify(message, Map.of());
        assertEquals("MISSING_SIGNATURE_INPUT", noHeaders.error().code());

        VerificationResult noKey = verifier.verify(message, signed.headers());
        assertEquals("PUBLIC_KEY_NOT_FOUND", noKey.error().code());

        Map<String, String> mismatched = new HashMap<>(signed.headers());
        mismatched.put("signature", mismatched.get("signature").replace("sig1=", "sig2="));
        assertEquals("SIGNATURE_ID_MISMATCH", verifier.verify(message, mismatched).error().code());

        Map<String, String> badDigest = new HashMap<>(signed.headers());
        badDigest.put("content-digest", "sha-256=abc");
        assertEquals("INVALID_CONTENT_DIGEST_FORMAT", verifier.verify(message, badDigest).error().code());
    }

    @Test
    void registeredKeysAreUsedByKeyId() throws Exception {
        SignableMessage message = post("{}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        Verifier verifier = verifierAt(CREATED);

        verifier.addPublicKey(KEY_ID, keyPair.publicKey());
        assertTrue(verifier.verify(message, signed.headers()).isValid());

        assertTrue(verifier.removePublicKey(KEY_ID));
        assertEquals(VerificationStatus.ERROR, verifier.verify(message, signed.headers()).status());
        assertThrows(VerificationException.class, () -> verifier.addPublicKey(KEY_ID, new byte[31]));
    }

    @Test
    void keySourcesAreTriedInOrder() throws Exception {
        SignableMessage message = post("{}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        KeySource failing = new StubKeySource("failing", id -> CompletableFuture.failedFuture(new IllegalStateException("down")));
        KeySource hanging = new StubKeySource("hanging", id -> new CompletableFuture<>());
        KeySource empty = new StubKeySource("empty", id -> CompletableFuture.completedFuture(Optional.empty()));
        InMemoryKeyProvider provider = new InMemoryKeyProvider().putPublicKey(KEY_ID, keyPair.publicKey());

        Verifier verifier = new Verifier(VerificationConfig.builder()
            .clock(fixedClock(CREATED))
            .addKeySource(failing)
            .addKeySource(hanging)
            .addKeySource(empty)
            .addKeySource(new KeyProviderSource("memory", provider))
            .keyRetrievalTimeout(Duration.ofMillis(100))
            .build());

        VerificationResult result = verifier.verify(message, signed.headers());
        assertEquals(VerificationStatus.VALID, result.status());
        assertTrue(result.performance().stepTimings().containsKey("key_retrieval"));

        VerificationResult skipped = verifier.verify(VerificationRequest.builder(message)
            .headers(signed.headers())
            .skipKeyRetrieval(true)
            .build());
        assertEquals("PUBLIC_KEY_NOT_FOUND", skipped.error().code());
    }

    @Test
    void failingRulesAreReportedAsRuleErrors() throws Exception {
        SignableMessage message = post("{}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        VerificationPolicy policy = VerificationPolicy.builder("custom")
            .description("custom rules")
            .requiredComponents(List.of("@method"))
            .addRule(VerificationRule.of("explodes", "throws", context -> {
                throw new IllegalStateException("kaput");
            }))
            .addRule(VerificationRule.async("stalls", "never completes", context -> new CompletableFuture<>()))
            .addRule(VerificationRule.of("passes", "passes", context -> VerificationRuleResult.pass("ok")))
            .build();
        Verifier verifier = new Verifier(VerificationConfig.builder()
            .clock(fixedClock(CREATED))
            .addPolicy(policy)
            .ruleTimeout(Duration.ofMillis(100))
            .build());

        VerificationResult result = verifier.verify(message, signed.headers(), "custom", keyPair.publicKey());

        List<VerificationRuleResult> rules = result.diagnostics().policy().customRuleResults();
        assertEquals(3, rules.size());
        assertEquals("Rule validation error: kaput", rules.get(0).message());
        assertEquals("explodes", rules.get(0).rule());
        assertEquals("Rule validation error: timed out after 100ms", rules.get(1).message());
        assertTrue(rules.get(2).passed());
        assertEquals("passes", rules.get(2).rule());
        assertFalse(result.passed(VerificationCheck.CUSTOM_RULES));
        assertTrue(result.signatureValid());
    }

    @Test
    void callerPoliciesShadowBuiltIns() throws Exception {
        VerificationPolicy relaxed = VerificationPolicy.builder("standard")
            .description("no timestamp")
            .verifyTimestamp(false)
            .build();
        Verifier verifier = new Verifier(VerificationConfig.builder().addPolicy(relaxed).build());

        assertEquals("no timestamp", verifier.policy("standard").orElseThrow().description());
        assertTrue(verifier.policyNames().containsAll(List.of("standard", "strict", "lenient", "legacy")));
        assertEquals(4, verifier.policyNames().size());
    }

    @Test
    void batchKeepsOrderAndIsolatesFailures() throws Exception {
        SignableMessage message = post("{}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));
        Verifier verifier = verifierAt(CREATED);
        verifier.addPublicKey(KEY_ID, keyPair.publicKey());

        List<VerificationResult> results = verifier.verifyBatch(List.of(
            VerificationRequest.of(message, signed.headers()),
            VerificationRequest.of(message, Map.of()),
            VerificationRequest.builder(message).headers(signed.headers()).policy("lenient").build()
        ));

        assertEquals(3, results.size());
        assertEquals(VerificationStatus.VALID, results.get(0).status());
        assertEquals(VerificationStatus.ERROR, results.get(1).status());
        assertEquals(VerificationStatus.VALID, results.get(2).status());
    }

    @Test
    void asyncVerificationCompletesNormally() throws Exception {
        SignableMessage message = post("{}");
        Verifier verifier = verifierAt(CREATED);

        VerificationResult result = verifier.verifyAsync(VerificationRequest.of(message, Map.of("signature-input", "garbage",
            "signature", "sig1=:00:"))).join();

        assertEquals(VerificationStatus.ERROR, result.status());
        assertEquals("INVALID_SIGNATURE_INPUT_FORMAT", result.error().code());
    }

    @Test
    void resultExposesTimingsAndCheckNames() throws Exception {
        SignableMessage message = post("{}");
        SignatureResult signed = signer.sign(message, pinned(CREATED));

        VerificationResult result = verifierAt(CREATED).verify(message, signed.headers(), null, keyPair.publicKey());

        assertEquals("standard", result.diagnostics().policy().policyName());
        assertEquals(List.of("format_valid", "cryptographic_valid", "timestamp_valid", "nonce_valid",
            "content_digest_valid", "component_coverage_valid", "custom_rules_valid"),
            List.copyOf(result.checksByName().keySet()));
        Map<String, Double> timings = result.performance().stepTimings();
        assertTrue(timings.keySet().containsAll(List.of("extraction", "policy_retrieval", "key_retrieval",
            "verification", "cryptographic_check", "custom_rules_check")));
        assertTrue(result.performance().totalMillis() >= 0d);
    }

    @Test
    void unknownDefaultPolicyIsRejected() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
            () -> new Verifier(VerificationConfig.builder().defaultPolicy("missing").build()));
        assertEquals("INVALID_CONFIG", ex.getCode());
    }

    private Verifier verifierAt(long epochSecond) throws ConfigurationException {
        return new Verifier(VerificationConfig.builder().clock(fixedClock(epochSecond)).build());
    }

    private static Clock fixedClock(long epochSecond) {
        return Clock.fixed(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC);
    }

    private static SigningOptions pinned(long created) {
        return SigningOptions.builder().timestamp(created).build();
    }

    private static SignableMessage post(String body) {
        return SignableMessage.builder(HttpMethod.POST, "https://api.example.com/items?page=2")
            .header("Content-Type", "application/json")
            .body(body)
            .build();
    }

    private static final class StubKeySource implements KeySource {
        private final String name;
        private final Function<String, CompletableFuture<Optional<byte[]>>> body;

        StubKeySource(String name, Function<String, CompletableFuture<Optional<byte[]>>> body) {
            this.name = name;
            this.body = body;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public CompletableFuture<Optional<byte[]>> retrieve(String keyId) {
            return body.apply(keyId);
        }
    }
}
