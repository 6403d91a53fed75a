package io.datafold.sdk.signing;

import io.datafold.sdk.HttpMethod;
import io.datafold.sdk.SignableMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalMessageBuilderTest {

    private static final String NONCE = "123e4567-e89b-42d3-a456-426614174000";
    private static final SignatureParams PARAMS = new SignatureParams(1_700_000_000L, "k", "ed25519", NONCE);

    @Test
    void minimalGetEmitsMethodTargetAndParams() throws Exception {
        SignableMessage message = SignableMessage.builder(HttpMethod.GET, "https://api.example.com/items?x=1").build();
        SignatureComponents components = SignatureComponents.builder().build();

        CanonicalMessage canonical = CanonicalMessageBuilder.lenient().build(message, components, PARAMS, null);

        assertEquals(List.of(
            "\"@method\": GET",
            "\"@target-uri\": /items?x=1",
            "\"@signature-params\": (\"@method\" \"@target-uri\");created=1700000000;keyid=\"k\";alg=\"ed25519\";nonce=\"" + NONCE + "\""
        ), canonical.lines());
        assertEquals(List.of("@method", "@target-uri"), canonical.coveredComponents());
        assertFalse(canonical.text().contains("content-digest"));
        assertFalse(canonical.text().endsWith("\n"));
    }

    @Test
    void headersFollowConfiguredOrderAndDigestComesLast() throws Exception {
        SignableMessage message = SignableMessage.builder(HttpMethod.POST, "https://api.example.com/")
            .header("X-B", "two")
            .header("Content-Type", "application/json")
            .body("{}")
            .build();
        SignatureComponents components = SignatureComponents.builder()
            .headers(List.of("content-type", "x-b"))
            .contentDigest(true)
            .build();
        ContentDigest digest = ContentDigests.compute("{}", DigestAlgorithm.SHA_256);

        CanonicalMessage canonical = CanonicalMessageBuilder.lenient().build(message, components, PARAMS, digest);

        assertEquals(List.of("@method", "@target-uri", "content-type", "x-b", "content-digest"), canonical.coveredComponents());
        assertEquals("\"content-digest\": " + digest.headerValue(), canonical.lines().get(4));
        assertEquals("\"@target-uri\": /", canonical.lines().get(1));
    }

    @Test
    void escapesQuotesInValuesButNotInParams() throws Exception {
        SignableMessage message = SignableMessage.builder(HttpMethod.GET, "https://example.com/a")
            .header("x-note", "say \"hi\"")
            .build();
        SignatureComponents components = SignatureComponents.builder().headers(List.of("x-note")).build();

        CanonicalMessage canonical = CanonicalMessageBuilder.lenient().build(message, components, PARAMS, null);

        assertEquals("\"x-note\": say \\\"hi\\\"", canonical.lines().get(2));
        assertTrue(canonical.lines().get(3).contains("keyid=\"k\""));
    }

    @Test
    void lenientBuilderSkipsMissingHeaders() throws Exception {
        SignableMessage message = SignableMessage.builder(HttpMethod.GET, "https://example.com/").build();
        SignatureComponents components = SignatureComponents.builder().headers(List.of("x-missing")).build();

        CanonicalMessage canonical = CanonicalMessageBuilder.lenient().build(message, components, PARAMS, null);

        assertEquals(List.of("@method", "@target-uri"), canonical.coveredComponents());
    }

    @Test
    void strictOrRequiredHeadersMustBePresent() {
        SignableMessage message = SignableMessage.builder(HttpMethod.GET, "https://example.com/").build();
        SignatureComponents components = SignatureComponents.builder().headers(List.of("x-missing")).build();

        SigningException strict = assertThrows(SigningException.class,
            () -> CanonicalMessageBuilder.strict().build(message, components, PARAMS, null));
        assertEquals(SigningErrorCode.MISSING_REQUIRED_HEADER, strict.getErrorCode());
        assertEquals("x-missing", strict.getDetails().get("header"));

        CanonicalMessageBuilder required = new CanonicalMessageBuilder(false, List.of("X-Missing"));
        assertThrows(SigningException.class, () -> required.build(message, components, PARAMS, null));
    }

    @Test
    void digestDefaultsToSha256OfBody() throws Exception {
        SignableMessage message = SignableMessage.builder(HttpMethod.PUT, "https://example.com/").body("abc").build();
        SignatureComponents components = SignatureComponents.builder().contentDigest(true).build();

        CanonicalMessage canonical = CanonicalMessageBuilder.lenient().build(message, components, PARAMS, null);

        assertEquals("\"content-digest\": " + ContentDigests.compute("abc", DigestAlgorithm.SHA_256).headerValue(),
            canonical.lines().get(2));
    }

    @Test
    void targetUriRequiresAbsoluteHttpUrl() throws Exception {
        assertEquals("/", CanonicalMessageBuilder.targetUri("http://example.com"));
        assertEquals("/a/b?q=%20x", CanonicalMessageBuilder.targetUri("https://example.com:8443/a/b?q=%20x"));

        SigningException relative = assertThrows(SigningException.class, () -> CanonicalMessageBuilder.targetUri("/a"));
        assertEquals(SigningErrorCode.INVALID_URL, relative.getErrorCode());
        assertThrows(SigningException.class, () -> CanonicalMessageBuilder.targetUri("ftp://example.com/a"));
        assertThrows(SigningException.class, () -> CanonicalMessageBuilder.targetUri("not a url"));
    }

    @Test
    void rebuildFollowsWireOrder() throws Exception {
        SignableMessage message = SignableMessage.builder(HttpMethod.GET, "https://example.com/x")
            .header("x-a", "1")
            .build();

        CanonicalMessage canonical = CanonicalMessageBuilder.rebuild(message, List.of("x-a", "@method"), PARAMS, null);

        assertEquals("\"x-a\": 1", canonical.lines().get(0));
        assertEquals("\"@method\": GET", canonical.lines().get(1));

        SigningException missing = assertThrows(SigningException.class,
            () -> CanonicalMessageBuilder.rebuild(message, List.of("x-b"), PARAMS, null));
        assertEquals(SigningErrorCode.MISSING_REQUIRED_HEADER, missing.getErrorCode());
        assertThrows(SigningException.class,
            () -> CanonicalMessageBuilder.rebuild(message, List.of("@authority"), PARAMS, null));
        assertThrows(SigningException.class,
            () -> CanonicalMessageBuilder.rebuild(message, List.of("content-digest"), PARAMS, null));
    }

    @Test
    void rebuildRejectsUppercaseComponentNames() {
        SignableMessage message = SignableMessage.builder(HttpMethod.GET, "https://example.com/x")
            .header("x-a", "1")
            .build();

        SigningException mixed = assertThrows(SigningException.class,
            () -> CanonicalMessageBuilder.rebuild(message, List.of("@method", "X-A"), PARAMS, null));
        assertEquals(SigningErrorCode.CANONICAL_MESSAGE_FAILED, mixed.getErrorCode());
        assertThrows(SigningException.class,
            () -> CanonicalMessageBuilder.rebuild(message, List.of("@Method"), PARAMS, null));
    }
}
