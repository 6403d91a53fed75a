package io.datafold.sdk.signing;

import io.datafold.sdk.internal.Ed25519;
import io.datafold.sdk.keys.InMemoryKeyProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SigningConfigTest {

    @Test
    void defaultsToStandardComponents() throws Exception {
        SigningConfig config = SigningConfig.builder()
            .keyId(" key-1 ")
            .privateKey(Ed25519.generateKeyPair().privateKey())
            .build();

        assertEquals("key-1", config.keyId());
        assertEquals(List.of("@method", "@target-uri", "content-type", "content-digest"), config.components().names());
        assertEquals(DigestAlgorithm.SHA_256, config.digestAlgorithm());
        assertEquals("sig1", config.signatureLabel());
        assertEquals(SigningConfig.DEFAULT_PERFORMANCE_TARGET, config.performanceTarget());
        assertTrue(config.allowCustomNonces());
    }

    @Test
    void profileByNameAppliesPreset() throws Exception {
        SigningConfig config = SigningConfig.builder()
            .profile("STRICT")
            .keyId("key-1")
            .privateKey(Ed25519.generateKeyPair().privateKey())
            .build();

        assertEquals(DigestAlgorithm.SHA_512, config.digestAlgorithm());
        assertFalse(config.allowCustomNonces());
        assertTrue(config.components().coversHeader("authorization"));
    }

    @Test
    void resolvesPrivateKeyFromProvider() throws Exception {
        Ed25519.RawKeyPair pair = Ed25519.generateKeyPair();
        InMemoryKeyProvider provider = new InMemoryKeyProvider().putKeyPair("key-1", pair);

        SigningConfig config = SigningConfig.builder().keyId("key-1").privateKey(provider).build();
        assertArrayEquals(pair.privateKey(), config.privateKey());

        SigningException missing = assertThrows(SigningException.class,
            () -> SigningConfig.builder().keyId("other").privateKey(provider).build());
        assertEquals(SigningErrorCode.INVALID_PRIVATE_KEY, missing.getErrorCode());
    }

    @Test
    void validatesInputs() throws Exception {
        byte[] key = Ed25519.generateKeyPair().privateKey();

        assertEquals(SigningErrorCode.INVALID_KEY_ID, assertThrows(SigningException.class,
            () -> SigningConfig.builder().privateKey(key).build()).getErrorCode());
        assertEquals(SigningErrorCode.INVALID_PRIVATE_KEY, assertThrows(SigningException.class,
            () -> SigningConfig.builder().keyId("k").privateKey(new byte[31]).build()).getErrorCode());
        assertEquals(SigningErrorCode.INVALID_PRIVATE_KEY, assertThrows(SigningException.class,
            () -> SigningConfig.builder().keyId("k").privateKey(new byte[32]).build()).getErrorCode());
        assertEquals(SigningErrorCode.INVALID_SIGNATURE_COMPONENTS, assertThrows(SigningException.class,
            () -> SigningConfig.builder().keyId("k").privateKey(key)
                .method(false).targetUri(false).headers(List.of()).contentDigest(false)
                .build()).getErrorCode());
        assertEquals(SigningErrorCode.INVALID_CONFIG, assertThrows(SigningException.class,
            () -> SigningConfig.builder().keyId("k").privateKey(key).signatureLabel("sig 1").build()).getErrorCode());
    }

    @Test
    void builderChangesAfterBuildDoNotLeak() throws Exception {
        byte[] key = Ed25519.generateKeyPair().privateKey();
        SigningConfig.Builder builder = SigningConfig.builder().keyId("k").privateKey(key);
        SigningConfig config = builder.build();

        builder.addHeader("x-late");
        key[0] ^= 1;

        assertFalse(config.components().coversHeader("x-late"));
        assertNotEquals(key[0], config.privateKey()[0]);
    }
}
