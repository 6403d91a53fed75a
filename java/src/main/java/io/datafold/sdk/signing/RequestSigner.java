package io.datafold.sdk.signing;

import io.datafold.sdk.SignableMessage;
import io.datafold.sdk.internal.Ed25519;
import io.datafold.sdk.internal.Hex;
import io.datafold.sdk.internal.Stopwatch;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Ed25519 signer producing RFC 9421 {@code Signature-Input}, {@code Signature} and {@code Content-Digest} headers.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class RequestSigner implements Signer {

    private static final Logger LOGGER = Logger.getLogger(RequestSigner.class.getName());

    private final SigningConfig config;
    private final PrivateKey privateKey;
    private final SignatureParamsGenerator paramsGenerator;
    private final CanonicalMessageBuilder canonicalBuilder;

    public RequestSigner(SigningConfig config) throws SigningException {
        this.config = Objects.requireNonNull(config, "config");
        try {
            this.privateKey = Ed25519.privateKey(config.privateKey());
        } catch (GeneralSecurityException ex) {
            throw new SigningException(
                SigningErrorCode.CRYPTOGRAPHY_UNAVAILABLE,
                "Ed25519 is not available: " + ex.getMessage(),
                Map.of(),
                ex
            );
        }
        this.paramsGenerator = new SignatureParamsGenerator(config.nonceGenerator(), config.timestampGenerator());
        this.canonicalBuilder = new CanonicalMessageBuilder(config.strictHeaders(), config.requiredHeaders());
    }

    public SigningConfig config() {
        return config;
    }

    @Override
    public SignatureResult sign(SignableMessage message, SigningOptions options) throws SigningException {
        Objects.requireNonNull(message, "message");
        SigningOptions effective = options == null ? SigningOptions.none() : options;
        Stopwatch stopwatch = Stopwatch.start();

        if (effective.nonce().isPresent() && !config.allowCustomNonces()) {
            throw new SigningException(
                SigningErrorCode.INVALID_CONFIG,
                "Custom nonces are not allowed by this signing configuration"
            );
        }

        SignatureParams params = paramsGenerator.generate(
            config.keyId(),
            config.algorithm(),
            effective.nonce().orElse(null),
            effective.timestamp().orElse(null)
        );
        SignatureComponents components = effective.components().orElse(config.components());
        requireDeclaredHeaders(message);

        ContentDigest digest = null;
        if (components.contentDigest()) {
            digest = ContentDigests.compute(message.bodyBytes(), effective.digestAlgorithm().orElse(config.digestAlgorithm()));
        }

        CanonicalMessage canonical = canonicalBuilder.build(message, components, params, digest);
        String signatureHex = Hex.encode(signBytes(canonical.bytes()));
        if (signatureHex.length() != Ed25519.SIGNATURE_LENGTH * 2) {
            throw new SigningException(
                SigningErrorCode.SIGNING_FAILED,
                "Unexpected signature length " + signatureHex.length(),
                Map.of("length", signatureHex.length())
            );
        }

        String label = config.signatureLabel();
        String signatureInput = label + "=" + canonical.signatureParams();
        String signature = label + "=:" + signatureHex + ":";

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(SignatureResult.SIGNATURE_INPUT_HEADER, signatureInput);
        headers.put(SignatureResult.SIGNATURE_HEADER, signature);
        if (digest != null) {
            headers.put(SignatureResult.CONTENT_DIGEST_HEADER, digest.headerValue());
        }
        if (shouldSynthesizeContentType(message, components)) {
            headers.put(SignatureResult.CONTENT_TYPE_HEADER, defaultContentType(message));
        }

        double elapsed = stopwatch.elapsedMillis();
        long target = config.performanceTarget().toMillis();
        if (elapsed > target) {
            LOGGER.warning(() -> String.format(Locale.ROOT,
                "[datafold-sdk] signing took %.2fms (target: <%dms)", elapsed, target));
        }
        return new SignatureResult(signatureInput, signature, headers, canonical);
    }

    private void requireDeclaredHeaders(SignableMessage message) throws SigningException {
        for (String header : config.requiredHeaders()) {
            if (!message.hasHeader(header)) {
                throw new SigningException(
                    SigningErrorCode.MISSING_REQUIRED_HEADER,
                    "Required header not found: " + header,
                    Map.of("header", header, "availableHeaders", List.copyOf(message.headers().keySet()))
                );
            }
        }
    }

    private byte[] signBytes(byte[] payload) throws SigningException {
        try {
            return Ed25519.sign(privateKey, payload);
        } catch (GeneralSecurityException ex) {
            throw new SigningException(
                SigningErrorCode.SIGNING_FAILED,
                "Message signing failed: " + ex.getMessage(),
                Map.of(),
                ex
            );
        }
    }

    static boolean shouldSynthesizeContentType(SignableMessage message, SignatureComponents components) {
        return message.hasBody()
            && !message.hasHeader(SignatureResult.CONTENT_TYPE_HEADER)
            && components.coversHeader(SignatureResult.CONTENT_TYPE_HEADER);
    }

    static String defaultContentType(SignableMessage message) {
        String text = message.bodyText().orElse("").trim();
        if ((text.startsWith("{") && text.endsWith("}")) || (text.startsWith("[") && text.endsWith("]"))) {
            return "application/json";
        }
        return "application/octet-stream";
    }
}
