package io.datafold.sdk.verification;

import io.datafold.sdk.SignableMessage;
import io.datafold.sdk.signing.CanonicalMessage;
import io.datafold.sdk.signing.CanonicalMessageBuilder;
import io.datafold.sdk.signing.ContentDigest;
import io.datafold.sdk.signing.SignatureParams;
import io.datafold.sdk.signing.SigningException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses signature headers and re-derives the canonical message they claim to cover.
 */
public final class SignatureExtractor {

    public static final String SIGNATURE_INPUT = "signature-input";
    public static final String SIGNATURE = "signature";
    public static final String CONTENT_DIGEST = "content-digest";

    private static final Pattern SIGNATURE_INPUT_PATTERN = Pattern.compile("^([^=\\s]+)=\\(([^)]*)\\);(.+)$");
    private static final Pattern SIGNATURE_PATTERN = Pattern.compile("^([^=\\s]+)=:([0-9a-f]{128}):$");
    private static final Pattern QUOTED_COMPONENT = Pattern.compile("\"([^\"]+)\"");
    private static final List<String> REQUIRED_PARAMETERS = List.of("created", "keyid", "alg", "nonce");

    private SignatureExtractor() {
    }

    /**
     * Parsed form of a {@code Signature-Input} value.
     */
    public record ParsedSignatureInput(String label, List<String> coveredComponents, Map<String, String> parameters) {

        public ParsedSignatureInput {
            coveredComponents = List.copyOf(coveredComponents);
            parameters = Map.copyOf(parameters);
        }
    }

    /**
     * Case-insensitive header lookup.
     */
    public static Optional<String> findHeader(Map<String, String> headers, String name) {
        if (headers == null || name == null) {
            return Optional.empty();
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().trim().equalsIgnoreCase(name)) {
                return Optional.ofNullable(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public static ExtractedSignatureData extract(Map<String, String> headers) throws VerificationException {
        String signatureInput = findHeader(headers, SIGNATURE_INPUT)
            .filter(value -> !value.isBlank())
            .orElseThrow(() -> new VerificationException(
                VerificationErrorCode.MISSING_SIGNATURE_INPUT, "Signature-Input header not found"));
        String signature = findHeader(headers, SIGNATURE)
            .filter(value -> !value.isBlank())
            .orElseThrow(() -> new VerificationException(
                VerificationErrorCode.MISSING_SIGNATURE, "Signature header not found"));

        ParsedSignatureInput parsed = parseSignatureInput(signatureInput);
        SignatureParams params = toParams(parsed, signatureInput);

        Matcher signatureMatcher = SIGNATURE_PATTERN.matcher(signature.trim());
        if (!signatureMatcher.matches()) {
            throw new VerificationException(
                VerificationErrorCode.INVALID_SIGNATURE_FORMAT,
                "Invalid signature header format",
                Map.of("signature", signature)
            );
        }
        String label = signatureMatcher.group(1);
        if (!label.equals(parsed.label())) {
            throw new VerificationException(
                VerificationErrorCode.SIGNATURE_ID_MISMATCH,
                "Signature ID mismatch: " + label + " != " + parsed.label(),
                Map.of("signatureLabel", label, "signatureInputLabel", parsed.label())
            );
        }

        ContentDigest digest = null;
        Optional<String> digestHeader = findHeader(headers, CONTENT_DIGEST);
        if (digestHeader.isPresent()) {
            digest = ContentDigest.parse(digestHeader.get()).orElseThrow(() -> new VerificationException(
                VerificationErrorCode.INVALID_CONTENT_DIGEST_FORMAT,
                "Content-Digest header format is invalid",
                Map.of("contentDigest", digestHeader.get())
            ));
        }

        return new ExtractedSignatureData(label, signatureMatcher.group(2), parsed.coveredComponents(), params, digest);
    }

    /**
     * Splits a {@code Signature-Input} value into label, covered components and raw parameters. Quotes around
     * parameter values are removed.
     */
    public static ParsedSignatureInput parseSignatureInput(String signatureInput) throws VerificationException {
        Matcher matcher = SIGNATURE_INPUT_PATTERN.matcher(signatureInput == null ? "" : signatureInput.trim());
        if (!matcher.matches()) {
            throw new VerificationException(
                VerificationErrorCode.INVALID_SIGNATURE_INPUT_FORMAT,
                "Failed to parse signature input: invalid signature input format",
                Map.of("signatureInput", String.valueOf(signatureInput))
            );
        }

        List<String> components = new ArrayList<>();
        Matcher componentMatcher = QUOTED_COMPONENT.matcher(matcher.group(2));
        while (componentMatcher.find()) {
            components.add(componentMatcher.group(1));
        }

        Map<String, String> parameters = new LinkedHashMap<>();
        for (String part : matcher.group(3).split(";")) {
            int eq = part.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = part.substring(0, eq).trim();
            String value = part.substring(eq + 1).trim();
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            parameters.put(key, value);
        }
        return new ParsedSignatureInput(matcher.group(1), components, parameters);
    }

    /**
     * Re-derives the canonical bytes from the message using only the wire component list and parameters.
     */
    public static CanonicalMessage reconstruct(SignableMessage message, ExtractedSignatureData extracted)
        throws VerificationException {
        try {
            return CanonicalMessageBuilder.rebuild(
                message,
                extracted.coveredComponents(),
                extracted.params(),
                extracted.contentDigest()
            );
        } catch (SigningException ex) {
            throw new VerificationException(
                VerificationErrorCode.CANONICAL_MESSAGE_RECONSTRUCTION_FAILED,
                "Failed to reconstruct canonical message: " + ex.getMessage(),
                ex.getDetails(),
                ex
            );
        }
    }

    private static SignatureParams toParams(ParsedSignatureInput parsed, String raw) throws VerificationException {
        Map<String, String> parameters = parsed.parameters();
        for (String name : REQUIRED_PARAMETERS) {
            String value = parameters.get(name);
            if (value == null || value.isEmpty()) {
                throw new VerificationException(
                    VerificationErrorCode.INVALID_SIGNATURE_INPUT_FORMAT,
                    "Missing required signature parameter: " + name,
                    Map.of("parameter", name, "signatureInput", raw)
                );
            }
        }
        long created;
        try {
            created = Long.parseLong(parameters.get("created"));
        } catch (NumberFormatException ex) {
            throw new VerificationException(
                VerificationErrorCode.INVALID_SIGNATURE_INPUT_FORMAT,
                "Invalid created parameter: " + parameters.get("created"),
                Map.of("parameter", "created", "signatureInput", raw),
                ex
            );
        }
        return new SignatureParams(created, parameters.get("keyid"), parameters.get("alg"), parameters.get("nonce"));
    }
}
