package io.datafold.sdk.signing;

import io.datafold.sdk.SignableMessage;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Serialises the covered facts of a message into its canonical form.
 * <p>
 * Lines are emitted as {@code @method}, {@code @target-uri}, headers in configured order, {@code content-digest},
 * then {@code @signature-params}. A configured header that the message lacks is skipped unless the builder is strict
 * or the header is listed as required, in which case building fails with {@link SigningErrorCode#MISSING_REQUIRED_HEADER}.
 */
public final class CanonicalMessageBuilder {

    private final boolean strictHeaders;
    private final List<String> requiredHeaders;

    public CanonicalMessageBuilder(boolean strictHeaders, List<String> requiredHeaders) {
        this.strictHeaders = strictHeaders;
        List<String> normalized = new ArrayList<>();
        if (requiredHeaders != null) {
            for (String name : requiredHeaders) {
                if (name != null && !name.isBlank()) {
                    normalized.add(name.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.requiredHeaders = List.copyOf(normalized);
    }

    public static CanonicalMessageBuilder lenient() {
        return new CanonicalMessageBuilder(false, List.of());
    }

    public static CanonicalMessageBuilder strict() {
        return new CanonicalMessageBuilder(true, List.of());
    }

    public boolean isStrict() {
        return strictHeaders;
    }

    public List<String> requiredHeaders() {
        return requiredHeaders;
    }

    /**
     * Builds the canonical message for signing.
     *
     * @param digest precomputed digest; when {@code null} and the digest is covered, a SHA-256 digest of the body
     *               (or of the empty byte string) is used
     */
    public CanonicalMessage build(SignableMessage message, SignatureComponents components, SignatureParams params,
                                  ContentDigest digest) throws SigningException {
        List<String> lines = new ArrayList<>();
        List<String> covered = new ArrayList<>();

        if (components.method()) {
            appendLine(lines, covered, SignatureComponents.METHOD, message.method().name());
        }
        if (components.targetUri()) {
            appendLine(lines, covered, SignatureComponents.TARGET_URI, targetUri(message.url()));
        }
        for (String header : components.headers()) {
            Optional<String> value = message.header(header);
            if (value.isPresent()) {
                appendLine(lines, covered, header, value.get());
            } else if (strictHeaders || requiredHeaders.contains(header)) {
                throw missingHeader(header, message);
            }
        }
        if (components.contentDigest()) {
            ContentDigest resolved = digest != null
                ? digest
                : ContentDigests.compute(message.bodyBytes(), DigestAlgorithm.SHA_256);
            appendLine(lines, covered, SignatureComponents.CONTENT_DIGEST, resolved.headerValue());
        }
        return finish(lines, covered, params);
    }

    /**
     * Re-derives the canonical message from a wire covered-component list, in wire order. Every listed component must
     * be reproducible from the message; anything missing or unknown fails.
     *
     * @param digest the digest claimed on the wire; required when {@code content-digest} is covered
     */
    public static CanonicalMessage rebuild(SignableMessage message, List<String> coveredComponents, SignatureParams params,
                                           ContentDigest digest) throws SigningException {
        List<String> lines = new ArrayList<>();
        List<String> covered = new ArrayList<>();

        for (String component : coveredComponents) {
            String name = component.toLowerCase(Locale.ROOT);
            if (!name.equals(component)) {
                throw new SigningException(
                    SigningErrorCode.CANONICAL_MESSAGE_FAILED,
                    "component names must be lowercase: " + component,
                    Map.of("component", component)
                );
            }
            switch (name) {
                case SignatureComponents.METHOD:
                    appendLine(lines, covered, name, message.method().name());
                    break;
                case SignatureComponents.TARGET_URI:
                    appendLine(lines, covered, name, targetUri(message.url()));
                    break;
                case SignatureComponents.CONTENT_DIGEST:
                    if (digest == null) {
                        throw new SigningException(
                            SigningErrorCode.CANONICAL_MESSAGE_FAILED,
                            "content-digest is covered but no Content-Digest header is present",
                            Map.of("component", name)
                        );
                    }
                    appendLine(lines, covered, name, digest.headerValue());
                    break;
                default:
                    if (name.startsWith("@")) {
                        throw new SigningException(
                            SigningErrorCode.CANONICAL_MESSAGE_FAILED,
                            "unsupported derived component " + component,
                            Map.of("component", component)
                        );
                    }
                    String value = message.header(name).orElseThrow(() -> missingHeader(name, message));
                    appendLine(lines, covered, name, value);
            }
        }
        return finish(lines, covered, params);
    }

    /**
     * Returns path plus query of an absolute http(s) URL; the path defaults to {@code /}.
     */
    public static String targetUri(String url) throws SigningException {
        if (url == null) {
            throw invalidUrl(null, null);
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException ex) {
            throw invalidUrl(url, ex);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw invalidUrl(url, null);
        }
        String host = uri.getHost() != null ? uri.getHost() : uri.getRawAuthority();
        if (host == null || host.isBlank()) {
            throw invalidUrl(url, null);
        }
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        String query = uri.getRawQuery();
        return query == null || query.isEmpty() ? path : path + "?" + query;
    }

    static String escapeValue(String value) {
        return value.replace("\"", "\\\"");
    }

    private static void appendLine(List<String> lines, List<String> covered, String name, String value) {
        lines.add("\"" + name + "\": " + escapeValue(value));
        covered.add(name);
    }

    private static CanonicalMessage finish(List<String> lines, List<String> covered, SignatureParams params) {
        String serialized = params.serialize(covered);
        // the parameter list keeps its own quotes unescaped so it matches Signature-Input byte for byte
        lines.add("\"" + SignatureComponents.SIGNATURE_PARAMS + "\": " + serialized);
        return new CanonicalMessage(lines, covered, serialized);
    }

    private static SigningException missingHeader(String header, SignableMessage message) {
        return new SigningException(
            SigningErrorCode.MISSING_REQUIRED_HEADER,
            "Required header not found: " + header,
            Map.of("header", header, "availableHeaders", List.copyOf(message.headers().keySet()))
        );
    }

    private static SigningException invalidUrl(String url, Throwable cause) {
        return new SigningException(
            SigningErrorCode.INVALID_URL,
            "Invalid URL format: " + url,
            Map.of("url", String.valueOf(url)),
            cause
        );
    }
}
