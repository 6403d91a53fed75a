package io.datafold.sdk.signing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Selection of message facts covered by a signature.
 * <p>
 * Header names are lowercased and de-duplicated, keeping the first occurrence so the configured order is preserved.
 */
public final class SignatureComponents {

    public static final String METHOD = "@method";
    public static final String TARGET_URI = "@target-uri";
    public static final String CONTENT_DIGEST = "content-digest";
    public static final String SIGNATURE_PARAMS = "@signature-params";

    private final boolean method;
    private final boolean targetUri;
    private final List<String> headers;
    private final boolean contentDigest;

    private SignatureComponents(boolean method, boolean targetUri, List<String> headers, boolean contentDigest) {
        this.method = method;
        this.targetUri = targetUri;
        this.headers = Collections.unmodifiableList(normalize(headers));
        this.contentDigest = contentDigest;
    }

    public static SignatureComponents of(boolean method, boolean targetUri, List<String> headers, boolean contentDigest) {
        return new SignatureComponents(method, targetUri, headers, contentDigest);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the selection implied by a wire covered-component list. Unknown pseudo-components are not representable
     * here and are ignored; reconstruction works from the list directly.
     */
    public static SignatureComponents fromCovered(List<String> covered) {
        Objects.requireNonNull(covered, "covered");
        List<String> headerNames = new ArrayList<>();
        for (String component : covered) {
            if (!component.startsWith("@") && !CONTENT_DIGEST.equalsIgnoreCase(component)) {
                headerNames.add(component);
            }
        }
        return new SignatureComponents(
            covered.contains(METHOD),
            covered.contains(TARGET_URI),
            headerNames,
            covered.stream().anyMatch(CONTENT_DIGEST::equalsIgnoreCase)
        );
    }

    public boolean method() {
        return method;
    }

    public boolean targetUri() {
        return targetUri;
    }

    public List<String> headers() {
        return headers;
    }

    public boolean contentDigest() {
        return contentDigest;
    }

    public boolean coversHeader(String name) {
        return name != null && headers.contains(name.trim().toLowerCase(Locale.ROOT));
    }

    public boolean isEmpty() {
        return !method && !targetUri && headers.isEmpty() && !contentDigest;
    }

    /**
     * @return every selected component name in canonical emission order.
     */
    public List<String> names() {
        List<String> names = new ArrayList<>();
        if (method) {
            names.add(METHOD);
        }
        if (targetUri) {
            names.add(TARGET_URI);
        }
        names.addAll(headers);
        if (contentDigest) {
            names.add(CONTENT_DIGEST);
        }
        return Collections.unmodifiableList(names);
    }

    public Builder toBuilder() {
        return new Builder()
            .method(method)
            .targetUri(targetUri)
            .headers(headers)
            .contentDigest(contentDigest);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SignatureComponents)) {
            return false;
        }
        SignatureComponents other = (SignatureComponents) o;
        return method == other.method
            && targetUri == other.targetUri
            && contentDigest == other.contentDigest
            && headers.equals(other.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, targetUri, headers, contentDigest);
    }

    @Override
    public String toString() {
        return "SignatureComponents" + names();
    }

    private static List<String> normalize(List<String> names) {
        List<String> out = new ArrayList<>();
        if (names == null) {
            return out;
        }
        for (String name : names) {
            if (name == null || name.isBlank()) {
                continue;
            }
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            if (!out.contains(normalized)) {
                out.add(normalized);
            }
        }
        return out;
    }

    public static final class Builder {
        private boolean method = true;
        private boolean targetUri = true;
        private final List<String> headers = new ArrayList<>();
        private boolean contentDigest;

        private Builder() {
        }

        public Builder method(boolean enabled) {
            this.method = enabled;
            return this;
        }

        public Builder targetUri(boolean enabled) {
            this.targetUri = enabled;
            return this;
        }

        public Builder headers(List<String> names) {
            headers.clear();
            if (names != null) {
                headers.addAll(names);
            }
            return this;
        }

        public Builder addHeader(String name) {
            headers.add(name);
            return this;
        }

        public Builder contentDigest(boolean enabled) {
            this.contentDigest = enabled;
            return this;
        }

        public SignatureComponents build() {
            return new SignatureComponents(method, targetUri, headers, contentDigest);
        }
    }
}
