package io.datafold.sdk;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Immutable view of an HTTP message that can be signed or verified.
 * <p>
 * Header names are matched case-insensitively; when the same header is supplied more than once the last value wins.
 * Responses are modelled with the originating request's method and URL plus an optional status code.
 */
public final class SignableMessage {

    private final HttpMethod method;
    private final String url;
    private final Map<String, String> headers;
    private final byte[] body;
    private final boolean textBody;
    private final Integer status;

    private SignableMessage(Builder builder) {
        this.method = builder.method;
        this.url = builder.url;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body == null ? null : builder.body.clone();
        this.textBody = builder.textBody;
        this.status = builder.status;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(HttpMethod method, String url) {
        return new Builder().method(method).url(url);
    }

    public HttpMethod method() {
        return method;
    }

    public String url() {
        return url;
    }

    /**
     * @return headers keyed by lowercase name, in insertion order.
     */
    public Map<String, String> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(headers.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean hasHeader(String name) {
        return header(name).isPresent();
    }

    /**
     * @return a copy of the body bytes, empty when the message has no body.
     */
    public Optional<byte[]> body() {
        return body == null ? Optional.empty() : Optional.of(body.clone());
    }

    /**
     * @return a copy of the body bytes, or an empty array.
     */
    public byte[] bodyBytes() {
        return body == null ? new byte[0] : body.clone();
    }

    public boolean hasBody() {
        return body != null && body.length > 0;
    }

    public boolean isTextBody() {
        return textBody;
    }

    public Optional<String> bodyText() {
        return body == null ? Optional.empty() : Optional.of(new String(body, StandardCharsets.UTF_8));
    }

    public int bodySize() {
        return body == null ? 0 : body.length;
    }

    public OptionalInt status() {
        return status == null ? OptionalInt.empty() : OptionalInt.of(status);
    }

    /**
     * Returns a copy of this message with the given headers added (replacing same-named ones).
     */
    public SignableMessage withHeaders(Map<String, String> extra) {
        Builder builder = toBuilder();
        if (extra != null) {
            extra.forEach(builder::header);
        }
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
            .method(method)
            .url(url)
            .headers(headers);
        builder.body = body == null ? null : body.clone();
        builder.textBody = textBody;
        builder.status = status;
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SignableMessage)) {
            return false;
        }
        SignableMessage other = (SignableMessage) o;
        return method == other.method
            && url.equals(other.url)
            && headers.equals(other.headers)
            && Arrays.equals(body, other.body)
            && Objects.equals(status, other.status);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, url, headers, Arrays.hashCode(body), status);
    }

    @Override
    public String toString() {
        return "SignableMessage{" + method + " " + url + ", headers=" + headers.keySet() + ", bodySize=" + bodySize() + '}';
    }

    public static final class Builder {
        private HttpMethod method;
        private String url;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte[] body;
        private boolean textBody;
        private Integer status;

        private Builder() {
        }

        public Builder method(HttpMethod method) {
            this.method = method;
            return this;
        }

        public Builder method(String method) {
            this.method = HttpMethod.of(method);
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder header(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("header name must be non-empty");
            }
            String key = name.trim().toLowerCase(Locale.ROOT);
            headers.remove(key);
            headers.put(key, value == null ? "" : value);
            return this;
        }

        public Builder headers(Map<String, String> values) {
            if (values != null) {
                values.forEach(this::header);
            }
            return this;
        }

        public Builder body(String text) {
            this.body = text == null ? null : text.getBytes(StandardCharsets.UTF_8);
            this.textBody = text != null;
            return this;
        }

        public Builder body(byte[] bytes) {
            this.body = bytes == null ? null : bytes.clone();
            this.textBody = false;
            return this;
        }

        public Builder status(int status) {
            this.status = status;
            return this;
        }

        public SignableMessage build() {
            Objects.requireNonNull(method, "method");
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("url must be non-empty");
            }
            url = url.trim();
            return new SignableMessage(this);
        }
    }
}
