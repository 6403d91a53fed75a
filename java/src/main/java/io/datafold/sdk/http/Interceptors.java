package io.datafold.sdk.http;

import io.datafold.sdk.signing.SignatureParamsGenerator;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ready-made interceptors for {@link SignedHttpClient}.
 */
public final class Interceptors {

    public static final String DEFAULT_CORRELATION_HEADER = "x-request-id";

    private static final Logger LOGGER = Logger.getLogger(Interceptors.class.getName());

    private Interceptors() {
    }

    public static RequestInterceptor correlationId() {
        return correlationId(DEFAULT_CORRELATION_HEADER, SignatureParamsGenerator::randomNonce);
    }

    /**
     * Adds a correlation id header unless the request already carries one and records it on the context. Register it
     * before signing-sensitive interceptors so the header can be covered by the signature.
     */
    public static RequestInterceptor correlationId(String headerName, Supplier<String> idGenerator) {
        String header = Objects.requireNonNull(headerName, "headerName").trim().toLowerCase(Locale.ROOT);
        Objects.requireNonNull(idGenerator, "idGenerator");
        return (request, context) -> {
            if (request.hasHeader(header)) {
                context.correlationId(request.header(header).orElse(null));
                return request;
            }
            String id = idGenerator.get();
            context.correlationId(id);
            return request.toBuilder().header(header, id).build();
        };
    }

    public static RequestInterceptor requestLogging(Level level) {
        Objects.requireNonNull(level, "level");
        return (request, context) -> {
            LOGGER.log(level, () -> "[datafold-sdk] HTTP request " + request.method() + " " + request.url()
                + context.correlationId().map(id -> " correlation_id=" + id).orElse(""));
            return request;
        };
    }

    public static ResponseInterceptor responseLogging(Level level) {
        Objects.requireNonNull(level, "level");
        return (response, context) -> {
            LOGGER.log(level, () -> String.format(Locale.ROOT, "[datafold-sdk] HTTP response %d for %s in %.2fms%s",
                response.statusCode(), context.endpoint(), context.elapsedMillis(),
                response.verification().map(v -> " verification=" + v.status().wireName()).orElse("")));
            return response;
        };
    }
}
