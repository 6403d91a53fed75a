package io.datafold.sdk.signing;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.LongSupplier;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Produces and validates signature parameters.
 */
public final class SignatureParamsGenerator {

    /** 2000-01-01T00:00:00Z. */
    public static final long MIN_TIMESTAMP = 946_684_800L;
    /** 2100-01-01T00:00:00Z. */
    public static final long MAX_TIMESTAMP = 4_102_444_800L;

    private static final Pattern UUID_V4 = Pattern.compile(
        "^[0-9a-f]{8}-[0-9a-f]{4}-4[0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$",
        Pattern.CASE_INSENSITIVE
    );

    private final Supplier<String> nonceSupplier;
    private final LongSupplier timestampSupplier;

    public SignatureParamsGenerator(Supplier<String> nonceSupplier, LongSupplier timestampSupplier) {
        this.nonceSupplier = Objects.requireNonNull(nonceSupplier, "nonceSupplier");
        this.timestampSupplier = Objects.requireNonNull(timestampSupplier, "timestampSupplier");
    }

    public static SignatureParamsGenerator defaults() {
        return withClock(Clock.systemUTC());
    }

    public static SignatureParamsGenerator withClock(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return new SignatureParamsGenerator(SignatureParamsGenerator::randomNonce, () -> clock.instant().getEpochSecond());
    }

    public static String randomNonce() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValidNonce(String nonce) {
        return nonce != null && UUID_V4.matcher(nonce).matches();
    }

    public static boolean isValidTimestamp(long timestamp) {
        return timestamp >= MIN_TIMESTAMP && timestamp <= MAX_TIMESTAMP;
    }

    /**
     * Creates parameters, preferring explicit overrides over generated values.
     *
     * @param nonceOverride     fixed nonce, or {@code null} to generate
     * @param timestampOverride fixed timestamp, or {@code null} to generate
     * @throws SigningException if the resulting nonce or timestamp is malformed
     */
    public SignatureParams generate(String keyId, SignatureAlgorithm algorithm, String nonceOverride, Long timestampOverride)
        throws SigningException {

        if (keyId == null || keyId.isBlank()) {
            throw new SigningException(SigningErrorCode.INVALID_KEY_ID, "key id must be non-empty");
        }
        String nonce = nonceOverride != null ? nonceOverride : nonceSupplier.get();
        long created = timestampOverride != null ? timestampOverride : timestampSupplier.getAsLong();

        if (!isValidNonce(nonce)) {
            throw new SigningException(
                SigningErrorCode.INVALID_NONCE,
                "Invalid nonce format: " + nonce,
                Map.of("nonce", String.valueOf(nonce))
            );
        }
        if (!isValidTimestamp(created)) {
            throw new SigningException(
                SigningErrorCode.INVALID_TIMESTAMP,
                "Invalid timestamp: " + created,
                Map.of("timestamp", created)
            );
        }
        return SignatureParams.of(created, keyId, algorithm, nonce);
    }
}
