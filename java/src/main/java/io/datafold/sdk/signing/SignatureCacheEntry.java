package io.datafold.sdk.signing;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A cached signing result. Usable only while {@code now <= createdAt + ttl}.
 *
 * @param result      the cached signing output
 * @param createdAt   insertion time
 * @param ttl         lifetime of the entry
 * @param fingerprint hash of the message the entry was produced for
 */
public record SignatureCacheEntry(SignatureResult result, Instant createdAt, Duration ttl, String fingerprint) {

    public SignatureCacheEntry {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(fingerprint, "fingerprint");
    }

    public Map<String, String> headers() {
        return result.headers();
    }

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt());
    }
}
