package io.datafold.sdk.signing;

/**
 * Point-in-time counters collected by {@link CachingSigner}.
 */
public record SigningMetrics(
    long totalRequests,
    long signedRequests,
    long cacheHits,
    long cacheMisses,
    long failures,
    double averageSigningMillis,
    double maxSigningMillis
) {

    public double cacheHitRate() {
        long lookups = cacheHits + cacheMisses;
        return lookups == 0 ? 0.0d : (double) cacheHits / lookups;
    }
}
