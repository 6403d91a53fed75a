package io.datafold.sdk.signing;

import io.datafold.sdk.SignableMessage;
import io.datafold.sdk.internal.Stopwatch;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.logging.Logger;

/**
 * {@link Signer} decorator that reuses recent signatures for identical messages.
 * <p>
 * Calls that override any signing option bypass the cache, since their output is not interchangeable with the
 * default one.
 */
public final class CachingSigner implements Signer {

    private static final Logger LOGGER = Logger.getLogger(CachingSigner.class.getName());

    private final Signer delegate;
    private final SignatureCache cache;
    private final Duration ttl;

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong signedRequests = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final DoubleAdder signingMillis = new DoubleAdder();
    private final Object maxLock = new Object();
    private double maxSigningMillis;

    public CachingSigner(Signer delegate, SignatureCache cache) {
        this(delegate, cache, null);
    }

    public CachingSigner(Signer delegate, SignatureCache cache, Duration ttl) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.ttl = ttl == null ? cache.defaultTtl() : ttl;
    }

    public SignatureCache cache() {
        return cache;
    }

    @Override
    public SignatureResult sign(SignableMessage message, SigningOptions options) throws SigningException {
        totalRequests.incrementAndGet();
        boolean cacheable = options == null || options == SigningOptions.none()
            || (!options.pinsParameters() && options.components().isEmpty() && options.digestAlgorithm().isEmpty());

        if (cacheable) {
            Optional<SignatureResult> cached = cache.getResult(message);
            if (cached.isPresent()) {
                cacheHits.incrementAndGet();
                LOGGER.fine(() -> "[datafold-sdk] signature cache hit for " + message.method() + " " + message.url());
                return cached.get();
            }
            cacheMisses.incrementAndGet();
        }

        Stopwatch stopwatch = Stopwatch.start();
        SignatureResult result;
        try {
            result = delegate.sign(message, options);
        } catch (SigningException ex) {
            failures.incrementAndGet();
            throw ex;
        }
        recordTiming(stopwatch.elapsedMillis());

        if (cacheable) {
            cache.put(message, result, ttl);
        }
        return result;
    }

    public SigningMetrics metrics() {
        long signed = signedRequests.get();
        double max;
        synchronized (maxLock) {
            max = maxSigningMillis;
        }
        return new SigningMetrics(
            totalRequests.get(),
            signed,
            cacheHits.get(),
            cacheMisses.get(),
            failures.get(),
            signed == 0 ? 0.0d : signingMillis.sum() / signed,
            max
        );
    }

    public void resetMetrics() {
        totalRequests.set(0);
        signedRequests.set(0);
        cacheHits.set(0);
        cacheMisses.set(0);
        failures.set(0);
        signingMillis.reset();
        synchronized (maxLock) {
            maxSigningMillis = 0.0d;
        }
    }

    private void recordTiming(double millis) {
        signedRequests.incrementAndGet();
        signingMillis.add(millis);
        synchronized (maxLock) {
            if (millis > maxSigningMillis) {
                maxSigningMillis = millis;
            }
        }
    }
}
