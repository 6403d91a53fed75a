package io.datafold.sdk.verification;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Bounded in-process {@link ReplayGuard}. A nonce is kept until its {@code created} time falls outside the retention
 * window. When the guard is full of nonces that are still inside the window, new nonces are refused rather than
 * forgetting one that could still be replayed.
 * <p>
 * Does not protect against replay across instances or process restarts.
 */
public final class InMemoryReplayGuard implements ReplayGuard {

    public static final int DEFAULT_CAPACITY = 10_000;

    /**
     * Longest built-in policy age (lenient, one hour) plus the future clock skew allowance.
     */
    public static final Duration DEFAULT_RETENTION =
        Duration.ofSeconds(3600 + VerificationRules.CLOCK_SKEW_SECONDS);

    private static final Logger LOGGER = Logger.getLogger(InMemoryReplayGuard.class.getName());

    private final int capacity;
    private final long retentionSeconds;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, Long> seen = new LinkedHashMap<>();

    public InMemoryReplayGuard() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryReplayGuard(int capacity) {
        this(capacity, DEFAULT_RETENTION, Clock.systemUTC());
    }

    /**
     * @param retention how long after its {@code created} time a nonce must be remembered; should cover the largest
     *                  {@code maxTimestampAge} of the policies using this guard plus the clock skew allowance
     */
    public InMemoryReplayGuard(int capacity, Duration retention, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        Objects.requireNonNull(retention, "retention");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        this.capacity = capacity;
        this.retentionSeconds = retention.getSeconds();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return {@code false} if the nonce was already recorded, or if the guard is full of unexpired nonces
     */
    @Override
    public boolean register(String nonce, long created) {
        Objects.requireNonNull(nonce, "nonce");
        lock.lock();
        try {
            if (seen.containsKey(nonce)) {
                return false;
            }
            if (seen.size() >= capacity) {
                purgeExpired();
            }
            if (seen.size() >= capacity) {
                LOGGER.warning(() -> "[datafold-sdk] replay guard holds " + capacity
                    + " unexpired nonces; refusing nonce until older entries expire");
                return false;
            }
            seen.put(nonce, created);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(String nonce) {
        lock.lock();
        try {
            return seen.containsKey(nonce);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            seen.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops nonces whose {@code created} time is outside the retention window.
     *
     * @return the number of nonces dropped
     */
    public int cleanupExpired() {
        lock.lock();
        try {
            return purgeExpired();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return seen.size();
        } finally {
            lock.unlock();
        }
    }

    private int purgeExpired() {
        long cutoff = clock.instant().getEpochSecond() - retentionSeconds;
        int before = seen.size();
        seen.values().removeIf(created -> created < cutoff);
        return before - seen.size();
    }
}
