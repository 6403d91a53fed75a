package io.datafold.sdk.signing;

import io.datafold.sdk.SignableMessage;
import io.datafold.sdk.internal.Hex;
import io.datafold.sdk.internal.Json;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded LRU cache of signing results with per-entry TTL.
 * <p>
 * Entries are keyed by a SHA-256 fingerprint of method, URL, sorted headers and body. Expired entries are purged lazily
 * on read or by {@link #cleanupExpired()}. All access goes through one lock.
 */
public final class SignatureCache {

    public static final int DEFAULT_CAPACITY = 1000;
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final int capacity;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, SignatureCacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);

    public SignatureCache() {
        this(DEFAULT_CAPACITY, DEFAULT_TTL, Clock.systemUTC());
    }

    public SignatureCache(int capacity, Duration defaultTtl) {
        this(capacity, defaultTtl, Clock.systemUTC());
    }

    public SignatureCache(int capacity, Duration defaultTtl, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        this.capacity = capacity;
        this.defaultTtl = defaultTtl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public int capacity() {
        return capacity;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    /**
     * @return the cached headers for {@code message}, or empty when absent or expired.
     */
    public Optional<Map<String, String>> get(SignableMessage message) {
        return getResult(message).map(SignatureResult::headers);
    }

    public Optional<SignatureResult> getResult(SignableMessage message) {
        String key = fingerprint(message);
        Instant now = clock.instant();
        lock.lock();
        try {
            SignatureCacheEntry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                return Optional.empty();
            }
            return Optional.of(entry.result());
        } finally {
            lock.unlock();
        }
    }

    public void put(SignableMessage message, SignatureResult result) {
        put(message, result, defaultTtl);
    }

    /**
     * Stores a result, evicting the least recently used entries once capacity is reached.
     */
    public void put(SignableMessage message, SignatureResult result, Duration ttl) {
        Objects.requireNonNull(result, "result");
        Duration effectiveTtl = ttl == null || ttl.isNegative() || ttl.isZero() ? defaultTtl : ttl;
        String key = fingerprint(message);
        SignatureCacheEntry entry = new SignatureCacheEntry(result, clock.instant(), effectiveTtl, key);

        lock.lock();
        try {
            entries.remove(key);
            Iterator<String> eldest = entries.keySet().iterator();
            while (entries.size() >= capacity && eldest.hasNext()) {
                eldest.next();
                eldest.remove();
            }
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of expired entries removed.
     */
    public int cleanupExpired() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int before = entries.size();
            entries.values().removeIf(entry -> entry.isExpired(now));
            return before - entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deterministic key for a message: SHA-256 over {@code METHOD|url|sorted-headers-json|body}.
     */
    public static String fingerprint(SignableMessage message) {
        Objects.requireNonNull(message, "message");
        String headersJson = Json.sortedObject(message.headers());
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 unavailable", ex);
        }
        String prefix = message.method().name() + "|" + message.url() + "|" + headersJson + "|";
        digest.update(prefix.getBytes(StandardCharsets.UTF_8));
        digest.update(message.bodyBytes());
        return Hex.encode(digest.digest());
    }
}
