package io.datafold.sdk.signing;

import io.datafold.sdk.HttpMethod;
import io.datafold.sdk.SignableMessage;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignatureCacheTest {

    @Test
    void evictsLeastRecentlyUsed() {
        SignatureCache cache = new SignatureCache(2, Duration.ofMinutes(5));
        SignableMessage a = message("/a");
        SignableMessage b = message("/b");
        SignableMessage c = message("/c");

        cache.put(a, result("A"));
        cache.put(b, result("B"));
        assertTrue(cache.get(a).isPresent());
        cache.put(c, result("C"));

        assertEquals(2, cache.size());
        assertTrue(cache.get(a).isPresent());
        assertTrue(cache.get(b).isEmpty());
        assertEquals("C", cache.get(c).orElseThrow().get("signature"));
    }

    @Test
    void entriesExpireAfterTtl() {
        MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));
        SignatureCache cache = new SignatureCache(10, Duration.ofSeconds(30), clock);
        SignableMessage a = message("/a");
        cache.put(a, result("A"));

        clock.advance(Duration.ofSeconds(30));
        assertTrue(cache.get(a).isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get(a).isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void cleanupRemovesOnlyExpiredEntries() {
        MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));
        SignatureCache cache = new SignatureCache(10, Duration.ofSeconds(30), clock);
        cache.put(message("/short"), result("S"), Duration.ofSeconds(5));
        cache.put(message("/long"), result("L"));

        clock.advance(Duration.ofSeconds(10));

        assertEquals(1, cache.cleanupExpired());
        assertEquals(1, cache.size());
        assertTrue(cache.get(message("/long")).isPresent());
    }

    @Test
    void fingerprintIgnoresHeaderInsertionOrder() {
        SignableMessage first = SignableMessage.builder(HttpMethod.POST, "https://example.com/")
            .header("a", "1").header("b", "2").body("x").build();
        SignableMessage second = SignableMessage.builder(HttpMethod.POST, "https://example.com/")
            .header("B", "2").header("A", "1").body("x").build();
        SignableMessage differentBody = second.toBuilder().body("y").build();

        assertEquals(SignatureCache.fingerprint(first), SignatureCache.fingerprint(second));
        assertNotEquals(SignatureCache.fingerprint(first), SignatureCache.fingerprint(differentBody));
    }

    @Test
    void rejectsNonPositiveSettings() {
        assertThrows(IllegalArgumentException.class, () -> new SignatureCache(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> new SignatureCache(1, Duration.ZERO));
    }

    private static SignableMessage message(String path) {
        return SignableMessage.builder(HttpMethod.GET, "https://example.com" + path).build();
    }

    private static SignatureResult result(String signature) {
        CanonicalMessage canonical = new CanonicalMessage(List.of(), List.of(), "()");
        return new SignatureResult("sig1=()", signature, Map.of("signature", signature), canonical);
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
