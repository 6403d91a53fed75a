package io.datafold.sdk;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignableMessageTest {

    @Test
    void headersAreLowercasedAndReplaced() {
        SignableMessage message = SignableMessage.builder(HttpMethod.GET, " https://api.example.com/a ")
            .header("Content-Type", "text/plain")
            .header("X-Trace", "1")
            .header("content-type", "application/json")
            .build();

        assertEquals("https://api.example.com/a", message.url());
        assertEquals(List.of("x-trace", "content-type"), List.copyOf(message.headers().keySet()));
        assertEquals("application/json", message.header("CONTENT-TYPE").orElseThrow());
        assertTrue(message.hasHeader("x-trace"));
        assertFalse(message.header(null).isPresent());
        assertThrows(UnsupportedOperationException.class, () -> message.headers().put("a", "b"));
    }

    @Test
    void bodyIsCopiedAndTracksText() {
        byte[] raw = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
        SignableMessage binary = SignableMessage.builder(HttpMethod.POST, "https://api.example.com").body(raw).build();
        raw[0] = 'x';

        assertEquals("{\"a\":1}", binary.bodyText().orElseThrow());
        assertFalse(binary.isTextBody());
        assertEquals(7, binary.bodySize());

        SignableMessage text = SignableMessage.builder(HttpMethod.POST, "https://api.example.com").body("héllo").build();
        assertTrue(text.isTextBody());
        assertEquals(6, text.bodySize());

        SignableMessage empty = SignableMessage.builder(HttpMethod.GET, "https://api.example.com").body("").build();
        assertFalse(empty.hasBody());
        assertTrue(empty.body().isPresent());
        assertEquals(0, SignableMessage.builder(HttpMethod.GET, "https://api.example.com").build().bodyBytes().length);
    }

    @Test
    void withHeadersLeavesOriginalUntouched() {
        SignableMessage original = SignableMessage.builder(HttpMethod.PUT, "https://api.example.com")
            .header("a", "1")
            .status(201)
            .build();

        SignableMessage extended = original.withHeaders(Map.of("B", "2", "a", "3"));

        assertEquals(Map.of("a", "1"), original.headers());
        assertEquals("3", extended.header("a").orElseThrow());
        assertEquals("2", extended.header("b").orElseThrow());
        assertEquals(201, extended.status().getAsInt());
        assertEquals(original, original.toBuilder().build());
        assertNotEquals(original, extended);
    }

    @Test
    void rejectsIncompleteMessages() {
        assertThrows(NullPointerException.class, () -> SignableMessage.builder().url("https://x").build());
        assertThrows(IllegalArgumentException.class, () -> SignableMessage.builder(HttpMethod.GET, " ").build());
        assertThrows(IllegalArgumentException.class,
            () -> SignableMessage.builder(HttpMethod.GET, "https://x").header(" ", "v"));
        assertEquals(HttpMethod.PATCH, HttpMethod.of(" patch "));
        assertThrows(IllegalArgumentException.class, () -> HttpMethod.of("BREW"));
    }
}
