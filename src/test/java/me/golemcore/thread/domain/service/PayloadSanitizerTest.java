package me.golemcore.thread.domain.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PayloadSanitizerTest {

    @Test
    void shouldRedactCredentialLikeKeysAtAnyDepth() {
        Map<String, Object> payload = Map.of(
                "headers", Map.of("Authorization", "Bearer abc", "accept", "json"),
                "api_key", "sk-1",
                "apiKey", "sk-2",
                "sessionToken", "t",
                "name", "visible");

        @SuppressWarnings("unchecked")
        Map<String, Object> sanitized = (Map<String, Object>) PayloadSanitizer.sanitize(payload);

        assertEquals(PayloadSanitizer.REDACTED, sanitized.get("api_key"));
        assertEquals(PayloadSanitizer.REDACTED, sanitized.get("apiKey"));
        assertEquals(PayloadSanitizer.REDACTED, sanitized.get("sessionToken"));
        assertEquals("visible", sanitized.get("name"));
        @SuppressWarnings("unchecked")
        Map<String, Object> headers = (Map<String, Object>) sanitized.get("headers");
        assertEquals(PayloadSanitizer.REDACTED, headers.get("Authorization"));
        assertEquals("json", headers.get("accept"));
    }

    @Test
    void shouldReplaceOversizedStrings() {
        String big = "x".repeat(11);

        assertEquals(PayloadSanitizer.TRUNCATED, PayloadSanitizer.sanitize(big, 10));
        assertEquals("short", PayloadSanitizer.sanitize("short", 10));
    }

    @Test
    void shouldBreakCycles() {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("id", 1);
        node.put("self", node);
        List<Object> list = new ArrayList<>();
        list.add(list);

        @SuppressWarnings("unchecked")
        Map<String, Object> sanitized = (Map<String, Object>) PayloadSanitizer.sanitize(node);

        assertEquals(1, sanitized.get("id"));
        assertEquals(PayloadSanitizer.CIRCULAR, sanitized.get("self"));
        assertEquals(List.of(PayloadSanitizer.CIRCULAR), PayloadSanitizer.sanitize(list));
    }

    @Test
    void shouldKeepSharedButAcyclicReferences() {
        Map<String, Object> shared = Map.of("v", 1);
        Map<String, Object> payload = Map.of("a", shared, "b", shared);

        @SuppressWarnings("unchecked")
        Map<String, Object> sanitized = (Map<String, Object>) PayloadSanitizer.sanitize(payload);

        assertEquals(Map.of("v", 1), sanitized.get("a"));
        assertEquals(Map.of("v", 1), sanitized.get("b"));
    }

    @Test
    void shouldStringifyUnknownObjectsAndArrays() {
        Object[] array = { "a", null, 2 };

        assertEquals(Arrays.asList("a", null, 2), PayloadSanitizer.sanitize(array));
        assertEquals("PT1S", PayloadSanitizer.sanitize(Duration.ofSeconds(1)));
    }

    @Test
    void shouldDetectSecretKeys() {
        assertTrue(PayloadSanitizer.isSecretKey("X-Api-Key"));
        assertTrue(PayloadSanitizer.isSecretKey("cookie"));
        assertTrue(PayloadSanitizer.isSecretKey("PASSWORD"));
        assertFalse(PayloadSanitizer.isSecretKey("toolName"));
        assertFalse(PayloadSanitizer.isSecretKey(null));
    }
}
