package com.mimecast.oidc.http;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClientPropertiesTest {

    @Test
    void testGetBoolean() {
        ClientProperties properties = new ClientProperties(Map.of("a", "true", "b", "TRUE", "c", "yes"));

        assertTrue(properties.getBoolean("a"));
        assertTrue(properties.getBoolean("b"));
        assertFalse(properties.getBoolean("c"));
        assertFalse(properties.getBoolean("missing"));
    }

    @Test
    void testImmutableCopy() {
        Map<String, String> source = new HashMap<>();
        source.put("a", "1");
        ClientProperties properties = new ClientProperties(source);
        source.put("b", "2");

        assertEquals(1, properties.size());
        assertThrows(UnsupportedOperationException.class, () -> properties.asMap().put("c", "3"));
    }

    @Test
    void testEmpty() {
        assertTrue(ClientProperties.empty().isEmpty());
        assertEquals(ClientProperties.empty(), new ClientProperties(Map.of()));
    }
}
