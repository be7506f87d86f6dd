package com.mimecast.oidc.config;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HttpIntegrationConfigTest {

    private static final Path CONFIG = Paths.get("src/test/resources/cfg/oidc-http.json5");
    private static final Path NO_RETRY_CONFIG = Paths.get("src/test/resources/cfg/oidc-http-noretry.json5");

    @Test
    void testLoad() throws IOException {
        HttpIntegrationConfig config = HttpIntegrationConfig.load(CONFIG);

        assertEquals("com.example.oidc", config.getClientNamePrefix());
        assertEquals(5, config.getResolutionTimeoutSeconds());

        HttpIntegrationConfig.RetryConfig retry = config.getRetry();
        assertTrue(retry.isEnabled());
        assertEquals(2, retry.getMaxRetries());
        assertEquals(0, retry.getBaseDelaySeconds());
    }

    @Test
    void testDefaults() throws IOException {
        HttpIntegrationConfig config = HttpIntegrationConfig.load(NO_RETRY_CONFIG);

        assertEquals(HttpIntegrationConfig.DEFAULT_CLIENT_NAME_PREFIX, config.getClientNamePrefix());
        assertEquals(30, config.getResolutionTimeoutSeconds());
        assertFalse(config.getRetry().isEnabled());
        assertEquals(4, config.getRetry().getMaxRetries());
        assertEquals(1, config.getRetry().getBaseDelaySeconds());
    }

    @Test
    void testEmptyMap() {
        HttpIntegrationConfig config = new HttpIntegrationConfig(null);

        assertEquals(HttpIntegrationConfig.DEFAULT_CLIENT_NAME_PREFIX, config.getClientNamePrefix());
        assertTrue(config.getRetry().isEnabled());
    }

    @Test
    void testDottedKeys() {
        Map<String, Object> retry = new HashMap<>();
        retry.put("maxRetries", 7.0);
        Map<String, Object> map = new HashMap<>();
        map.put("retry", retry);
        map.put("resolutionTimeoutSeconds", "12");

        BasicConfig config = new BasicConfig(map);

        assertTrue(config.hasProperty("retry.maxRetries"));
        assertFalse(config.hasProperty("retry.missing"));
        assertEquals(7L, config.getLongProperty("retry.maxRetries", 0L));
        assertEquals(12L, config.getLongProperty("resolutionTimeoutSeconds", 0L));
        assertEquals("fallback", config.getStringProperty("missing", "fallback"));
        assertTrue(config.getMapProperty("missing").isEmpty());
    }

    @Test
    void testLoadMissingFile() {
        assertThrows(IOException.class, () -> HttpIntegrationConfig.load(Paths.get("src/test/resources/cfg/missing.json5")));
    }
}
