package com.mimecast.oidc.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * HTTP integration configuration.
 *
 * <p>This class provides type safe access to the file based settings of the HTTP integration.
 * <p>Example:
 * <pre>
 * {
 *   clientNamePrefix: "com.mimecast.oidc.http",
 *   resolutionTimeoutSeconds: 30,
 *   retry: {
 *     enabled: true,
 *     maxRetries: 4,
 *     baseDelaySeconds: 1
 *   }
 * }
 * </pre>
 */
public class HttpIntegrationConfig extends BasicConfig {

    /**
     * Default prefix of managed client names.
     */
    public static final String DEFAULT_CLIENT_NAME_PREFIX = "com.mimecast.oidc.http";

    /**
     * Constructs a new HttpIntegrationConfig instance.
     *
     * @param map Configuration map.
     */
    public HttpIntegrationConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Loads configuration from a JSON5 file.
     *
     * @param path File path.
     * @return HttpIntegrationConfig instance.
     * @throws IOException Unable to read file.
     */
    public static HttpIntegrationConfig load(Path path) throws IOException {
        return new HttpIntegrationConfig(readMap(path));
    }

    /**
     * Gets the prefix identifying client names managed by this integration.
     *
     * @return Prefix string.
     */
    public String getClientNamePrefix() {
        return getStringProperty("clientNamePrefix", DEFAULT_CLIENT_NAME_PREFIX);
    }

    /**
     * Gets the maximum time to wait for a registration lookup.
     *
     * @return Timeout in seconds.
     */
    public long getResolutionTimeoutSeconds() {
        return getLongProperty("resolutionTimeoutSeconds", 30L);
    }

    /**
     * Gets retry configuration.
     *
     * @return RetryConfig instance.
     */
    public RetryConfig getRetry() {
        return new RetryConfig(getMapProperty("retry"));
    }

    /**
     * Retry configuration.
     */
    public static class RetryConfig extends BasicConfig {

        /**
         * Constructs a new RetryConfig instance.
         *
         * @param map Configuration map.
         */
        public RetryConfig(Map<String, Object> map) {
            super(map);
        }

        /**
         * Is retry enabled.
         *
         * @return Boolean.
         */
        public boolean isEnabled() {
            return getBooleanProperty("enabled", true);
        }

        /**
         * Gets maximum number of retries after the first attempt.
         *
         * @return Retries count.
         */
        public int getMaxRetries() {
            return Math.toIntExact(getLongProperty("maxRetries", 4L));
        }

        /**
         * Gets base delay multiplied by 2^attempt.
         *
         * @return Delay in seconds.
         */
        public long getBaseDelaySeconds() {
            return getLongProperty("baseDelaySeconds", 1L);
        }
    }
}
