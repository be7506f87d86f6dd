package com.mimecast.oidc.http;

import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.Objects;

/**
 * Client level settings of a managed client.
 *
 * <p>Initial values mirror a permissive platform default: a 2 GiB response cap and a 100 second timeout.
 * <br>Client actions adjust them before the client is assembled.
 */
public class HttpClientOptions {

    /**
     * Platform default response cap.
     */
    public static final long DEFAULT_MAX_RESPONSE_CONTENT_BUFFER_SIZE = Integer.MAX_VALUE;

    /**
     * Platform default timeout.
     */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(100);

    private long maxResponseContentBufferSize = DEFAULT_MAX_RESPONSE_CONTENT_BUFFER_SIZE;
    private Duration timeout = DEFAULT_TIMEOUT;

    public long getMaxResponseContentBufferSize() {
        return maxResponseContentBufferSize;
    }

    /**
     * Sets the maximum number of response body bytes that may be read.
     *
     * @param maxResponseContentBufferSize Size in bytes, must be positive.
     * @return Self.
     */
    public HttpClientOptions setMaxResponseContentBufferSize(long maxResponseContentBufferSize) {
        if (maxResponseContentBufferSize <= 0) {
            throw new IllegalArgumentException("maxResponseContentBufferSize must be positive");
        }
        this.maxResponseContentBufferSize = maxResponseContentBufferSize;
        return this;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Sets the complete call timeout.
     *
     * @param timeout Duration, zero means no timeout.
     * @return Self.
     */
    public HttpClientOptions setTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * Applies the settings to the client being assembled.
     *
     * @param builder OkHttpClient.Builder instance.
     */
    public void configure(OkHttpClient.Builder builder) {
        builder.callTimeout(timeout);
        builder.addInterceptor(new ResponseSizeLimitInterceptor(maxResponseContentBufferSize));
    }

    @Override
    public String toString() {
        return "HttpClientOptions{maxResponseContentBufferSize=" + maxResponseContentBufferSize +
                ", timeout=" + timeout +
                "}";
    }
}
