package com.mimecast.oidc.resilience;

import com.mimecast.oidc.config.HttpIntegrationConfig;
import com.mimecast.oidc.http.ResponseTooLargeException;
import okhttp3.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * Default retry policy for transient HTTP errors.
 * <p>Retries network failures, server errors (5xx), request timeouts (408) and throttling (429).
 * <br>Cancelled calls, including those hitting the call timeout, are not retried.
 * <p>The wait time before each retry grows exponentially:
 * <pre>
 *     wait_time = BASE_DELAY * (2 ^ retry_count)
 * </pre>
 * <p>Defaults:
 * <ul>
 *     <li>Total retries: 4</li>
 *     <li>Base delay: 1 second</li>
 *     <li>Wait times: 2, 4, 8 and 16 seconds (30 seconds cumulative)</li>
 * </ul>
 */
public class TransientErrorRetryPolicy implements HttpErrorPolicy {

    private static final int DEFAULT_MAX_RETRIES = 4;
    private static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

    /**
     * Upper bound of retries, also the largest backoff exponent.
     */
    public static final int MAX_RETRIES = 16;

    /**
     * Upper bound of the base delay.
     */
    public static final Duration MAX_BASE_DELAY = Duration.ofHours(1);

    private final int maxRetries;
    private final Duration baseDelay;

    /**
     * Constructs a new TransientErrorRetryPolicy with defaults.
     */
    public TransientErrorRetryPolicy() {
        this(DEFAULT_MAX_RETRIES, DEFAULT_BASE_DELAY);
    }

    /**
     * Constructs a new TransientErrorRetryPolicy.
     *
     * @param maxRetries Retries after the first attempt, 0 to {@link #MAX_RETRIES}.
     * @param baseDelay  Base delay, 0 to {@link #MAX_BASE_DELAY}.
     * @throws IllegalArgumentException If a value is out of range.
     */
    public TransientErrorRetryPolicy(int maxRetries, Duration baseDelay) {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES) {
            throw new IllegalArgumentException("maxRetries must be between 0 and " + MAX_RETRIES + ": " + maxRetries);
        }
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        if (baseDelay.isNegative() || baseDelay.compareTo(MAX_BASE_DELAY) > 0) {
            throw new IllegalArgumentException("baseDelay must be between 0 and " + MAX_BASE_DELAY + ": " + baseDelay);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
    }

    /**
     * Creates a policy from retry configuration.
     *
     * @param config RetryConfig instance.
     * @return TransientErrorRetryPolicy instance.
     */
    public static TransientErrorRetryPolicy fromConfig(HttpIntegrationConfig.RetryConfig config) {
        return new TransientErrorRetryPolicy(config.getMaxRetries(), Duration.ofSeconds(config.getBaseDelaySeconds()));
    }

    @Override
    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public boolean shouldRetry(Response response, IOException error) {
        if (error != null) {
            // Call timeouts and cancellations are final, socket timeouts are not.
            if (error instanceof InterruptedIOException && !(error instanceof SocketTimeoutException)) {
                return false;
            }
            return !(error instanceof ResponseTooLargeException);
        }
        int code = response.code();
        return code >= 500 || code == 408 || code == 429;
    }

    @Override
    public Duration getDelay(int attempt) {
        return baseDelay.multipliedBy(1L << Math.max(0, Math.min(attempt, MAX_RETRIES)));
    }
}
