package com.mimecast.oidc.resilience;

import okhttp3.Response;

import java.io.IOException;
import java.time.Duration;

/**
 * Retry policy for failed HTTP requests.
 *
 * <p>The policy only decides; {@link PolicyInterceptor} replays the request.
 */
public interface HttpErrorPolicy {

    /**
     * Gets maximum number of retries after the first attempt.
     *
     * @return Retries count.
     */
    int getMaxRetries();

    /**
     * Decides if an outcome should be retried.
     *
     * @param response Response, null when the attempt failed with an exception.
     * @param error    Exception, null when a response was received.
     * @return Boolean.
     */
    boolean shouldRetry(Response response, IOException error);

    /**
     * Gets wait time before a retry.
     *
     * @param attempt Retry number, starting at 1.
     * @return Duration.
     */
    Duration getDelay(int attempt);
}
