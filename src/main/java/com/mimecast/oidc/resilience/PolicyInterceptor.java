package com.mimecast.oidc.resilience;

import okhttp3.Call;
import okhttp3.Interceptor;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Replays requests according to an {@link HttpErrorPolicy}.
 *
 * <p>Stops as soon as the call is cancelled, which is how OkHttp enforces the call timeout.
 */
public class PolicyInterceptor implements Interceptor {
    private static final Logger log = LogManager.getLogger(PolicyInterceptor.class);

    private static final long CANCEL_POLL_MILLIS = 50L;

    private final HttpErrorPolicy policy;

    /**
     * Constructs a new PolicyInterceptor instance.
     *
     * @param policy HttpErrorPolicy instance.
     */
    public PolicyInterceptor(HttpErrorPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public HttpErrorPolicy getPolicy() {
        return policy;
    }

    @NotNull
    @Override
    public Response intercept(@NotNull Chain chain) throws IOException {
        Call call = chain.call();
        int attempt = 0;
        while (true) {
            Response response = null;
            IOException error = null;
            try {
                response = chain.proceed(chain.request());
            } catch (IOException e) {
                error = e;
            }

            // A timed out or cancelled call is final.
            if (call.isCanceled() || attempt >= policy.getMaxRetries() || !policy.shouldRetry(response, error)) {
                if (error != null) {
                    throw error;
                }
                return response;
            }

            attempt++;
            if (response != null) {
                response.close();
            }

            Duration delay = policy.getDelay(attempt);
            log.debug("Retrying {} {} after {}, retry {} of {}",
                    chain.request().method(), chain.request().url().redact(),
                    error != null ? error.getMessage() : "HTTP " + response.code(),
                    attempt, policy.getMaxRetries());
            await(call, delay);

            if (call.isCanceled()) {
                throw new IOException("Canceled while waiting to retry", error);
            }
        }
    }

    /**
     * Waits before a retry, returning early once the call is cancelled.
     *
     * @param call  Call instance.
     * @param delay Wait time.
     * @throws InterruptedIOException If the thread is interrupted.
     */
    private static void await(Call call, Duration delay) throws InterruptedIOException {
        long deadline = System.nanoTime() + delay.toNanos();
        try {
            long remaining;
            while ((remaining = deadline - System.nanoTime()) > 0 && !call.isCanceled()) {
                Thread.sleep(Math.max(1L, Math.min(TimeUnit.NANOSECONDS.toMillis(remaining), CANCEL_POLL_MILLIS)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry");
        }
    }
}
