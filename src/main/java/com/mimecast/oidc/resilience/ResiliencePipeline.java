package com.mimecast.oidc.resilience;

import okhttp3.Interceptor;
import okhttp3.Response;

import java.io.IOException;

/**
 * Resilience pipeline wrapping the rest of the handler chain.
 *
 * <p>Implementations own the whole strategy (retries, hedging, circuit breaking) and may
 * <br>call {@link Interceptor.Chain#proceed} several times, closing discarded responses.
 */
@FunctionalInterface
public interface ResiliencePipeline {

    /**
     * Executes the request through the pipeline.
     *
     * @param chain Interceptor chain.
     * @return Response instance.
     * @throws IOException On failure after the pipeline gave up.
     */
    Response execute(Interceptor.Chain chain) throws IOException;
}
