package com.mimecast.oidc.resilience;

import okhttp3.Interceptor;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.Objects;

/**
 * Runs the rest of the chain through a {@link ResiliencePipeline}.
 */
public class ResilienceInterceptor implements Interceptor {

    private final ResiliencePipeline pipeline;

    /**
     * Constructs a new ResilienceInterceptor instance.
     *
     * @param pipeline ResiliencePipeline instance.
     */
    public ResilienceInterceptor(ResiliencePipeline pipeline) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    public ResiliencePipeline getPipeline() {
        return pipeline;
    }

    @NotNull
    @Override
    public Response intercept(@NotNull Chain chain) throws IOException {
        return pipeline.execute(chain);
    }
}
