package com.mimecast.oidc.http.factory;

import com.mimecast.oidc.http.HttpClientOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Per-name build actions collected from configurers.
 *
 * <p>Actions run in list order. Handler builder actions run before client actions.
 */
public class HttpClientFactoryOptions {

    private final List<Consumer<HttpClientOptions>> httpClientActions = new ArrayList<>();
    private final List<Consumer<HandlerBuilder>> handlerBuilderActions = new ArrayList<>();

    /**
     * Gets client level actions.
     *
     * @return Mutable list.
     */
    public List<Consumer<HttpClientOptions>> getHttpClientActions() {
        return httpClientActions;
    }

    /**
     * Gets handler chain actions.
     *
     * @return Mutable list.
     */
    public List<Consumer<HandlerBuilder>> getHandlerBuilderActions() {
        return handlerBuilderActions;
    }
}
