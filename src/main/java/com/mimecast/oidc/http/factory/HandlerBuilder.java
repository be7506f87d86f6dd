package com.mimecast.oidc.http.factory;

import com.mimecast.oidc.http.HttpMessageHandler;
import okhttp3.Interceptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Handler chain under construction.
 *
 * <p>Holds the primary handler and the additional interceptors placed in front of it.
 */
public class HandlerBuilder {

    private final String name;
    private HttpMessageHandler primaryHandler;
    private final List<Interceptor> additionalHandlers = new ArrayList<>();

    /**
     * Constructs a new HandlerBuilder instance.
     *
     * @param name           Client name.
     * @param primaryHandler Initial primary handler.
     */
    public HandlerBuilder(String name, HttpMessageHandler primaryHandler) {
        this.name = name;
        this.primaryHandler = Objects.requireNonNull(primaryHandler, "primaryHandler must not be null");
    }

    public String getName() {
        return name;
    }

    public HttpMessageHandler getPrimaryHandler() {
        return primaryHandler;
    }

    public void setPrimaryHandler(HttpMessageHandler primaryHandler) {
        this.primaryHandler = Objects.requireNonNull(primaryHandler, "primaryHandler must not be null");
    }

    /**
     * Gets additional interceptors, outermost first.
     *
     * @return Mutable list.
     */
    public List<Interceptor> getAdditionalHandlers() {
        return additionalHandlers;
    }
}
