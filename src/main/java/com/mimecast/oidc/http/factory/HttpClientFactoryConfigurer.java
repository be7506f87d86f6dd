package com.mimecast.oidc.http.factory;

/**
 * Hook into named client construction.
 *
 * <p>For every client built, all configurers are called with {@link #configure} first,
 * <br>then all are called with {@link #postConfigure}.
 * <br>Both run on the building thread, once per build of a given name.
 */
public interface HttpClientFactoryConfigurer {

    /**
     * Contributes actions before the client is built.
     *
     * @param name    Client name.
     * @param options HttpClientFactoryOptions instance.
     */
    void configure(String name, HttpClientFactoryOptions options);

    /**
     * Contributes actions after every configurer ran {@link #configure}.
     *
     * @param name    Client name.
     * @param options HttpClientFactoryOptions instance.
     */
    default void postConfigure(String name, HttpClientFactoryOptions options) {
        // Nothing by default.
    }
}
