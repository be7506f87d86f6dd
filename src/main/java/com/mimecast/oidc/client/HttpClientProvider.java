package com.mimecast.oidc.client;

import com.mimecast.oidc.http.factory.HttpClientFactory;
import com.mimecast.oidc.http.factory.ManagedHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.util.List;
import java.util.Objects;

/**
 * Entry point handing out HTTP clients per client registration.
 *
 * <p>Wires a {@link HttpClientFactory} with a {@link HttpClientConfiguration} and
 * <br>derives client names from the registration and authentication method.
 *
 * <p>Example usage:
 * <pre>
 * try (HttpClientProvider provider = new HttpClientProvider(options)) {
 *     ManagedHttpClient client = provider.getClient("reg-1", ClientAuthenticationMethod.TLS_CLIENT_AUTH);
 *     try (Response response = client.newCall(request).execute()) {
 *         ...
 *     }
 * }
 * </pre>
 */
public class HttpClientProvider implements Closeable {
    private static final Logger log = LogManager.getLogger(HttpClientProvider.class);

    private final HttpIntegrationOptions options;
    private final HttpClientFactory factory;

    /**
     * Constructs a new HttpClientProvider instance.
     *
     * @param options HttpIntegrationOptions instance.
     */
    public HttpClientProvider(HttpIntegrationOptions options) {
        this(options, new HttpClientFactory(List.of(new HttpClientConfiguration(options))));
    }

    /**
     * Constructs a new HttpClientProvider instance with a given factory.
     *
     * @param options HttpIntegrationOptions instance.
     * @param factory HttpClientFactory instance.
     */
    public HttpClientProvider(HttpIntegrationOptions options, HttpClientFactory factory) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.factory = Objects.requireNonNull(factory, "factory must not be null");
    }

    /**
     * Gets the client for a registration and authentication method.
     *
     * @param registrationId Registration identifier.
     * @param method         Client authentication method.
     * @return ManagedHttpClient instance.
     * @throws IllegalArgumentException If the method is not enabled.
     */
    public ManagedHttpClient getClient(String registrationId, ClientAuthenticationMethod method) {
        Objects.requireNonNull(method, "method must not be null");
        if (!options.getClientAuthenticationMethods().contains(method)) {
            throw new IllegalArgumentException("Client authentication method not enabled: " + method.getValue());
        }

        log.debug("Client requested for registration {} using {}", registrationId, method.getValue());
        return factory.getClient(ClientNames.forRegistration(options.getClientNamePrefix(), registrationId, method));
    }

    /**
     * Evicts the cached client for a registration and authentication method.
     * <p>The next lookup resolves the registration again, picking up rotated certificates.
     *
     * @param registrationId Registration identifier.
     * @param method         Client authentication method.
     * @return True if a client was evicted.
     */
    public boolean evict(String registrationId, ClientAuthenticationMethod method) {
        return factory.evict(ClientNames.forRegistration(options.getClientNamePrefix(), registrationId, method));
    }

    public HttpClientFactory getFactory() {
        return factory;
    }

    @Override
    public void close() {
        factory.close();
    }
}
