package com.mimecast.oidc.client;

import com.mimecast.oidc.config.HttpIntegrationConfig;
import com.mimecast.oidc.http.ClientCertificateHandler;
import com.mimecast.oidc.http.HttpClientOptions;
import com.mimecast.oidc.registration.ClientRegistration;
import com.mimecast.oidc.registration.RegistrationResolver;
import com.mimecast.oidc.resilience.HttpErrorPolicy;
import com.mimecast.oidc.resilience.ResiliencePipeline;
import com.mimecast.oidc.resilience.TransientErrorRetryPolicy;
import com.mimecast.oidc.trust.ClientCertificateSelector;
import com.mimecast.oidc.trust.ClientCertificateSelectors;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

/**
 * Immutable settings of the HTTP integration.
 *
 * <p>Passed explicitly to {@link HttpClientConfiguration}. Defaults are resolved once in {@link Builder#build()}:
 * <ul>
 *   <li>Certificate selectors fall back to {@link ClientCertificateSelectors}.</li>
 *   <li>Without a policy or pipeline, a {@link TransientErrorRetryPolicy} is used unless resilience is disabled.</li>
 *   <li>Registration lookups run on a dedicated daemon pool, never on the thread building the client.</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 * HttpIntegrationOptions options = new HttpIntegrationOptions.Builder()
 *     .withRegistrationResolver(resolver)
 *     .addHttpClientAction((registration, client) -> client.setTimeout(Duration.ofMinutes(2)))
 *     .build();
 * </pre>
 */
public class HttpIntegrationOptions {

    private static final ExecutorService DEFAULT_RESOLUTION_EXECUTOR = Executors.newCachedThreadPool(new ResolverThreadFactory());

    private final String clientNamePrefix;
    private final RegistrationResolver registrationResolver;
    private final Executor resolutionExecutor;
    private final Duration resolutionTimeout;
    private final ClientCertificateSelector selfSignedTlsClientAuthenticationCertificateSelector;
    private final ClientCertificateSelector tlsClientAuthenticationCertificateSelector;
    private final List<BiConsumer<ClientRegistration, HttpClientOptions>> httpClientActions;
    private final List<BiConsumer<ClientRegistration, ClientCertificateHandler>> httpClientHandlerActions;
    private final HttpErrorPolicy httpErrorPolicy;
    private final ResiliencePipeline resiliencePipeline;
    private final Set<ClientAuthenticationMethod> clientAuthenticationMethods;

    private HttpIntegrationOptions(Builder builder) {
        this.clientNamePrefix = builder.clientNamePrefix;
        this.registrationResolver = builder.registrationResolver;
        this.resolutionExecutor = builder.resolutionExecutor != null ? builder.resolutionExecutor : DEFAULT_RESOLUTION_EXECUTOR;
        this.resolutionTimeout = builder.resolutionTimeout;
        this.selfSignedTlsClientAuthenticationCertificateSelector = builder.selfSignedSelector != null ?
                builder.selfSignedSelector : ClientCertificateSelectors.selfSigned();
        this.tlsClientAuthenticationCertificateSelector = builder.tlsSelector != null ?
                builder.tlsSelector : ClientCertificateSelectors.standard();
        this.httpClientActions = List.copyOf(builder.httpClientActions);
        this.httpClientHandlerActions = List.copyOf(builder.httpClientHandlerActions);
        this.resiliencePipeline = builder.resiliencePipeline;
        if (builder.httpErrorPolicy == null && builder.resiliencePipeline == null && builder.resilienceEnabled) {
            this.httpErrorPolicy = new TransientErrorRetryPolicy();
        } else {
            this.httpErrorPolicy = builder.httpErrorPolicy;
        }
        this.clientAuthenticationMethods = Collections.unmodifiableSet(EnumSet.copyOf(builder.clientAuthenticationMethods));
    }

    public String getClientNamePrefix() {
        return clientNamePrefix;
    }

    public RegistrationResolver getRegistrationResolver() {
        return registrationResolver;
    }

    public Executor getResolutionExecutor() {
        return resolutionExecutor;
    }

    public Duration getResolutionTimeout() {
        return resolutionTimeout;
    }

    public ClientCertificateSelector getSelfSignedTlsClientAuthenticationCertificateSelector() {
        return selfSignedTlsClientAuthenticationCertificateSelector;
    }

    public ClientCertificateSelector getTlsClientAuthenticationCertificateSelector() {
        return tlsClientAuthenticationCertificateSelector;
    }

    /**
     * Gets user client actions, in registration order.
     *
     * @return Unmodifiable list.
     */
    public List<BiConsumer<ClientRegistration, HttpClientOptions>> getHttpClientActions() {
        return httpClientActions;
    }

    /**
     * Gets user handler actions, in registration order.
     *
     * @return Unmodifiable list.
     */
    public List<BiConsumer<ClientRegistration, ClientCertificateHandler>> getHttpClientHandlerActions() {
        return httpClientHandlerActions;
    }

    public Optional<HttpErrorPolicy> getHttpErrorPolicy() {
        return Optional.ofNullable(httpErrorPolicy);
    }

    public Optional<ResiliencePipeline> getResiliencePipeline() {
        return Optional.ofNullable(resiliencePipeline);
    }

    public Set<ClientAuthenticationMethod> getClientAuthenticationMethods() {
        return clientAuthenticationMethods;
    }

    /**
     * Builder for HttpIntegrationOptions.
     */
    public static class Builder {
        private String clientNamePrefix = HttpIntegrationConfig.DEFAULT_CLIENT_NAME_PREFIX;
        private RegistrationResolver registrationResolver;
        private Executor resolutionExecutor;
        private Duration resolutionTimeout = Duration.ofSeconds(30);
        private ClientCertificateSelector selfSignedSelector;
        private ClientCertificateSelector tlsSelector;
        private final List<BiConsumer<ClientRegistration, HttpClientOptions>> httpClientActions = new ArrayList<>();
        private final List<BiConsumer<ClientRegistration, ClientCertificateHandler>> httpClientHandlerActions = new ArrayList<>();
        private HttpErrorPolicy httpErrorPolicy;
        private ResiliencePipeline resiliencePipeline;
        private boolean resilienceEnabled = true;
        private Set<ClientAuthenticationMethod> clientAuthenticationMethods = EnumSet.allOf(ClientAuthenticationMethod.class);

        /**
         * Applies file based configuration.
         * <p>Sets the name prefix, resolution timeout and, if enabled, the retry policy.
         *
         * @param config HttpIntegrationConfig instance.
         * @return Builder instance.
         */
        public Builder withConfig(HttpIntegrationConfig config) {
            this.clientNamePrefix = config.getClientNamePrefix();
            this.resolutionTimeout = Duration.ofSeconds(config.getResolutionTimeoutSeconds());
            HttpIntegrationConfig.RetryConfig retry = config.getRetry();
            if (retry.isEnabled()) {
                this.httpErrorPolicy = TransientErrorRetryPolicy.fromConfig(retry);
                this.resilienceEnabled = true;
            } else {
                this.httpErrorPolicy = null;
                this.resilienceEnabled = false;
            }
            return this;
        }

        public Builder withClientNamePrefix(String clientNamePrefix) {
            this.clientNamePrefix = clientNamePrefix;
            return this;
        }

        public Builder withRegistrationResolver(RegistrationResolver registrationResolver) {
            this.registrationResolver = registrationResolver;
            return this;
        }

        /**
         * Sets the executor registration lookups are dispatched to.
         * <p>Must not be the executor that builds clients.
         *
         * @param resolutionExecutor Executor instance.
         * @return Builder instance.
         */
        public Builder withResolutionExecutor(Executor resolutionExecutor) {
            this.resolutionExecutor = resolutionExecutor;
            return this;
        }

        public Builder withResolutionTimeout(Duration resolutionTimeout) {
            this.resolutionTimeout = resolutionTimeout;
            return this;
        }

        public Builder withSelfSignedTlsClientAuthenticationCertificateSelector(ClientCertificateSelector selector) {
            this.selfSignedSelector = selector;
            return this;
        }

        public Builder withTlsClientAuthenticationCertificateSelector(ClientCertificateSelector selector) {
            this.tlsSelector = selector;
            return this;
        }

        /**
         * Adds a client action run after the security defaults.
         *
         * @param action BiConsumer of ClientRegistration, HttpClientOptions.
         * @return Builder instance.
         */
        public Builder addHttpClientAction(BiConsumer<ClientRegistration, HttpClientOptions> action) {
            httpClientActions.add(Objects.requireNonNull(action, "action must not be null"));
            return this;
        }

        /**
         * Adds a handler action run after certificates are attached.
         *
         * @param action BiConsumer of ClientRegistration, ClientCertificateHandler.
         * @return Builder instance.
         */
        public Builder addHttpClientHandlerAction(BiConsumer<ClientRegistration, ClientCertificateHandler> action) {
            httpClientHandlerActions.add(Objects.requireNonNull(action, "action must not be null"));
            return this;
        }

        public Builder withHttpErrorPolicy(HttpErrorPolicy httpErrorPolicy) {
            this.httpErrorPolicy = httpErrorPolicy;
            return this;
        }

        public Builder withResiliencePipeline(ResiliencePipeline resiliencePipeline) {
            this.resiliencePipeline = resiliencePipeline;
            return this;
        }

        /**
         * Disables the default retry policy.
         *
         * @return Builder instance.
         */
        public Builder withoutResilience() {
            this.httpErrorPolicy = null;
            this.resiliencePipeline = null;
            this.resilienceEnabled = false;
            return this;
        }

        /**
         * Sets the enabled client authentication methods.
         *
         * @param methods Methods, at least one.
         * @return Builder instance.
         */
        public Builder withClientAuthenticationMethods(Set<ClientAuthenticationMethod> methods) {
            if (methods == null || methods.isEmpty()) {
                throw new IllegalArgumentException("At least one client authentication method is required");
            }
            this.clientAuthenticationMethods = EnumSet.copyOf(methods);
            return this;
        }

        /**
         * Builds the HttpIntegrationOptions instance.
         *
         * @return HttpIntegrationOptions instance.
         * @throws IllegalStateException If required fields are missing or settings conflict.
         */
        public HttpIntegrationOptions build() {
            if (registrationResolver == null) {
                throw new IllegalStateException("registrationResolver must not be null");
            }
            if (clientNamePrefix == null || clientNamePrefix.isEmpty()) {
                throw new IllegalStateException("clientNamePrefix must not be empty");
            }
            if (resolutionTimeout == null || resolutionTimeout.isNegative() || resolutionTimeout.isZero()) {
                throw new IllegalStateException("resolutionTimeout must be positive");
            }
            if (httpErrorPolicy != null && resiliencePipeline != null) {
                throw new IllegalStateException("An HTTP error policy and a resilience pipeline cannot be used together");
            }
            return new HttpIntegrationOptions(this);
        }
    }

    /**
     * Daemon threads for registration lookups.
     */
    private static class ResolverThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "oidc-registration-resolver-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
