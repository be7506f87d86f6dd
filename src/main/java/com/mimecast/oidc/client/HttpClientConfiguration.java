package com.mimecast.oidc.client;

import com.mimecast.oidc.http.ClientCertificateHandler;
import com.mimecast.oidc.http.ClientCertificateMode;
import com.mimecast.oidc.http.ClientNameCodec;
import com.mimecast.oidc.http.ClientProperties;
import com.mimecast.oidc.http.HttpClientConfigurationException;
import com.mimecast.oidc.http.HttpClientOptions;
import com.mimecast.oidc.http.factory.HandlerBuilder;
import com.mimecast.oidc.http.factory.HttpClientFactoryConfigurer;
import com.mimecast.oidc.http.factory.HttpClientFactoryOptions;
import com.mimecast.oidc.registration.ClientRegistration;
import com.mimecast.oidc.registration.RegistrationNotFoundException;
import com.mimecast.oidc.resilience.PolicyInterceptor;
import com.mimecast.oidc.resilience.ResilienceInterceptor;
import com.mimecast.oidc.trust.ClientCertificateSelector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;

/**
 * Configures managed HTTP clients for client registrations.
 *
 * <p>Only clients whose name carries the configured prefix are touched, see {@link ClientNameCodec}.
 *
 * <p>{@link #configure} resolves the registration named by the client and registers, in order:
 * <ol>
 *   <li>The security defaults: 10 MiB response cap and 1 minute timeout.</li>
 *   <li>The user client actions, which may relax or tighten the defaults.</li>
 *   <li>The retry policy or resilience pipeline, manual certificate mode and the requested client certificate.</li>
 *   <li>The user handler actions.</li>
 * </ol>
 *
 * <p>{@link #postConfigure} makes sure the primary handler can carry certificates and,
 * <br>once every other action ran, turns off automatic decompression and cookies.
 */
public class HttpClientConfiguration implements HttpClientFactoryConfigurer {
    private static final Logger log = LogManager.getLogger(HttpClientConfiguration.class);

    /**
     * Response cap applied to managed clients.
     */
    public static final long MAX_RESPONSE_CONTENT_BUFFER_SIZE = 10L * 1024 * 1024;

    /**
     * Timeout applied to managed clients.
     */
    public static final Duration TIMEOUT = Duration.ofMinutes(1);

    private final HttpIntegrationOptions settings;

    /**
     * Constructs a new HttpClientConfiguration instance.
     *
     * @param settings HttpIntegrationOptions instance.
     */
    public HttpClientConfiguration(HttpIntegrationOptions settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    @Override
    public void configure(String name, HttpClientFactoryOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        ClientProperties properties = ClientNameCodec.decode(name, settings.getClientNamePrefix());
        Optional<String> identifier = properties.get(ClientProperties.REGISTRATION_ID);
        if (identifier.isEmpty()) {
            return;
        }

        ClientRegistration registration = resolveRegistration(identifier.get());

        options.getHttpClientActions().add(client -> {
            // Defaults, user actions below may override.
            client.setMaxResponseContentBufferSize(MAX_RESPONSE_CONTENT_BUFFER_SIZE);
            client.setTimeout(TIMEOUT);
        });

        for (BiConsumer<ClientRegistration, HttpClientOptions> action : settings.getHttpClientActions()) {
            options.getHttpClientActions().add(client -> action.accept(registration, client));
        }

        options.getHandlerBuilderActions().add(builder -> {
            if (settings.getHttpErrorPolicy().isPresent()) {
                builder.getAdditionalHandlers().add(new PolicyInterceptor(settings.getHttpErrorPolicy().get()));
            } else if (settings.getResiliencePipeline().isPresent()) {
                builder.getAdditionalHandlers().add(new ResilienceInterceptor(settings.getResiliencePipeline().get()));
            }

            ClientCertificateHandler handler = requireCertificateHandler(builder);
            handler.setClientCertificateMode(ClientCertificateMode.MANUAL);

            if (properties.getBoolean(ClientProperties.ATTACH_TLS_CLIENT_CERTIFICATE)) {
                attachCertificate(handler, registration, settings.getTlsClientAuthenticationCertificateSelector());
            } else if (properties.getBoolean(ClientProperties.ATTACH_SELF_SIGNED_TLS_CLIENT_CERTIFICATE)) {
                attachCertificate(handler, registration, settings.getSelfSignedTlsClientAuthenticationCertificateSelector());
            }
        });

        for (BiConsumer<ClientRegistration, ClientCertificateHandler> action : settings.getHttpClientHandlerActions()) {
            options.getHandlerBuilderActions().add(builder -> action.accept(registration, requireCertificateHandler(builder)));
        }
    }

    @Override
    public void postConfigure(String name, HttpClientFactoryOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        if (!ClientNameCodec.isManaged(name, settings.getClientNamePrefix())) {
            return;
        }

        options.getHandlerBuilderActions().add(0, builder -> {
            if (!(builder.getPrimaryHandler() instanceof ClientCertificateHandler)) {
                log.debug("Replacing primary handler {} with {}",
                        builder.getPrimaryHandler().getClass().getSimpleName(), ClientCertificateHandler.class.getSimpleName());
                builder.setPrimaryHandler(new ClientCertificateHandler());
            }
        });

        options.getHandlerBuilderActions().add(builder -> applyHardening(requireCertificateHandler(builder)));
    }

    /**
     * Turns off automatic decompression and cookies.
     * <p>Decompressing automatically advertises compression on every request, which exposes
     * <br>reflected secrets to compression side channels. Encoded responses are left to the caller.
     * <p>Handlers are cached and shared, so cookies would leak between unrelated callers.
     *
     * @param handler ClientCertificateHandler instance.
     */
    public static void applyHardening(ClientCertificateHandler handler) {
        if (handler.supportsAutomaticDecompression()) {
            handler.setAutomaticDecompression(false);
        }
        handler.setUseCookies(false);
    }

    private ClientRegistration resolveRegistration(String identifier) {
        log.debug("Resolving client registration: {}", identifier);

        // Never resolved on the calling thread.
        CompletableFuture<ClientRegistration> future = CompletableFuture
                .supplyAsync(() -> settings.getRegistrationResolver().getRegistrationById(identifier),
                        settings.getResolutionExecutor())
                .thenCompose(lookup -> lookup);

        try {
            ClientRegistration registration = future.get(settings.getResolutionTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (registration == null) {
                throw new RegistrationNotFoundException(identifier);
            }
            log.info("Resolved client registration: {}", registration);
            return registration;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null ?
                    e.getCause().getCause() : e.getCause();
            if (cause instanceof RegistrationNotFoundException) {
                throw (RegistrationNotFoundException) cause;
            }
            throw new HttpClientConfigurationException("Unable to resolve client registration " + identifier + ": " +
                    (cause != null ? cause.getMessage() : e.getMessage()), cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HttpClientConfigurationException("Timed out resolving client registration " + identifier +
                    " after " + settings.getResolutionTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HttpClientConfigurationException("Interrupted resolving client registration " + identifier, e);
        }
    }

    private static void attachCertificate(ClientCertificateHandler handler, ClientRegistration registration,
                                          ClientCertificateSelector selector) {
        selector.select(registration).ifPresentOrElse(
                certificate -> {
                    handler.getClientCertificates().add(certificate);
                    log.debug("Attached client certificate {} for registration {}", certificate, registration.getRegistrationId());
                },
                () -> log.debug("No client certificate to attach for registration {}", registration.getRegistrationId()));
    }

    private static ClientCertificateHandler requireCertificateHandler(HandlerBuilder builder) {
        if (!(builder.getPrimaryHandler() instanceof ClientCertificateHandler)) {
            throw new HttpClientConfigurationException("The primary handler of client " + builder.getName() +
                    " must be an instance of " + ClientCertificateHandler.class.getName());
        }
        return (ClientCertificateHandler) builder.getPrimaryHandler();
    }
}
