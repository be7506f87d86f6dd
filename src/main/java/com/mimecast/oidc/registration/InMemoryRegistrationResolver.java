package com.mimecast.oidc.registration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registration resolver.
 *
 * <p>Thread safe. Registrations may be replaced at any time, lookups always see the latest one.
 */
public class InMemoryRegistrationResolver implements RegistrationResolver {
    private static final Logger log = LogManager.getLogger(InMemoryRegistrationResolver.class);

    private final Map<String, ClientRegistration> registrations = new ConcurrentHashMap<>();

    /**
     * Adds or replaces a registration.
     *
     * @param registration ClientRegistration instance.
     * @return Self.
     */
    public InMemoryRegistrationResolver register(ClientRegistration registration) {
        Objects.requireNonNull(registration, "registration must not be null");
        registrations.put(registration.getRegistrationId(), registration);
        log.debug("Registered client registration: {}", registration.getRegistrationId());
        return this;
    }

    /**
     * Removes a registration.
     *
     * @param registrationId Registration identifier.
     * @return True if a registration was removed.
     */
    public boolean remove(String registrationId) {
        return registrations.remove(registrationId) != null;
    }

    @Override
    public CompletableFuture<ClientRegistration> getRegistrationById(String registrationId) {
        ClientRegistration registration = registrationId != null ? registrations.get(registrationId) : null;
        if (registration == null) {
            return CompletableFuture.failedFuture(new RegistrationNotFoundException(registrationId));
        }
        return CompletableFuture.completedFuture(registration);
    }
}
