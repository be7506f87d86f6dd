package com.mimecast.oidc.registration;

import java.util.concurrent.CompletableFuture;

/**
 * Client registration lookup.
 *
 * <p>Implementations may perform network or storage I/O.
 * <br>When no registration matches, the returned future completes exceptionally
 * with a {@link RegistrationNotFoundException}.
 */
public interface RegistrationResolver {

    /**
     * Gets a registration by identifier.
     *
     * @param registrationId Registration identifier.
     * @return CompletableFuture of ClientRegistration.
     */
    CompletableFuture<ClientRegistration> getRegistrationById(String registrationId);
}
