package com.mimecast.oidc.trust;

import com.mimecast.oidc.registration.ClientRegistration;

import java.util.Optional;

/**
 * Picks the certificate to present for TLS client authentication.
 *
 * @see ClientCertificateSelectors
 */
@FunctionalInterface
public interface ClientCertificateSelector {

    /**
     * Selects a certificate for the given registration.
     *
     * @param registration ClientRegistration instance.
     * @return Optional of ClientCertificate, empty when nothing is eligible.
     */
    Optional<ClientCertificate> select(ClientRegistration registration);
}
