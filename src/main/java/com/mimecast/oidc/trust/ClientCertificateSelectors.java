package com.mimecast.oidc.trust;

import com.mimecast.oidc.registration.ClientRegistration;
import com.mimecast.oidc.registration.SigningCredential;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.cert.X509Certificate;
import java.util.Optional;

/**
 * Default certificate selectors.
 *
 * <p>Both return the first X.509 signing credential of the registration that is suitable
 * <br>for digital signature and client authentication.
 * <br>They differ only in the self-issued test:
 * <ul>
 *   <li>{@link #selfSigned()} for <i>self_signed_tls_client_auth</i> requires a self-issued certificate.</li>
 *   <li>{@link #standard()} for <i>tls_client_auth</i> requires a certificate that is not self-issued.</li>
 * </ul>
 * <p>Nothing is cached, credentials may be rotated between calls.
 */
public class ClientCertificateSelectors {
    private static final Logger log = LogManager.getLogger(ClientCertificateSelectors.class);

    private static final ClientCertificateSelector SELF_SIGNED = registration -> select(registration, true);
    private static final ClientCertificateSelector STANDARD = registration -> select(registration, false);

    /**
     * Private constructor.
     */
    private ClientCertificateSelectors() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets selector for self-signed TLS client authentication.
     *
     * @return ClientCertificateSelector instance.
     */
    public static ClientCertificateSelector selfSigned() {
        return SELF_SIGNED;
    }

    /**
     * Gets selector for standard TLS client authentication.
     *
     * @return ClientCertificateSelector instance.
     */
    public static ClientCertificateSelector standard() {
        return STANDARD;
    }

    private static Optional<ClientCertificate> select(ClientRegistration registration, boolean selfIssued) {
        for (SigningCredential credential : registration.getSigningCredentials()) {
            Optional<X509Certificate> certificate = credential.getCertificate();
            if (certificate.isPresent() && CertificateInspector.isEligible(certificate.get(), selfIssued)) {
                log.debug("Selected {} certificate {} for registration {}",
                        selfIssued ? "self-signed" : "standard", credential.getKeyId(), registration.getRegistrationId());
                return Optional.of(new ClientCertificate(certificate.get(), credential.getPrivateKey().orElse(null)));
            }
        }

        log.debug("No {} certificate eligible for registration {}",
                selfIssued ? "self-signed" : "standard", registration.getRegistrationId());
        return Optional.empty();
    }
}
