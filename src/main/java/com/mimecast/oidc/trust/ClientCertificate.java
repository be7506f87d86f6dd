package com.mimecast.oidc.trust;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Objects;
import java.util.Optional;

/**
 * TLS client certificate with its private key.
 *
 * <p>The key is needed to complete the handshake. A certificate without key can be listed
 * <br>on a handler but will not be presented.
 */
public class ClientCertificate {

    private final X509Certificate certificate;
    private final PrivateKey privateKey;

    /**
     * Constructs a new ClientCertificate instance.
     *
     * @param certificate X509Certificate instance.
     * @param privateKey  Private key, may be null.
     */
    public ClientCertificate(X509Certificate certificate, PrivateKey privateKey) {
        this.certificate = Objects.requireNonNull(certificate, "certificate must not be null");
        this.privateKey = privateKey;
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    public Optional<PrivateKey> getPrivateKey() {
        return Optional.ofNullable(privateKey);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClientCertificate)) return false;
        ClientCertificate that = (ClientCertificate) o;
        return certificate.equals(that.certificate) && Objects.equals(privateKey, that.privateKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(certificate, privateKey);
    }

    @Override
    public String toString() {
        return "ClientCertificate{subject=" + certificate.getSubjectX500Principal().getName() +
                ", serial=" + certificate.getSerialNumber().toString(16) +
                ", privateKey=" + (privateKey != null) +
                "}";
    }
}
