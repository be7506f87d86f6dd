package com.mimecast.oidc.registration;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Objects;
import java.util.Optional;

/**
 * Signing credential attached to a client registration.
 *
 * <p>A credential is a key reference that may or may not wrap an X.509 certificate.
 * <br>Only certificate backed credentials are considered for TLS client authentication.
 */
public class SigningCredential {

    private final String keyId;
    private final String algorithm;
    private final PrivateKey privateKey;
    private final X509Certificate certificate;

    /**
     * Constructs a new SigningCredential instance.
     *
     * @param keyId       Key identifier.
     * @param algorithm   Signing algorithm, e.g. RS256.
     * @param privateKey  Private key, may be null.
     * @param certificate X.509 certificate, may be null.
     */
    public SigningCredential(String keyId, String algorithm, PrivateKey privateKey, X509Certificate certificate) {
        this.keyId = Objects.requireNonNull(keyId, "keyId must not be null");
        this.algorithm = algorithm;
        this.privateKey = privateKey;
        this.certificate = certificate;
    }

    /**
     * Creates a credential backed by a certificate and its private key.
     *
     * @param keyId       Key identifier.
     * @param privateKey  Private key.
     * @param certificate X.509 certificate.
     * @return SigningCredential instance.
     */
    public static SigningCredential ofCertificate(String keyId, PrivateKey privateKey, X509Certificate certificate) {
        Objects.requireNonNull(certificate, "certificate must not be null");
        return new SigningCredential(keyId, certificate.getSigAlgName(), privateKey, certificate);
    }

    /**
     * Creates a credential that only carries a key.
     *
     * @param keyId      Key identifier.
     * @param algorithm  Signing algorithm.
     * @param privateKey Private key.
     * @return SigningCredential instance.
     */
    public static SigningCredential ofKey(String keyId, String algorithm, PrivateKey privateKey) {
        return new SigningCredential(keyId, algorithm, privateKey, null);
    }

    public String getKeyId() {
        return keyId;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public Optional<PrivateKey> getPrivateKey() {
        return Optional.ofNullable(privateKey);
    }

    public Optional<X509Certificate> getCertificate() {
        return Optional.ofNullable(certificate);
    }

    @Override
    public String toString() {
        return "SigningCredential{keyId=" + keyId +
                ", algorithm=" + algorithm +
                ", certificate=" + (certificate != null ? certificate.getSubjectX500Principal().getName() : "none") +
                "}";
    }
}
