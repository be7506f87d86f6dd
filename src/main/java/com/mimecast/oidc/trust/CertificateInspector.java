package com.mimecast.oidc.trust;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.security.cert.CertificateParsingException;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.List;

/**
 * Structural X.509 certificate checks used to pick TLS client authentication certificates.
 *
 * <p>Only attributes of a single certificate are inspected.
 * <br>No chain is built and no trust decision is made.
 *
 * @see <a href="https://tools.ietf.org/html/rfc8705">RFC 8705 - OAuth 2.0 Mutual-TLS Client Authentication</a>
 * @see <a href="https://tools.ietf.org/html/rfc5280#section-4.2.1.12">RFC 5280 - Extended Key Usage</a>
 */
public class CertificateInspector {
    private static final Logger log = LogManager.getLogger(CertificateInspector.class);

    /**
     * id-kp-clientAuth, TLS WWW client authentication.
     */
    public static final String CLIENT_AUTHENTICATION_OID = "1.3.6.1.5.5.7.3.2";

    /**
     * Position of digitalSignature in the KeyUsage bit string.
     */
    private static final int DIGITAL_SIGNATURE = 0;

    /**
     * Private constructor.
     */
    private CertificateInspector() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Checks if the certificate is self-issued.
     * <p>A self-issued certificate is assumed to be self-signed to avoid building a chain.
     *
     * @param certificate X509Certificate instance.
     * @return True if encoded subject and issuer names are identical.
     */
    public static boolean isSelfIssued(X509Certificate certificate) {
        return Arrays.equals(
                certificate.getSubjectX500Principal().getEncoded(),
                certificate.getIssuerX500Principal().getEncoded());
    }

    /**
     * Checks if the certificate Key Usage extension allows digital signatures.
     * <p>Certificates without a Key Usage extension do not qualify.
     *
     * @param certificate X509Certificate instance.
     * @return Boolean.
     */
    public static boolean hasDigitalSignatureKeyUsage(X509Certificate certificate) {
        boolean[] keyUsage = certificate.getKeyUsage();
        return keyUsage != null && keyUsage.length > DIGITAL_SIGNATURE && keyUsage[DIGITAL_SIGNATURE];
    }

    /**
     * Checks if the certificate Extended Key Usage extension lists client authentication.
     * <p>Missing or unparsable extensions do not qualify.
     *
     * @param certificate X509Certificate instance.
     * @return Boolean.
     */
    public static boolean hasClientAuthenticationExtendedKeyUsage(X509Certificate certificate) {
        try {
            List<String> usages = certificate.getExtendedKeyUsage();
            return usages != null && usages.contains(CLIENT_AUTHENTICATION_OID);
        } catch (CertificateParsingException e) {
            log.debug("Unable to parse extended key usage of {}: {}",
                    certificate.getSubjectX500Principal().getName(), e.getMessage());
            return false;
        }
    }

    /**
     * Checks if the certificate is X.509 v3 so extensions are meaningful.
     *
     * @param certificate X509Certificate instance.
     * @return Boolean.
     */
    public static boolean isVersion3(X509Certificate certificate) {
        return certificate.getVersion() >= 3;
    }

    /**
     * Checks if the certificate can be presented for TLS client authentication.
     *
     * @param certificate X509Certificate instance.
     * @param selfIssued  Expected self-issued polarity.
     * @return Boolean.
     */
    public static boolean isEligible(X509Certificate certificate, boolean selfIssued) {
        return isVersion3(certificate) &&
                isSelfIssued(certificate) == selfIssued &&
                hasDigitalSignatureKeyUsage(certificate) &&
                hasClientAuthenticationExtendedKeyUsage(certificate);
    }
}
