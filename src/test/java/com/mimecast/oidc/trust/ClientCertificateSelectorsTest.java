package com.mimecast.oidc.trust;

import com.mimecast.oidc.registration.ClientRegistration;
import com.mimecast.oidc.registration.SigningCredential;
import org.junit.jupiter.api.Test;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ClientCertificateSelectorsTest {

    private static final PrivateKey KEY = CertificateFixtures.CLIENT_KEY_PAIR.getPrivate();

    @Test
    void testSelectorsAreSeparatedBySelfIssuance() {
        X509Certificate a = CertificateFixtures.selfSigned("a");
        X509Certificate b = CertificateFixtures.issued("b");

        ClientRegistration registration = new ClientRegistration.Builder("reg-1")
                .addSigningCredential(SigningCredential.ofCertificate("a", KEY, a))
                .addSigningCredential(SigningCredential.ofCertificate("b", KEY, b))
                .build();

        Optional<ClientCertificate> selfSigned = ClientCertificateSelectors.selfSigned().select(registration);
        Optional<ClientCertificate> standard = ClientCertificateSelectors.standard().select(registration);

        assertTrue(selfSigned.isPresent());
        assertEquals(a, selfSigned.get().getCertificate());
        assertEquals(Optional.of(KEY), selfSigned.get().getPrivateKey());

        assertTrue(standard.isPresent());
        assertEquals(b, standard.get().getCertificate());
    }

    @Test
    void testSelectionIsDeterministic() {
        ClientRegistration registration = new ClientRegistration.Builder("reg-1")
                .addSigningCredential(SigningCredential.ofCertificate("a", KEY, CertificateFixtures.selfSigned("a")))
                .build();

        assertEquals(ClientCertificateSelectors.selfSigned().select(registration),
                ClientCertificateSelectors.selfSigned().select(registration));
    }

    @Test
    void testFirstEligibleInOrderWins() {
        X509Certificate first = CertificateFixtures.selfSigned("first");
        X509Certificate second = CertificateFixtures.selfSigned("second");

        ClientRegistration registration = new ClientRegistration.Builder("reg-1")
                .addSigningCredential(SigningCredential.ofCertificate("first", KEY, first))
                .addSigningCredential(SigningCredential.ofCertificate("second", KEY, second))
                .build();

        assertEquals(first, ClientCertificateSelectors.selfSigned().select(registration).orElseThrow().getCertificate());
    }

    @Test
    void testIneligibleCertificatesSkipped() {
        X509Certificate noSignature = CertificateFixtures.builder("c").selfIssued(false).digitalSignature(false).build();
        X509Certificate serverOnly = CertificateFixtures.builder("d").selfIssued(false).serverAuthOnly().build();
        X509Certificate eligible = CertificateFixtures.issued("e");

        ClientRegistration registration = new ClientRegistration.Builder("reg-1")
                .addSigningCredential(SigningCredential.ofCertificate("c", KEY, noSignature))
                .addSigningCredential(SigningCredential.ofCertificate("d", KEY, serverOnly))
                .addSigningCredential(SigningCredential.ofCertificate("e", KEY, eligible))
                .build();

        assertEquals(eligible, ClientCertificateSelectors.standard().select(registration).orElseThrow().getCertificate());
    }

    @Test
    void testSelfIssuedWithoutDigitalSignatureNeverSelected() {
        X509Certificate noSignature = CertificateFixtures.builder("x").selfIssued(true).digitalSignature(false).build();

        ClientRegistration registration = new ClientRegistration.Builder("reg-1")
                .addSigningCredential(SigningCredential.ofCertificate("x", KEY, noSignature))
                .build();

        assertTrue(ClientCertificateSelectors.selfSigned().select(registration).isEmpty());
        assertTrue(ClientCertificateSelectors.standard().select(registration).isEmpty());
    }

    @Test
    void testMissingKeyUsageNeverSelected() {
        X509Certificate selfIssued = CertificateFixtures.builder("y").selfIssued(true).withoutKeyUsage().build();
        X509Certificate issued = CertificateFixtures.builder("z").selfIssued(false).withoutKeyUsage().build();

        ClientRegistration registration = new ClientRegistration.Builder("reg-1")
                .addSigningCredential(SigningCredential.ofCertificate("y", KEY, selfIssued))
                .addSigningCredential(SigningCredential.ofCertificate("z", KEY, issued))
                .build();

        assertTrue(ClientCertificateSelectors.selfSigned().select(registration).isEmpty());
        assertTrue(ClientCertificateSelectors.standard().select(registration).isEmpty());
    }

    @Test
    void testOnlyIneligibleCertificates() {
        ClientRegistration registration = new ClientRegistration.Builder("reg-1")
                .addSigningCredential(SigningCredential.ofCertificate("c", KEY,
                        CertificateFixtures.builder("c").selfIssued(false).digitalSignature(false).build()))
                .addSigningCredential(SigningCredential.ofCertificate("v1", KEY, CertificateFixtures.version1("v1")))
                .build();

        assertTrue(ClientCertificateSelectors.standard().select(registration).isEmpty());
        assertTrue(ClientCertificateSelectors.selfSigned().select(registration).isEmpty());
    }

    @Test
    void testKeyOnlyCredentialsIgnored() {
        ClientRegistration registration = new ClientRegistration.Builder("reg-1")
                .addSigningCredential(SigningCredential.ofKey("key", "RS256", KEY))
                .build();

        assertTrue(ClientCertificateSelectors.selfSigned().select(registration).isEmpty());
        assertTrue(ClientCertificateSelectors.standard().select(registration).isEmpty());
    }

    @Test
    void testNoCredentials() {
        ClientRegistration registration = new ClientRegistration.Builder("reg-1").build();

        assertTrue(ClientCertificateSelectors.selfSigned().select(registration).isEmpty());
    }
}
