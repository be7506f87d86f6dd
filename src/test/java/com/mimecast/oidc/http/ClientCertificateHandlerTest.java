package com.mimecast.oidc.http;

import com.mimecast.oidc.trust.CertificateFixtures;
import com.mimecast.oidc.trust.ClientCertificate;
import okhttp3.CookieJar;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ClientCertificateHandlerTest {

    private MockWebServer mockWebServer;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void testDefaults() {
        ClientCertificateHandler handler = new ClientCertificateHandler();

        assertEquals(ClientCertificateMode.AUTOMATIC, handler.getClientCertificateMode());
        assertTrue(handler.getClientCertificates().isEmpty());
        assertTrue(handler.supportsAutomaticDecompression());
        assertTrue(handler.isAutomaticDecompression());
        assertTrue(handler.isUseCookies());
    }

    @Test
    void testCookiesReplayedWhenEnabled() throws Exception {
        OkHttpClient client = build(new ClientCertificateHandler());

        mockWebServer.enqueue(new MockResponse().addHeader("Set-Cookie", "session=abc; Path=/"));
        mockWebServer.enqueue(new MockResponse());
        execute(client);
        execute(client);

        mockWebServer.takeRequest();
        assertEquals("session=abc", mockWebServer.takeRequest().getHeader("Cookie"));
    }

    @Test
    void testCookiesDroppedWhenDisabled() throws Exception {
        ClientCertificateHandler handler = new ClientCertificateHandler().setUseCookies(false);
        OkHttpClient client = build(handler);
        assertSame(CookieJar.NO_COOKIES, client.cookieJar());

        mockWebServer.enqueue(new MockResponse().addHeader("Set-Cookie", "session=abc; Path=/"));
        mockWebServer.enqueue(new MockResponse());
        execute(client);
        execute(client);

        mockWebServer.takeRequest();
        assertNull(mockWebServer.takeRequest().getHeader("Cookie"));
    }

    @Test
    void testCompressionAdvertisedByDefault() throws Exception {
        mockWebServer.enqueue(new MockResponse());
        execute(build(new ClientCertificateHandler()));

        assertEquals("gzip", mockWebServer.takeRequest().getHeader("Accept-Encoding"));
    }

    @Test
    void testIdentityEncodingWhenDecompressionDisabled() throws Exception {
        OkHttpClient client = build(new ClientCertificateHandler().setAutomaticDecompression(false));

        mockWebServer.enqueue(new MockResponse());
        execute(client);
        assertEquals("identity", mockWebServer.takeRequest().getHeader("Accept-Encoding"));

        mockWebServer.enqueue(new MockResponse());
        try (Response response = client.newCall(new Request.Builder()
                .url(mockWebServer.url("/"))
                .header("Accept-Encoding", "br")
                .build()).execute()) {
            assertEquals(200, response.code());
        }
        RecordedRequest recorded = mockWebServer.takeRequest();
        assertEquals("br", recorded.getHeader("Accept-Encoding"));
    }

    @Test
    void testManualModeWithCertificate() {
        ClientCertificateHandler handler = new ClientCertificateHandler()
                .setClientCertificateMode(ClientCertificateMode.MANUAL);
        handler.getClientCertificates().add(new ClientCertificate(
                CertificateFixtures.selfSigned("client"), CertificateFixtures.CLIENT_KEY_PAIR.getPrivate()));

        OkHttpClient.Builder builder = new OkHttpClient.Builder();
        assertDoesNotThrow(() -> handler.configure(builder));
        assertNotNull(builder.build().sslSocketFactory());
    }

    @Test
    void testManualModeSkipsCertificateWithoutKey() {
        ClientCertificateHandler handler = new ClientCertificateHandler()
                .setClientCertificateMode(ClientCertificateMode.MANUAL);
        handler.getClientCertificates().add(new ClientCertificate(CertificateFixtures.selfSigned("client"), null));

        assertDoesNotThrow(() -> handler.configure(new OkHttpClient.Builder()));
    }

    private OkHttpClient build(ClientCertificateHandler handler) {
        OkHttpClient.Builder builder = new OkHttpClient.Builder();
        handler.configure(builder);
        return builder.build();
    }

    private void execute(OkHttpClient client) throws IOException {
        try (Response response = client.newCall(new Request.Builder().url(mockWebServer.url("/")).build()).execute()) {
            assertEquals(200, response.code());
        }
    }
}
