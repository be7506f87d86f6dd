package com.mimecast.oidc.http;

import com.mimecast.oidc.trust.ClientCertificate;
import okhttp3.CookieJar;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Certificate capable handler.
 *
 * <p>Supports attaching TLS client certificates and controls content decompression and cookies.
 * <p>Defaults follow OkHttp behaviour:
 * <ul>
 *   <li>Client certificates are discovered automatically from the JVM key store settings.</li>
 *   <li>Responses are transparently decompressed, which advertises <i>Accept-Encoding: gzip</i>.</li>
 *   <li>Cookies are kept in memory and replayed.</li>
 * </ul>
 * <p>The class is mutable and NOT thread-safe. It is configured once while a client is built.
 */
public class ClientCertificateHandler implements HttpMessageHandler {
    private static final Logger log = LogManager.getLogger(ClientCertificateHandler.class);

    private static final char[] KEY_STORE_PASSWORD = new char[0];

    private ClientCertificateMode clientCertificateMode = ClientCertificateMode.AUTOMATIC;
    private final List<ClientCertificate> clientCertificates = new ArrayList<>();
    private boolean automaticDecompression = true;
    private boolean useCookies = true;

    public ClientCertificateMode getClientCertificateMode() {
        return clientCertificateMode;
    }

    public ClientCertificateHandler setClientCertificateMode(ClientCertificateMode clientCertificateMode) {
        this.clientCertificateMode = clientCertificateMode;
        return this;
    }

    /**
     * Gets client certificates presented in manual mode.
     *
     * @return Mutable list of ClientCertificate.
     */
    public List<ClientCertificate> getClientCertificates() {
        return clientCertificates;
    }

    /**
     * Checks if this handler can decompress responses on its own.
     *
     * @return Boolean.
     */
    public boolean supportsAutomaticDecompression() {
        return true;
    }

    public boolean isAutomaticDecompression() {
        return automaticDecompression;
    }

    public ClientCertificateHandler setAutomaticDecompression(boolean automaticDecompression) {
        this.automaticDecompression = automaticDecompression;
        return this;
    }

    public boolean isUseCookies() {
        return useCookies;
    }

    public ClientCertificateHandler setUseCookies(boolean useCookies) {
        this.useCookies = useCookies;
        return this;
    }

    @Override
    public void configure(OkHttpClient.Builder builder) {
        builder.cookieJar(useCookies ? new InMemoryCookieJar() : CookieJar.NO_COOKIES);

        if (!automaticDecompression) {
            builder.addInterceptor(new IdentityEncodingInterceptor());
        }

        try {
            if (clientCertificateMode == ClientCertificateMode.AUTOMATIC) {
                SSLContext context = SSLContext.getDefault();
                builder.sslSocketFactory(context.getSocketFactory(), platformTrustManager());
            } else if (!clientCertificates.isEmpty()) {
                SSLContext context = SSLContext.getInstance("TLS");
                KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
                kmf.init(buildKeyStore(), KEY_STORE_PASSWORD);
                X509TrustManager trustManager = platformTrustManager();
                context.init(kmf.getKeyManagers(), new TrustManager[]{trustManager}, null);
                builder.sslSocketFactory(context.getSocketFactory(), trustManager);
            }
        } catch (GeneralSecurityException | IOException e) {
            throw new HttpClientConfigurationException("Unable to initialize TLS context: " + e.getMessage(), e);
        }
    }

    /**
     * Builds an in-memory PKCS12 key store from the listed certificates.
     *
     * @return KeyStore instance.
     */
    private KeyStore buildKeyStore() throws GeneralSecurityException, IOException {
        KeyStore keyStore = KeyStore.getInstance("PKCS12");
        keyStore.load(null, KEY_STORE_PASSWORD);

        int index = 0;
        for (ClientCertificate clientCertificate : clientCertificates) {
            Optional<PrivateKey> privateKey = clientCertificate.getPrivateKey();
            if (privateKey.isEmpty()) {
                log.warn("Client certificate has no private key and will not be presented: {}", clientCertificate);
                continue;
            }
            keyStore.setKeyEntry("client-" + index++, privateKey.get(), KEY_STORE_PASSWORD,
                    new Certificate[]{clientCertificate.getCertificate()});
        }

        log.debug("Built client key store with {} of {} certificates", index, clientCertificates.size());
        return keyStore;
    }

    /**
     * Gets the platform default trust manager.
     *
     * @return X509TrustManager instance.
     */
    private static X509TrustManager platformTrustManager() throws GeneralSecurityException {
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init((KeyStore) null);

        for (TrustManager tm : tmf.getTrustManagers()) {
            if (tm instanceof X509TrustManager) {
                return (X509TrustManager) tm;
            }
        }
        throw new GeneralSecurityException("No X509TrustManager found");
    }

    /**
     * Asks for identity encoding unless the caller chose an encoding.
     * <p>OkHttp only decompresses transparently when it added the header itself.
     */
    static class IdentityEncodingInterceptor implements Interceptor {

        @Override
        public okhttp3.Response intercept(Chain chain) throws IOException {
            Request request = chain.request();
            if (request.header("Accept-Encoding") == null) {
                request = request.newBuilder().header("Accept-Encoding", "identity").build();
            }
            return chain.proceed(request);
        }
    }
}
