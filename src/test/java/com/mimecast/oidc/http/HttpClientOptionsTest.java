package com.mimecast.oidc.http;

import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpClientOptionsTest {

    @Test
    void testDefaults() {
        HttpClientOptions options = new HttpClientOptions();

        assertEquals(HttpClientOptions.DEFAULT_MAX_RESPONSE_CONTENT_BUFFER_SIZE, options.getMaxResponseContentBufferSize());
        assertEquals(Duration.ofSeconds(100), options.getTimeout());
    }

    @Test
    void testValidation() {
        HttpClientOptions options = new HttpClientOptions();

        assertThrows(IllegalArgumentException.class, () -> options.setMaxResponseContentBufferSize(0));
        assertThrows(IllegalArgumentException.class, () -> options.setTimeout(Duration.ofSeconds(-1)));
        assertThrows(NullPointerException.class, () -> options.setTimeout(null));
    }

    @Test
    void testConfigure() {
        OkHttpClient.Builder builder = new OkHttpClient.Builder();
        new HttpClientOptions()
                .setTimeout(Duration.ofSeconds(5))
                .setMaxResponseContentBufferSize(1024)
                .configure(builder);

        OkHttpClient client = builder.build();
        assertEquals(5000, client.callTimeoutMillis());
        assertEquals(1, client.interceptors().size());
        assertEquals(1024, ((ResponseSizeLimitInterceptor) client.interceptors().get(0)).getMaxBytes());
    }
}
