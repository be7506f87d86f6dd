package com.mimecast.oidc.http;

import okhttp3.OkHttpClient;

/**
 * Platform default handler.
 *
 * <p>Leaves OkHttp defaults untouched. It cannot carry client certificates.
 */
public class PlatformHttpHandler implements HttpMessageHandler {

    @Override
    public void configure(OkHttpClient.Builder builder) {
        // OkHttp defaults.
    }
}
