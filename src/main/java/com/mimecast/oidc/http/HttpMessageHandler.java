package com.mimecast.oidc.http;

import okhttp3.OkHttpClient;

/**
 * Primary message handler of a managed client.
 *
 * <p>Owns the connection level settings: TLS material, cookies and content encoding.
 */
public interface HttpMessageHandler {

    /**
     * Applies the handler settings to the client being assembled.
     *
     * @param builder OkHttpClient.Builder instance.
     */
    void configure(OkHttpClient.Builder builder);
}
