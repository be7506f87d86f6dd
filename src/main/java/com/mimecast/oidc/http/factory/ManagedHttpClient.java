package com.mimecast.oidc.http.factory;

import com.mimecast.oidc.http.HttpClientOptions;
import com.mimecast.oidc.http.HttpMessageHandler;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;

/**
 * Named client built by the {@link HttpClientFactory}.
 *
 * <p>Keeps the handler and options it was assembled from.
 */
public class ManagedHttpClient {

    private final String name;
    private final OkHttpClient client;
    private final HttpMessageHandler primaryHandler;
    private final HttpClientOptions options;

    /**
     * Constructs a new ManagedHttpClient instance.
     *
     * @param name           Client name.
     * @param client         OkHttpClient instance.
     * @param primaryHandler Primary handler.
     * @param options        Client options.
     */
    public ManagedHttpClient(String name, OkHttpClient client, HttpMessageHandler primaryHandler, HttpClientOptions options) {
        this.name = name;
        this.client = client;
        this.primaryHandler = primaryHandler;
        this.options = options;
    }

    public String getName() {
        return name;
    }

    public OkHttpClient getClient() {
        return client;
    }

    public HttpMessageHandler getPrimaryHandler() {
        return primaryHandler;
    }

    public HttpClientOptions getOptions() {
        return options;
    }

    /**
     * Prepares a call.
     *
     * @param request Request instance.
     * @return Call instance.
     */
    public Call newCall(Request request) {
        return client.newCall(request);
    }

    /**
     * Releases dispatcher threads and pooled connections.
     */
    void shutdown() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
