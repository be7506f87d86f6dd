package com.mimecast.oidc.http.factory;

import com.mimecast.oidc.http.HttpClientOptions;
import com.mimecast.oidc.http.HttpMessageHandler;
import com.mimecast.oidc.http.PlatformHttpHandler;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Named and cached HTTP client factory.
 *
 * <p>Clients are built once per name and reused until evicted.
 * <br>At most one build per name is in flight; builds of different names may run concurrently.
 * <br>A failed build is not cached and its exception is rethrown to every waiting caller.
 *
 * <p>Build order:
 * <ol>
 *   <li>All configurers {@code configure}, then all configurers {@code postConfigure}.</li>
 *   <li>Handler builder actions, starting from the default primary handler.</li>
 *   <li>Client actions, starting from platform defaults.</li>
 *   <li>Assembly: primary handler, client options, then additional interceptors.</li>
 * </ol>
 */
public class HttpClientFactory implements Closeable {
    private static final Logger log = LogManager.getLogger(HttpClientFactory.class);

    private final List<HttpClientFactoryConfigurer> configurers;
    private final Supplier<HttpMessageHandler> defaultPrimaryHandler;
    private final Map<String, CompletableFuture<ManagedHttpClient>> clients = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Constructs a new HttpClientFactory using the platform handler as default.
     *
     * @param configurers List of HttpClientFactoryConfigurer.
     */
    public HttpClientFactory(List<HttpClientFactoryConfigurer> configurers) {
        this(configurers, PlatformHttpHandler::new);
    }

    /**
     * Constructs a new HttpClientFactory.
     *
     * @param configurers           List of HttpClientFactoryConfigurer.
     * @param defaultPrimaryHandler Supplier of the initial primary handler.
     */
    public HttpClientFactory(List<HttpClientFactoryConfigurer> configurers, Supplier<HttpMessageHandler> defaultPrimaryHandler) {
        this.configurers = List.copyOf(configurers);
        this.defaultPrimaryHandler = Objects.requireNonNull(defaultPrimaryHandler, "defaultPrimaryHandler must not be null");
    }

    /**
     * Gets or builds the client for the given name.
     *
     * @param name Client name.
     * @return ManagedHttpClient instance.
     */
    public ManagedHttpClient getClient(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (closed) {
            throw new IllegalStateException("HttpClientFactory is closed");
        }

        CompletableFuture<ManagedHttpClient> created = new CompletableFuture<>();
        CompletableFuture<ManagedHttpClient> existing = clients.putIfAbsent(name, created);
        if (existing != null) {
            try {
                return existing.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                }
                throw e;
            }
        }

        try {
            ManagedHttpClient client = build(name);
            created.complete(client);
            return client;
        } catch (RuntimeException e) {
            clients.remove(name, created);
            created.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Evicts a cached client so the next lookup builds a new one.
     *
     * @param name Client name.
     * @return True if a client was evicted.
     */
    public boolean evict(String name) {
        CompletableFuture<ManagedHttpClient> future = clients.remove(name);
        if (future == null) {
            return false;
        }
        future.thenAccept(ManagedHttpClient::shutdown);
        log.debug("Evicted HTTP client: {}", name);
        return true;
    }

    @Override
    public void close() {
        closed = true;
        for (String name : new ArrayList<>(clients.keySet())) {
            evict(name);
        }
    }

    private ManagedHttpClient build(String name) {
        HttpClientFactoryOptions options = new HttpClientFactoryOptions();
        for (HttpClientFactoryConfigurer configurer : configurers) {
            configurer.configure(name, options);
        }
        for (HttpClientFactoryConfigurer configurer : configurers) {
            configurer.postConfigure(name, options);
        }

        HandlerBuilder handlerBuilder = new HandlerBuilder(name, defaultPrimaryHandler.get());
        for (Consumer<HandlerBuilder> action : options.getHandlerBuilderActions()) {
            action.accept(handlerBuilder);
        }

        HttpClientOptions clientOptions = new HttpClientOptions();
        for (Consumer<HttpClientOptions> action : options.getHttpClientActions()) {
            action.accept(clientOptions);
        }

        OkHttpClient.Builder builder = new OkHttpClient.Builder();
        HttpMessageHandler primaryHandler = handlerBuilder.getPrimaryHandler();
        primaryHandler.configure(builder);
        clientOptions.configure(builder);
        for (Interceptor interceptor : handlerBuilder.getAdditionalHandlers()) {
            builder.addInterceptor(interceptor);
        }

        log.info("Built HTTP client: {} with handler {} and {}",
                printable(name), primaryHandler.getClass().getSimpleName(), clientOptions);
        return new ManagedHttpClient(name, builder.build(), primaryHandler, clientOptions);
    }

    /**
     * Makes control characters in client names visible in logs.
     *
     * @param name Client name.
     * @return Printable name.
     */
    static String printable(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            if (Character.isISOControl(c)) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
