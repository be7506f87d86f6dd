package com.mimecast.oidc.http.factory;

import com.mimecast.oidc.http.ClientCertificateHandler;
import com.mimecast.oidc.http.PlatformHttpHandler;
import okhttp3.Interceptor;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HttpClientFactoryTest {

    @Test
    void testClientsCachedByName() {
        AtomicInteger builds = new AtomicInteger();
        HttpClientFactoryConfigurer counting = (name, options) -> builds.incrementAndGet();

        try (HttpClientFactory factory = new HttpClientFactory(List.of(counting))) {
            ManagedHttpClient first = factory.getClient("a");
            assertSame(first, factory.getClient("a"));
            assertNotSame(first, factory.getClient("b"));
            assertEquals(2, builds.get());
        }
    }

    @Test
    void testDefaultPrimaryHandler() {
        try (HttpClientFactory factory = new HttpClientFactory(List.of())) {
            ManagedHttpClient client = factory.getClient("plain");

            assertInstanceOf(PlatformHttpHandler.class, client.getPrimaryHandler());
            assertEquals("plain", client.getName());
        }
    }

    @Test
    void testConfigureBeforePostConfigure() {
        List<String> calls = new ArrayList<>();
        HttpClientFactoryConfigurer first = new RecordingConfigurer("first", calls);
        HttpClientFactoryConfigurer second = new RecordingConfigurer("second", calls);

        try (HttpClientFactory factory = new HttpClientFactory(List.of(first, second))) {
            factory.getClient("a");
        }

        assertEquals(List.of("first.configure", "second.configure", "first.postConfigure", "second.postConfigure"), calls);
    }

    @Test
    void testActionsAppliedInOrder() {
        Interceptor outer = chain -> chain.proceed(chain.request());
        Interceptor inner = chain -> chain.proceed(chain.request());

        HttpClientFactoryConfigurer configurer = (name, options) -> {
            options.getHttpClientActions().add(client -> client.setTimeout(Duration.ofSeconds(10)));
            options.getHttpClientActions().add(client -> client.setTimeout(Duration.ofSeconds(20)));
            options.getHandlerBuilderActions().add(builder -> builder.setPrimaryHandler(new ClientCertificateHandler()));
            options.getHandlerBuilderActions().add(builder -> builder.getAdditionalHandlers().add(outer));
            options.getHandlerBuilderActions().add(builder -> builder.getAdditionalHandlers().add(inner));
        };

        try (HttpClientFactory factory = new HttpClientFactory(List.of(configurer))) {
            ManagedHttpClient client = factory.getClient("a");

            assertEquals(Duration.ofSeconds(20), client.getOptions().getTimeout());
            assertEquals(20_000, client.getClient().callTimeoutMillis());
            assertInstanceOf(ClientCertificateHandler.class, client.getPrimaryHandler());

            List<Interceptor> interceptors = client.getClient().interceptors();
            assertTrue(interceptors.indexOf(outer) < interceptors.indexOf(inner));
        }
    }

    @Test
    void testFailedBuildNotCached() {
        AtomicInteger attempts = new AtomicInteger();
        HttpClientFactoryConfigurer failingOnce = (name, options) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        };

        try (HttpClientFactory factory = new HttpClientFactory(List.of(failingOnce))) {
            IllegalStateException e = assertThrows(IllegalStateException.class, () -> factory.getClient("a"));
            assertEquals("boom", e.getMessage());

            assertNotNull(factory.getClient("a"));
            assertEquals(2, attempts.get());
        }
    }

    @Test
    void testSingleBuildPerName() throws Exception {
        AtomicInteger builds = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        HttpClientFactoryConfigurer slow = (name, options) -> {
            builds.incrementAndGet();
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try (HttpClientFactory factory = new HttpClientFactory(List.of(slow))) {
            Future<ManagedHttpClient> first = executor.submit(() -> factory.getClient("a"));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            Future<ManagedHttpClient> second = executor.submit(() -> factory.getClient("a"));
            release.countDown();

            assertSame(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS));
            assertEquals(1, builds.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testEvict() {
        try (HttpClientFactory factory = new HttpClientFactory(List.of())) {
            ManagedHttpClient first = factory.getClient("a");

            assertTrue(factory.evict("a"));
            assertFalse(factory.evict("a"));
            assertNotSame(first, factory.getClient("a"));
        }
    }

    @Test
    void testClosed() {
        HttpClientFactory factory = new HttpClientFactory(List.of());
        factory.close();

        assertThrows(IllegalStateException.class, () -> factory.getClient("a"));
    }

    @Test
    void testPrintable() {
        assertEquals("pfx:a\\u001eb\\u001fc\\u001ed", HttpClientFactory.printable("pfx:a\u001eb\u001fc\u001ed"));
        assertEquals("plain", HttpClientFactory.printable("plain"));
    }

    private static class RecordingConfigurer implements HttpClientFactoryConfigurer {
        private final String id;
        private final List<String> calls;

        RecordingConfigurer(String id, List<String> calls) {
            this.id = id;
            this.calls = calls;
        }

        @Override
        public void configure(String name, HttpClientFactoryOptions options) {
            calls.add(id + ".configure");
        }

        @Override
        public void postConfigure(String name, HttpClientFactoryOptions options) {
            calls.add(id + ".postConfigure");
        }
    }
}
