/**
 * Named HTTP client factory.
 *
 * <p>Builds OkHttp clients on demand, caches them by name and lets
 * <br>{@link com.mimecast.oidc.http.factory.HttpClientFactoryConfigurer} instances contribute
 * <br>handler and client actions before each build.
 *
 * @see com.mimecast.oidc.http.factory.HttpClientFactory
 * @see com.mimecast.oidc.http.factory.HandlerBuilder
 */
package com.mimecast.oidc.http.factory;
