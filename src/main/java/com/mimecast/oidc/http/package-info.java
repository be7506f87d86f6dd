/**
 * Managed HTTP client building blocks.
 *
 * <p>The {@link com.mimecast.oidc.http.ClientNameCodec} carries per-client properties in the client name,
 * <br>since the factory caches clients by name and offers no other way to pass context.
 *
 * <p>The {@link com.mimecast.oidc.http.ClientCertificateHandler} is the primary handler that can present
 * <br>TLS client certificates and turn off decompression and cookies.
 *
 * <p>The {@link com.mimecast.oidc.http.HttpClientOptions} hold the client level response cap and timeout.
 *
 * @see com.mimecast.oidc.http.factory.HttpClientFactory
 */
package com.mimecast.oidc.http;
