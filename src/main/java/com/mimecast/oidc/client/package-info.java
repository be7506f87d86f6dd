/**
 * OpenID client integration of the managed HTTP clients.
 *
 * <p>{@link com.mimecast.oidc.client.HttpClientConfiguration} turns a client name carrying a registration identifier
 * <br>into a hardened client for that registration, optionally presenting a TLS client certificate.
 *
 * <p>{@link com.mimecast.oidc.client.HttpClientProvider} is the usual entry point.
 *
 * @see com.mimecast.oidc.client.HttpIntegrationOptions
 */
package com.mimecast.oidc.client;
