/**
 * Everything related to TLS client certificates and their selection.
 *
 * <p>The {@link com.mimecast.oidc.trust.CertificateInspector} holds the structural checks.
 * <br>The {@link com.mimecast.oidc.trust.ClientCertificateSelectors} apply them to a registration.
 *
 * <p>A self-issued certificate is treated as self-signed. The chain is never built.
 *
 * @see com.mimecast.oidc.trust.ClientCertificateSelector
 */
package com.mimecast.oidc.trust;
