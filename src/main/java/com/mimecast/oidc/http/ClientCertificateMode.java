package com.mimecast.oidc.http;

/**
 * How a handler finds client certificates.
 */
public enum ClientCertificateMode {

    /**
     * Key material configured on the JVM, e.g. via <i>javax.net.ssl.keyStore</i>.
     */
    AUTOMATIC,

    /**
     * Only certificates listed on the handler.
     */
    MANUAL
}
