package com.mimecast.oidc.client;

/**
 * OAuth client authentication methods handled by the HTTP integration.
 *
 * @see <a href="https://tools.ietf.org/html/rfc8705#section-2">RFC 8705 - Mutual-TLS Client Authentication</a>
 */
public enum ClientAuthenticationMethod {
    CLIENT_SECRET_BASIC("client_secret_basic"),
    SELF_SIGNED_TLS_CLIENT_AUTH("self_signed_tls_client_auth"),
    TLS_CLIENT_AUTH("tls_client_auth");

    private final String value;

    ClientAuthenticationMethod(String value) {
        this.value = value;
    }

    /**
     * Gets the registered OAuth name.
     *
     * @return String.
     */
    public String getValue() {
        return value;
    }

    /**
     * Finds a method by its OAuth name.
     *
     * @param value OAuth name.
     * @return ClientAuthenticationMethod.
     * @throws IllegalArgumentException If the name is unknown.
     */
    public static ClientAuthenticationMethod fromValue(String value) {
        for (ClientAuthenticationMethod method : values()) {
            if (method.value.equals(value)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown client authentication method: " + value);
    }
}
