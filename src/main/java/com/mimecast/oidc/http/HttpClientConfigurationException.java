package com.mimecast.oidc.http;

/**
 * Thrown when a managed client cannot be configured.
 * <p>Indicates a host or programming error rather than a transient condition.
 */
public class HttpClientConfigurationException extends RuntimeException {

    /**
     * Constructs a new HttpClientConfigurationException.
     *
     * @param message Error message.
     */
    public HttpClientConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new HttpClientConfigurationException with cause.
     *
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public HttpClientConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
