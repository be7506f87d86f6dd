package com.mimecast.oidc.http;

import java.io.IOException;

/**
 * Thrown when a response body exceeds the configured cap.
 */
public class ResponseTooLargeException extends IOException {

    private final long maxBytes;

    /**
     * Constructs a new ResponseTooLargeException.
     *
     * @param size     Declared or read size in bytes.
     * @param maxBytes Cap in bytes.
     */
    public ResponseTooLargeException(long size, long maxBytes) {
        super("Response content of at least " + size + " bytes exceeds the limit of " + maxBytes + " bytes");
        this.maxBytes = maxBytes;
    }

    public long getMaxBytes() {
        return maxBytes;
    }
}
