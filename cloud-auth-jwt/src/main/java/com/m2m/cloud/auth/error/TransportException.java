package com.m2m.cloud.auth.error;

/**
 * The underlying HTTP call failed, or the metadata service answered with a non-2xx status.
 */
public class TransportException extends AuthException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
