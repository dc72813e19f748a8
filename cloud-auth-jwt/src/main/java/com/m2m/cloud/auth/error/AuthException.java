package com.m2m.cloud.auth.error;

/**
 * Base class for every error raised by the credentials library.
 */
public class AuthException extends RuntimeException {

    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
