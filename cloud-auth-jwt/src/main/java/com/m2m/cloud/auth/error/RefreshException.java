package com.m2m.cloud.auth.error;

/**
 * Obtaining a new access token failed.
 */
public class RefreshException extends AuthException {

    public RefreshException(String message) {
        super(message);
    }

    public RefreshException(String message, Throwable cause) {
        super(message, cause);
    }
}
