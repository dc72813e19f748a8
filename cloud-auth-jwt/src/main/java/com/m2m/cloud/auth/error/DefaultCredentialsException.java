package com.m2m.cloud.auth.error;

/**
 * Acquiring default credentials failed, either because no source matched or because a matched
 * source held unusable material.
 */
public class DefaultCredentialsException extends AuthException {

    public DefaultCredentialsException(String message) {
        super(message);
    }

    public DefaultCredentialsException(String message, Throwable cause) {
        super(message, cause);
    }
}
