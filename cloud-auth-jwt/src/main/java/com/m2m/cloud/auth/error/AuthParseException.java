package com.m2m.cloud.auth.error;

/**
 * A JSON document (key file, token endpoint or metadata body) could not be parsed
 * or lacks a required field.
 */
public class AuthParseException extends AuthException {

    public AuthParseException(String message) {
        super(message);
    }

    public AuthParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
