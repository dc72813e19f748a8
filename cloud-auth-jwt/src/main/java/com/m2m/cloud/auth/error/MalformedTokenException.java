package com.m2m.cloud.auth.error;

/**
 * The compact token does not have three segments, or one of them is not base64url encoded JSON.
 */
public class MalformedTokenException extends VerificationException {

    public MalformedTokenException(String message) {
        super(message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
