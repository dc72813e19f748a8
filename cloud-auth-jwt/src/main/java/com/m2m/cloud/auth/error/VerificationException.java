package com.m2m.cloud.auth.error;

/**
 * A token failed verification: bad signature, missing or out of window {@code iat}/{@code exp},
 * audience mismatch or unknown key id. Never retried.
 */
public class VerificationException extends AuthException {

    public VerificationException(String message) {
        super(message);
    }

    public VerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
