package com.m2m.cloud.auth.error;

public class InvalidCredentialTypeException extends DefaultCredentialsException {

    public InvalidCredentialTypeException(String message) {
        super(message);
    }
}
