package com.m2m.cloud.auth.jwt;

import java.util.Collection;

/**
 * Checks a signature against a set of PEM encoded certificates or public keys.
 */
public interface SignatureVerifier {

    /**
     * @return {@code true} if at least one of {@code certificates} validates {@code signature}
     */
    boolean verify(byte[] message, byte[] signature, Collection<String> certificates);
}
