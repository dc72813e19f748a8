package com.m2m.cloud.auth.jwt;

/**
 * Produces signatures over arbitrary bytes with a private key the caller never sees.
 */
public interface Signer {

    byte[] sign(byte[] message);

    /**
     * Identifier of the signing key, written as the {@code kid} header of encoded tokens.
     * May be {@code null}.
     */
    String getKeyId();
}
