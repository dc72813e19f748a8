package com.m2m.cloud.auth;

import com.m2m.cloud.auth.jwt.Signer;

/**
 * Credentials holding a private key that can sign arbitrary bytes.
 */
public interface Signing {

    Signer getSigner();

    default byte[] signBytes(byte[] message) {
        return getSigner().sign(message);
    }
}
