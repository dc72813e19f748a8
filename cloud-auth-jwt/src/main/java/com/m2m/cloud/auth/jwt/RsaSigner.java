package com.m2m.cloud.auth.jwt;

import com.m2m.cloud.auth.jwt.key.PemKeyLoader;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Objects;

/**
 * RSASSA-PKCS1-v1_5 with SHA-256, the {@code RS256} JWT algorithm.
 */
@AllArgsConstructor
public final class RsaSigner implements Signer {
    static final String ALGORITHM = "SHA256withRSA";

    private final PrivateKey privateKey;
    @Getter
    private final String keyId;

    public static RsaSigner fromString(String privateKeyPem, String keyId) {
        Objects.requireNonNull(privateKeyPem, "privateKeyPem");
        return new RsaSigner(PemKeyLoader.loadPrivateKey(privateKeyPem), keyId);
    }

    @Override
    public byte[] sign(byte[] message) {
        try {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(message);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign message with " + ALGORITHM, e);
        }
    }
}
