package com.m2m.cloud.auth.jwt;

import com.m2m.cloud.auth.jwt.key.PemKeyLoader;

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.util.Collection;

/**
 * Verifies {@code SHA256withRSA} signatures. A malformed signature or a key that is not RSA
 * counts as a mismatch.
 */
public final class RsaSignatureVerifier implements SignatureVerifier {

    @Override
    public boolean verify(byte[] message, byte[] signature, Collection<String> certificates) {
        for (String certificate : certificates) {
            if (verify(message, signature, PemKeyLoader.loadVerificationKey(certificate))) {
                return true;
            }
        }
        return false;
    }

    private static boolean verify(byte[] message, byte[] signature, PublicKey key) {
        try {
            Signature verifier = Signature.getInstance(RsaSigner.ALGORITHM);
            verifier.initVerify(key);
            verifier.update(message);
            return verifier.verify(signature);
        } catch (InvalidKeyException | SignatureException e) {
            return false;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(RsaSigner.ALGORITHM + " not available", e);
        }
    }
}
