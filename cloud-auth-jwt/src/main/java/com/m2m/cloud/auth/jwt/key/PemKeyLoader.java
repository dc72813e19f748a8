package com.m2m.cloud.auth.jwt.key;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Reads RSA keys and X.509 certificates from PEM text.
 */
public final class PemKeyLoader {
    private static final String CERTIFICATE = "CERTIFICATE";
    private static final String PRIVATE_KEY = "PRIVATE KEY";
    private static final String PUBLIC_KEY = "PUBLIC KEY";

    private PemKeyLoader() {}

    public static KeyPair generateRsaKeyPair(int bits) {
        try {
            KeyPairGenerator kgp = KeyPairGenerator.getInstance("RSA");
            kgp.initialize(bits);
            return kgp.generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA not available", e);
        }
    }

    /**
     * Parses a PKCS#8 {@code PRIVATE KEY} block, the format service account key files carry.
     */
    public static PrivateKey loadPrivateKey(String pem) {
        try {
            byte[] der = decodeBody(pem, PRIVATE_KEY);
            return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (NoSuchAlgorithmException | InvalidKeySpecException | IllegalArgumentException e) {
            throw new IllegalArgumentException("No key could be detected in the private key PEM", e);
        }
    }

    public static PublicKey loadPublicKey(String pem) {
        try {
            byte[] der = decodeBody(pem, PUBLIC_KEY);
            return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        } catch (NoSuchAlgorithmException | InvalidKeySpecException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to parse public key from PEM", e);
        }
    }

    /**
     * Returns the public key of either a {@code CERTIFICATE} or a {@code PUBLIC KEY} block.
     */
    public static PublicKey loadVerificationKey(String pem) {
        if (!pem.contains("-----BEGIN " + CERTIFICATE + "-----")) {
            return loadPublicKey(pem);
        }
        try {
            var factory = CertificateFactory.getInstance("X.509");
            var cert = factory.generateCertificate(
                new ByteArrayInputStream(pem.getBytes(StandardCharsets.US_ASCII)));
            return cert.getPublicKey();
        } catch (CertificateException e) {
            throw new IllegalArgumentException("Failed to parse certificate from PEM", e);
        }
    }

    public static String toPem(PrivateKey key) {
        return toPem(key, PRIVATE_KEY);
    }

    public static String toPem(PublicKey key) {
        return toPem(key, PUBLIC_KEY);
    }

    private static String toPem(Key key, String type) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
            .encodeToString(key.getEncoded());
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
    }

    private static byte[] decodeBody(String pem, String type) {
        String content = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s+", "");
        return Base64.getDecoder().decode(content.getBytes(StandardCharsets.US_ASCII));
    }
}
