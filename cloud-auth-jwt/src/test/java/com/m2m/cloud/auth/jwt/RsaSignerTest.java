package com.m2m.cloud.auth.jwt;

import com.m2m.cloud.auth.jwt.key.PemKeyLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RsaSignerTest {

    private static KeyPair keyPair;
    private static KeyPair otherKeyPair;

    @BeforeAll
    static void generateKeys() {
        keyPair = PemKeyLoader.generateRsaKeyPair(2048);
        otherKeyPair = PemKeyLoader.generateRsaKeyPair(2048);
    }

    @Test
    void signatureVerifiesWithMatchingPublicKey() {
        var signer = RsaSigner.fromString(PemKeyLoader.toPem(keyPair.getPrivate()), "key-1");
        var message = "123".getBytes(StandardCharsets.UTF_8);

        var signature = signer.sign(message);

        assertThat(signer.getKeyId()).isEqualTo("key-1");
        assertThat(new RsaSignatureVerifier()
            .verify(message, signature, List.of(PemKeyLoader.toPem(keyPair.getPublic())))).isTrue();
    }

    @Test
    void anyMatchingCertificateIsEnough() {
        var signer = new RsaSigner(keyPair.getPrivate(), null);
        var message = "payload".getBytes(StandardCharsets.UTF_8);
        var certificates = List.of(
            PemKeyLoader.toPem(otherKeyPair.getPublic()),
            PemKeyLoader.toPem(keyPair.getPublic()));

        assertThat(new RsaSignatureVerifier().verify(message, signer.sign(message), certificates)).isTrue();
    }

    @Test
    void signatureDoesNotVerifyWithOtherKey() {
        var signer = new RsaSigner(keyPair.getPrivate(), null);
        var message = "payload".getBytes(StandardCharsets.UTF_8);

        assertThat(new RsaSignatureVerifier()
            .verify(message, signer.sign(message), List.of(PemKeyLoader.toPem(otherKeyPair.getPublic())))).isFalse();
    }

    @Test
    void truncatedSignatureDoesNotVerify() {
        var message = "payload".getBytes(StandardCharsets.UTF_8);

        assertThat(new RsaSignatureVerifier()
            .verify(message, new byte[] {1, 2, 3}, List.of(PemKeyLoader.toPem(keyPair.getPublic())))).isFalse();
    }
}
