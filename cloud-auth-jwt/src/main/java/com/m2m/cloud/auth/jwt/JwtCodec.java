package com.m2m.cloud.auth.jwt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.m2m.cloud.auth.error.MalformedTokenException;
import com.m2m.cloud.auth.error.VerificationException;
import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.Encoders;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes, decodes and verifies compact {@code RS256} JSON Web Tokens.
 *
 * <p>A token is {@code base64url(header) + "." + base64url(payload) + "." + base64url(signature)},
 * all segments unpadded, the signature computed over the first two segments exactly as they
 * appear in the token.
 *
 * <p>Verification accepts tokens whose {@code iat} is at most {@link #CLOCK_SKEW} in the future
 * and whose {@code exp} is at most {@link #CLOCK_SKEW} in the past.
 */
public final class JwtCodec {
    public static final Duration CLOCK_SKEW = Duration.ofSeconds(300);

    private static final TypeReference<LinkedHashMap<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final SignatureVerifier verifier;
    private final Clock clock;

    public JwtCodec() {
        this(Clock.systemUTC());
    }

    public JwtCodec(Clock clock) {
        this(new ObjectMapper(), new RsaSignatureVerifier(), clock);
    }

    public JwtCodec(ObjectMapper mapper, SignatureVerifier verifier, Clock clock) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String encode(Signer signer, Map<String, ?> payload) {
        return encode(signer, payload, null);
    }

    /**
     * Encodes with the signer's own key id as {@code kid}.
     */
    public String encode(Signer signer, Map<String, ?> payload, Map<String, ?> header) {
        return encode(signer, payload, header, signer.getKeyId());
    }

    /**
     * Encodes with an explicit key id; a {@code null} key id leaves {@code kid} out of the header
     * even if the signer has one.
     *
     * @param header extra header fields, {@code typ} and {@code alg} always win
     */
    public String encode(Signer signer, Map<String, ?> payload, Map<String, ?> header, String keyId) {
        Objects.requireNonNull(signer, "signer");
        Objects.requireNonNull(payload, "payload");

        Map<String, Object> fullHeader = new LinkedHashMap<>();
        if (header != null) {
            fullHeader.putAll(header);
        }
        fullHeader.put("typ", "JWT");
        fullHeader.put("alg", "RS256");
        if (keyId != null) {
            fullHeader.put("kid", keyId);
        }

        String signingInput = encodeSegment(fullHeader) + "." + encodeSegment(payload);
        byte[] signature = signer.sign(signingInput.getBytes(StandardCharsets.US_ASCII));
        return signingInput + "." + Encoders.BASE64URL.encode(signature);
    }

    /**
     * Returns the header without checking the signature, typically to pick the certificate
     * named by {@code kid}.
     */
    public Map<String, Object> decodeHeader(String token) {
        return split(token).header();
    }

    /**
     * Returns the payload without any signature or claim validation.
     */
    public Map<String, Object> decodeUnverified(String token) {
        return split(token).payload();
    }

    public Map<String, Object> decode(String token, String certificate) {
        return decode(token, certificate, null);
    }

    /**
     * Decodes and verifies a token against a single PEM certificate or public key.
     *
     * @param audience expected {@code aud}, or {@code null} to skip the audience check
     */
    public Map<String, Object> decode(String token, String certificate, String audience) {
        Objects.requireNonNull(certificate, "certificate");
        Segments segments = split(token);
        return verify(segments, List.of(certificate), audience);
    }

    public Map<String, Object> decode(String token, Map<String, String> certificates) {
        return decode(token, certificates, null);
    }

    /**
     * Decodes and verifies a token against a key id to PEM mapping. When the header carries a
     * {@code kid} only that entry is tried, otherwise every certificate is.
     */
    public Map<String, Object> decode(String token, Map<String, String> certificates, String audience) {
        Objects.requireNonNull(certificates, "certificates");
        Segments segments = split(token);

        Collection<String> candidates;
        Object keyId = segments.header().get("kid");
        if (keyId != null && !keyId.toString().isEmpty()) {
            String certificate = certificates.get(keyId.toString());
            if (certificate == null) {
                throw new VerificationException("Certificate for key id " + keyId + " not found.");
            }
            candidates = List.of(certificate);
        } else {
            candidates = certificates.values();
        }
        return verify(segments, candidates, audience);
    }

    private Map<String, Object> verify(Segments segments, Collection<String> certificates, String audience) {
        if (!verifier.verify(segments.signedSection(), segments.signature(), certificates)) {
            throw new VerificationException("Could not verify token signature.");
        }

        verifyIatAndExp(segments.payload());

        if (audience != null) {
            Object claimAudience = segments.payload().get("aud");
            if (!audience.equals(claimAudience)) {
                throw new VerificationException(
                    "Token has wrong audience " + claimAudience + ", expected " + audience);
            }
        }
        return segments.payload();
    }

    private void verifyIatAndExp(Map<String, Object> payload) {
        long now = clock.instant().getEpochSecond();
        long iat = numericClaim(payload, "iat");
        long exp = numericClaim(payload, "exp");

        long earliest = iat - CLOCK_SKEW.toSeconds();
        if (now < earliest) {
            throw new VerificationException("Token used too early, " + now + " < " + iat);
        }

        long latest = exp + CLOCK_SKEW.toSeconds();
        if (latest < now) {
            throw new VerificationException("Token expired, " + latest + " < " + now);
        }
    }

    private static long numericClaim(Map<String, Object> payload, String name) {
        Object value = payload.get(name);
        if (value == null) {
            throw new VerificationException("Token does not contain required claim " + name);
        }
        if (!(value instanceof Number)) {
            throw new VerificationException("Claim " + name + " is not a number: " + value);
        }
        return ((Number) value).longValue();
    }

    private Segments split(String token) {
        Objects.requireNonNull(token, "token");
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new MalformedTokenException(
                "Wrong number of segments in token: expected 3, got " + parts.length);
        }

        Map<String, Object> header = decodeSegment(parts[0]);
        Map<String, Object> payload = decodeSegment(parts[1]);
        byte[] signedSection = (parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
        byte[] signature = base64UrlDecode(parts[2]);
        return new Segments(header, payload, signedSection, signature);
    }

    private Map<String, Object> decodeSegment(String segment) {
        byte[] bytes = base64UrlDecode(segment);
        try {
            Map<String, Object> section = mapper.readValue(bytes, JSON_OBJECT);
            if (section == null) {
                throw new MalformedTokenException("Segment is not a JSON object");
            }
            return section;
        } catch (IOException e) {
            throw new MalformedTokenException(
                "Can't parse segment: " + new String(bytes, StandardCharsets.UTF_8), e);
        }
    }

    private static byte[] base64UrlDecode(String segment) {
        try {
            return Decoders.BASE64URL.decode(segment);
        } catch (DecodingException | IllegalArgumentException e) {
            throw new MalformedTokenException("Segment is not valid base64url", e);
        }
    }

    private String encodeSegment(Map<String, ?> section) {
        try {
            return Encoders.BASE64URL.encode(mapper.writeValueAsBytes(section));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JWT section is not JSON serializable", e);
        }
    }

    private record Segments(Map<String, Object> header,
                            Map<String, Object> payload,
                            byte[] signedSection,
                            byte[] signature) {
    }
}
