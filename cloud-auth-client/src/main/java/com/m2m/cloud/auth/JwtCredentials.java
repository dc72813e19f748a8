package com.m2m.cloud.auth;

import com.m2m.cloud.auth.jwt.JwtCodec;
import com.m2m.cloud.auth.jwt.Signer;
import com.m2m.cloud.auth.transport.Transport;
import lombok.AccessLevel;
import lombok.Getter;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Credentials that present a self-signed JWT as the bearer token.
 *
 * <p>With a fixed audience the token is cached and re-minted once it expires. Without one, every
 * request gets a fresh one-time token whose audience is the request URI stripped of its query and
 * fragment; that token is never cached.
 *
 * <p>Claims are immutable, use {@link #withClaims} to derive a differently configured copy.
 */
@Getter
public class JwtCredentials extends Credentials implements Signing {
    public static final Duration DEFAULT_TOKEN_LIFETIME = Duration.ofHours(1);

    private final Signer signer;
    private final String issuer;
    private final String subject;
    private final String audience;
    private final Map<String, Object> additionalClaims;
    private final Duration tokenLifetime;
    @Getter(AccessLevel.NONE)
    private final JwtCodec codec;

    public JwtCredentials(Signer signer, String issuer, String subject, String audience,
                          Map<String, ?> additionalClaims) {
        this(signer, issuer, subject, audience, additionalClaims, DEFAULT_TOKEN_LIFETIME, Clock.systemUTC());
    }

    public JwtCredentials(Signer signer, String issuer, String subject, String audience,
                          Map<String, ?> additionalClaims, Duration tokenLifetime, Clock clock) {
        super(clock);
        this.signer = Objects.requireNonNull(signer, "signer");
        this.issuer = issuer;
        this.subject = subject;
        this.audience = audience;
        this.additionalClaims = additionalClaims == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(additionalClaims));
        this.tokenLifetime = tokenLifetime == null ? DEFAULT_TOKEN_LIFETIME : tokenLifetime;
        this.codec = new JwtCodec(clock);
    }

    /**
     * Builds credentials from a parsed {@code service_account} key file. Issuer and subject are the
     * service account email.
     */
    public static JwtCredentials fromServiceAccountInfo(Map<String, ?> info) {
        return fromServiceAccountInfo(info, null, Clock.systemUTC());
    }

    public static JwtCredentials fromServiceAccountInfo(Map<String, ?> info, String audience, Clock clock) {
        ServiceAccountKey key = ServiceAccountKey.fromInfo(info);
        return new JwtCredentials(key.signer(), key.clientEmail(), key.clientEmail(), audience, null,
            DEFAULT_TOKEN_LIFETIME, clock);
    }

    public static JwtCredentials fromServiceAccountFile(Path file) {
        return fromServiceAccountInfo(CredentialsJson.read(file));
    }

    /**
     * Returns a copy with the given claims replaced. {@code null} arguments keep the current
     * value; {@code additionalClaims} are merged over the current ones.
     */
    public JwtCredentials withClaims(String issuer, String subject, String audience,
                                     Map<String, ?> additionalClaims) {
        Map<String, Object> merged = new LinkedHashMap<>(this.additionalClaims);
        if (additionalClaims != null) {
            merged.putAll(additionalClaims);
        }
        return new JwtCredentials(
            signer,
            issuer != null ? issuer : this.issuer,
            subject != null ? subject : this.subject,
            audience != null ? audience : this.audience,
            merged,
            tokenLifetime,
            clock);
    }

    public JwtCredentials withSubject(String subject) {
        return withClaims(null, subject, null, null);
    }

    @Override
    public void refresh(Transport transport) {
        AccessToken jwt = makeJwt(audience);
        this.token = jwt.tokenValue();
        this.expiry = jwt.expiry();
    }

    @Override
    public void beforeRequest(Transport transport, String method, String url, Map<String, String> headers) {
        if (audience != null) {
            super.beforeRequest(transport, method, url, headers);
        } else {
            apply(headers, makeJwt(oneTimeAudience(url)).tokenValue());
        }
    }

    AccessToken makeJwt(String tokenAudience) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(tokenLifetime);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("iss", issuer);
        payload.put("sub", subject != null ? subject : issuer);
        payload.put("iat", now.getEpochSecond());
        payload.put("exp", expiresAt.getEpochSecond());
        if (tokenAudience != null) {
            payload.put("aud", tokenAudience);
        }
        payload.putAll(additionalClaims);

        return new AccessToken(codec.encode(signer, payload), expiresAt);
    }

    static String oneTimeAudience(String url) {
        URI uri = URI.create(url);
        StringBuilder audience = new StringBuilder();
        if (uri.getScheme() != null) {
            audience.append(uri.getScheme()).append(':');
        }
        if (uri.getRawAuthority() != null) {
            audience.append("//").append(uri.getRawAuthority());
        }
        if (uri.getRawPath() != null) {
            audience.append(uri.getRawPath());
        }
        return audience.toString();
    }
}
