package com.m2m.cloud.auth.oauth2;

import com.m2m.cloud.auth.Credentials;
import com.m2m.cloud.auth.CredentialsJson;
import com.m2m.cloud.auth.Scoped;
import com.m2m.cloud.auth.ServiceAccountKey;
import com.m2m.cloud.auth.Signing;
import com.m2m.cloud.auth.error.AuthParseException;
import com.m2m.cloud.auth.error.RefreshException;
import com.m2m.cloud.auth.jwt.JwtCodec;
import com.m2m.cloud.auth.jwt.Signer;
import com.m2m.cloud.auth.transport.Transport;
import lombok.AccessLevel;
import lombok.Getter;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Service account credentials that trade a signed assertion for an access token at the token
 * endpoint (two-legged OAuth).
 *
 * <p>An access token is only issued for explicit scopes, so these credentials can not be
 * refreshed until {@link #withScopes(Collection)} was called. {@link #withSubject(String)} asks
 * for domain-wide delegation on behalf of a user.
 */
@Getter
public class ServiceAccountCredentials extends Credentials implements Scoped, Signing {
    static final Duration ASSERTION_LIFETIME = Duration.ofHours(1);

    private final Signer signer;
    private final String serviceAccountEmail;
    private final String tokenUri;
    private final List<String> scopes;
    private final String subject;
    private final Map<String, Object> additionalClaims;
    @Getter(AccessLevel.NONE)
    private final TokenEndpointClient client;
    @Getter(AccessLevel.NONE)
    private final JwtCodec codec;

    public ServiceAccountCredentials(Signer signer, String serviceAccountEmail, String tokenUri) {
        this(signer, serviceAccountEmail, tokenUri, null, null, null, Clock.systemUTC());
    }

    public ServiceAccountCredentials(Signer signer, String serviceAccountEmail, String tokenUri,
                                     Collection<String> scopes, String subject,
                                     Map<String, ?> additionalClaims, Clock clock) {
        this(signer, serviceAccountEmail, tokenUri, scopes, subject, additionalClaims,
            new TokenEndpointClient(clock), clock);
    }

    public ServiceAccountCredentials(Signer signer, String serviceAccountEmail, String tokenUri,
                                     Collection<String> scopes, String subject,
                                     Map<String, ?> additionalClaims, TokenEndpointClient client,
                                     Clock clock) {
        super(clock);
        this.signer = Objects.requireNonNull(signer, "signer");
        this.serviceAccountEmail = Objects.requireNonNull(serviceAccountEmail, "serviceAccountEmail");
        this.tokenUri = Objects.requireNonNull(tokenUri, "tokenUri");
        this.scopes = scopes == null ? null : List.copyOf(scopes);
        this.subject = subject;
        this.additionalClaims = additionalClaims == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(additionalClaims));
        this.client = Objects.requireNonNull(client, "client");
        this.codec = new JwtCodec(clock);
    }

    /**
     * Builds unscoped credentials from a parsed {@code service_account} key file, which must
     * carry a {@code token_uri}.
     */
    public static ServiceAccountCredentials fromServiceAccountInfo(Map<String, ?> info) {
        return fromServiceAccountInfo(info, Clock.systemUTC());
    }

    public static ServiceAccountCredentials fromServiceAccountInfo(Map<String, ?> info, Clock clock) {
        ServiceAccountKey key = ServiceAccountKey.fromInfo(info);
        if (key.tokenUri() == null) {
            throw new AuthParseException("Credentials info is missing the token_uri field");
        }
        return new ServiceAccountCredentials(key.signer(), key.clientEmail(), key.tokenUri(),
            null, null, null, clock);
    }

    public static ServiceAccountCredentials fromServiceAccountFile(Path file) {
        return fromServiceAccountInfo(CredentialsJson.read(file));
    }

    @Override
    public boolean requiresScopes() {
        return scopes == null || scopes.isEmpty();
    }

    @Override
    public ServiceAccountCredentials withScopes(Collection<String> scopes) {
        return new ServiceAccountCredentials(signer, serviceAccountEmail, tokenUri, scopes, subject,
            additionalClaims, client, clock);
    }

    @Override
    public ServiceAccountCredentials withScopes(String scopes) {
        return withScopes(Scoped.splitScopes(scopes));
    }

    public ServiceAccountCredentials withSubject(String subject) {
        return new ServiceAccountCredentials(signer, serviceAccountEmail, tokenUri, scopes, subject,
            additionalClaims, client, clock);
    }

    /**
     * Returns a copy whose assertion carries {@code additionalClaims} merged over the current ones.
     */
    public ServiceAccountCredentials withClaims(Map<String, ?> additionalClaims) {
        Map<String, Object> merged = new LinkedHashMap<>(this.additionalClaims);
        if (additionalClaims != null) {
            merged.putAll(additionalClaims);
        }
        return new ServiceAccountCredentials(signer, serviceAccountEmail, tokenUri, scopes, subject,
            merged, client, clock);
    }

    @Override
    public void refresh(Transport transport) {
        if (requiresScopes()) {
            throw new RefreshException("Service account credentials require scopes before they can be refreshed");
        }
        TokenGrant grant = client.jwtGrant(transport, tokenUri, makeAuthorizationGrantAssertion());
        this.token = grant.accessToken();
        this.expiry = grant.expiry();
    }

    String makeAuthorizationGrantAssertion() {
        Instant now = clock.instant();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("iss", serviceAccountEmail);
        payload.put("aud", tokenUri);
        payload.put("iat", now.getEpochSecond());
        payload.put("exp", now.plus(ASSERTION_LIFETIME).getEpochSecond());
        payload.put("scope", String.join(" ", scopes == null ? List.of() : scopes));
        if (subject != null) {
            payload.put("sub", subject);
        }
        payload.putAll(additionalClaims);

        return codec.encode(signer, payload);
    }
}
