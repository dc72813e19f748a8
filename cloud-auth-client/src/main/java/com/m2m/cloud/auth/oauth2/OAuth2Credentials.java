package com.m2m.cloud.auth.oauth2;

import com.m2m.cloud.auth.Credentials;
import com.m2m.cloud.auth.Scoped;
import com.m2m.cloud.auth.error.RefreshException;
import com.m2m.cloud.auth.transport.Transport;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Clock;
import java.util.Collection;
import java.util.List;

/**
 * OAuth 2.0 user credentials renewed through the refresh token grant.
 *
 * <p>Scopes were fixed when the user authorized the client; they are informational only and can
 * not be changed. The server may rotate the refresh token on any refresh, so callers that persist
 * credentials should store {@link #getRefreshToken()} after each refresh.
 */
@Getter
public class OAuth2Credentials extends Credentials implements Scoped {

    private String refreshToken;
    private final String tokenUri;
    private final String clientId;
    private final String clientSecret;
    private final List<String> scopes;
    @Getter(AccessLevel.NONE)
    private final TokenEndpointClient client;

    public OAuth2Credentials(String token, String refreshToken, String tokenUri, String clientId,
                             String clientSecret, Collection<String> scopes) {
        this(token, refreshToken, tokenUri, clientId, clientSecret, scopes, Clock.systemUTC());
    }

    public OAuth2Credentials(String token, String refreshToken, String tokenUri, String clientId,
                             String clientSecret, Collection<String> scopes, Clock clock) {
        this(token, refreshToken, tokenUri, clientId, clientSecret, scopes, new TokenEndpointClient(clock), clock);
    }

    public OAuth2Credentials(String token, String refreshToken, String tokenUri, String clientId,
                             String clientSecret, Collection<String> scopes, TokenEndpointClient client,
                             Clock clock) {
        super(clock);
        this.token = token;
        this.refreshToken = refreshToken;
        this.tokenUri = tokenUri;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.scopes = scopes == null ? null : List.copyOf(scopes);
        this.client = client;
    }

    @Override
    public boolean requiresScopes() {
        return false;
    }

    @Override
    public Credentials withScopes(Collection<String> scopes) {
        throw new UnsupportedOperationException("OAuth 2.0 Credentials can not modify their scopes.");
    }

    @Override
    public void refresh(Transport transport) {
        if (refreshToken == null || tokenUri == null) {
            throw new RefreshException(
                "The credentials do not contain the fields necessary to refresh the access token");
        }
        TokenGrant grant = client.refreshGrant(transport, tokenUri, refreshToken, clientId, clientSecret);

        this.token = grant.accessToken();
        this.expiry = grant.expiry();
        this.refreshToken = grant.refreshToken();
    }
}
