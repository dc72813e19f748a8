package com.m2m.cloud.auth.oauth2;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.m2m.cloud.auth.error.AuthParseException;
import com.m2m.cloud.auth.error.RefreshException;
import com.m2m.cloud.auth.transport.Response;
import com.m2m.cloud.auth.transport.Transport;
import lombok.extern.slf4j.Slf4j;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Client for an OAuth 2.0 authorization server's token endpoint.
 *
 * <p>Supports the JWT profile for authorization grants (RFC 7523, section 2.1) and the refresh
 * token grant (RFC 6749, section 6).
 */
@Slf4j
public class TokenEndpointClient {
    static final String JWT_GRANT_TYPE = "urn:ietf:params:oauth:grant-type:jwt-bearer";
    static final String REFRESH_GRANT_TYPE = "refresh_token";

    private final ObjectMapper mapper;
    private final Clock clock;

    public TokenEndpointClient() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    public TokenEndpointClient(Clock clock) {
        this(new ObjectMapper(), clock);
    }

    public TokenEndpointClient(ObjectMapper mapper, Clock clock) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Exchanges a signed assertion for an access token.
     *
     * @throws RefreshException if the endpoint rejects the assertion
     */
    public TokenGrant jwtGrant(Transport transport, String tokenUri, String assertion) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("assertion", assertion);
        body.put("grant_type", JWT_GRANT_TYPE);

        JsonNode response = tokenEndpointRequest(transport, tokenUri, body);
        return new TokenGrant(accessToken(response), null, parseExpiry(response), response);
    }

    /**
     * Exchanges a refresh token for an access token. The returned refresh token is the one the
     * server sent back, or {@code refreshToken} if it sent none; callers should persist it.
     *
     * @throws RefreshException if the endpoint rejects the refresh token
     */
    public TokenGrant refreshGrant(Transport transport, String tokenUri, String refreshToken,
                                   String clientId, String clientSecret) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("grant_type", REFRESH_GRANT_TYPE);
        body.put("client_id", clientId);
        body.put("client_secret", clientSecret);
        body.put("refresh_token", refreshToken);

        JsonNode response = tokenEndpointRequest(transport, tokenUri, body);
        JsonNode newRefreshToken = response.get("refresh_token");
        return new TokenGrant(
            accessToken(response),
            newRefreshToken != null && !newRefreshToken.isNull() ? newRefreshToken.asText() : refreshToken,
            parseExpiry(response),
            response);
    }

    private JsonNode tokenEndpointRequest(Transport transport, String tokenUri, Map<String, String> body) {
        String form = body.entrySet().stream()
            .filter(e -> e.getValue() != null)
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));

        Map<String, String> headers = Map.of("Content-Type", "application/x-www-form-urlencoded");
        Response response = transport.request(
            "POST", tokenUri, headers, form.getBytes(StandardCharsets.UTF_8), null);

        String responseBody = response.text();
        if (response.status() != 200) {
            log.debug("Token endpoint {} answered {}", tokenUri, response.status());
            throw new RefreshException(errorDetails(responseBody));
        }

        try {
            return mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new AuthParseException("Token endpoint returned a body that is not JSON", e);
        }
    }

    private String errorDetails(String responseBody) {
        try {
            JsonNode error = mapper.readTree(responseBody);
            if (error == null || !error.hasNonNull("error")) {
                return responseBody;
            }
            String details = error.get("error").asText();
            if (error.hasNonNull("error_description")) {
                details += ": " + error.get("error_description").asText();
            }
            return details;
        } catch (JsonProcessingException e) {
            return responseBody;
        }
    }

    private static String accessToken(JsonNode response) {
        if (response == null || !response.hasNonNull("access_token")) {
            throw new RefreshException("No access token in token endpoint response");
        }
        return response.get("access_token").asText();
    }

    private Instant parseExpiry(JsonNode response) {
        long expiresIn = response.path("expires_in").asLong(0);
        return expiresIn > 0 ? clock.instant().plusSeconds(expiresIn) : null;
    }
}
