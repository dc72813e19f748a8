package com.m2m.cloud.auth.oauth2;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Result of a token endpoint exchange.
 *
 * @param refreshToken the refresh token to keep using; {@code null} for the JWT-bearer grant
 * @param expiry       {@code null} if the response carried no {@code expires_in}
 * @param response     the raw JSON response
 */
public record TokenGrant(String accessToken, String refreshToken, Instant expiry, JsonNode response) {
}
