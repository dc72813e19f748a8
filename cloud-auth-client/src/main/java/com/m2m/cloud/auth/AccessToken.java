package com.m2m.cloud.auth;

import java.time.Instant;

/**
 * @param expiry {@code null} when the issuer did not say
 */
public record AccessToken(String tokenValue, Instant expiry) {
}
