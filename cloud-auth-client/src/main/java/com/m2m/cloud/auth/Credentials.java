package com.m2m.cloud.auth;

import com.m2m.cloud.auth.transport.Transport;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A bearer token holder that knows how to renew itself.
 *
 * <p>A credential is valid while it has a token and its expiry, if any, lies in the future.
 * {@link #refresh(Transport)} is the only operation that changes the token; it either leaves the
 * credential valid or throws, leaving the previous state in place.
 *
 * <p>Instances are not thread safe. Callers sharing one credential across threads must serialize
 * access to it.
 */
public abstract class Credentials {
    public static final String AUTHORIZATION = "Authorization";

    protected final Clock clock;

    @Getter
    protected String token;
    @Getter
    protected Instant expiry;

    protected Credentials() {
        this(Clock.systemUTC());
    }

    protected Credentials(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public boolean isExpired() {
        return expiry != null && !expiry.isAfter(clock.instant());
    }

    public boolean isValid() {
        return token != null && !isExpired();
    }

    /**
     * Obtains a new token.
     *
     * @param transport used for any network call the refresh needs
     */
    public abstract void refresh(Transport transport);

    /**
     * Refreshes the token if it is not valid and stamps it on {@code headers}.
     *
     * @param headers mutable request headers
     */
    public void beforeRequest(Transport transport, String method, String url, Map<String, String> headers) {
        if (!isValid()) {
            refresh(transport);
        }
        apply(headers);
    }

    public void apply(Map<String, String> headers) {
        apply(headers, token);
    }

    protected void apply(Map<String, String> headers, String bearerToken) {
        headers.put(AUTHORIZATION, "Bearer " + bearerToken);
    }
}
