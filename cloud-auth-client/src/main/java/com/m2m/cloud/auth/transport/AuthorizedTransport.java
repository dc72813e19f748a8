package com.m2m.cloud.auth.transport;

import com.m2m.cloud.auth.Credentials;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A {@link Transport} that authorizes every request with {@link Credentials} and, when the
 * response says the token is stale, refreshes it and retries a bounded number of times.
 *
 * <p>The caller's headers are never modified; every retry starts again from them. The retry
 * counter travels with each call, so one instance can be shared between threads as
 * long as the credentials themselves are guarded.
 */
@Slf4j
public class AuthorizedTransport implements Transport {

    @Getter
    private final Credentials credentials;
    private final Transport transport;
    private final AuthorizedTransportConfig config;

    public AuthorizedTransport(Credentials credentials, Transport transport) {
        this(credentials, transport, new AuthorizedTransportConfig());
    }

    public AuthorizedTransport(Credentials credentials, Transport transport, AuthorizedTransportConfig config) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public Response request(String method, String url, Map<String, String> headers, byte[] body, Duration timeout) {
        return request(method, url, headers, body, timeout, 0);
    }

    private Response request(String method, String url, Map<String, String> headers, byte[] body,
                             Duration timeout, int refreshAttempt) {
        Map<String, String> requestHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            requestHeaders.putAll(headers);
        }

        credentials.beforeRequest(transport, method, url, requestHeaders);

        Response response = transport.request(method, url, requestHeaders, body, timeout);

        if (config.isRefreshStatus(response.status()) && refreshAttempt < config.getMaxRefreshAttempts()) {
            log.info("Refreshing credentials due to a {} response. Attempt {}/{}.",
                response.status(), refreshAttempt + 1, config.getMaxRefreshAttempts());

            credentials.refresh(transport);
            return request(method, url, headers, body, timeout, refreshAttempt + 1);
        }
        return response;
    }
}
