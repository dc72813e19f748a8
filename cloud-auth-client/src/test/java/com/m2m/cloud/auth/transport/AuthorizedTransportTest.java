package com.m2m.cloud.auth.transport;

import com.m2m.cloud.auth.StubCredentials;
import com.m2m.cloud.auth.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class AuthorizedTransportTest {

    private static final String URL = "https://api.example.com/v1/things";

    private StubCredentials credentials;
    private RecordingTransport inner;

    @BeforeEach
    void setUp() {
        credentials = new StubCredentials(new TestClock(Instant.parse("2026-10-19T12:00:00Z")), Duration.ofHours(1));
        inner = new RecordingTransport();
    }

    @Test
    void authorizesRequestWithoutTouchingCallerHeaders() {
        var transport = new AuthorizedTransport(credentials, inner);
        inner.respond(200, "ok");
        Map<String, String> headers = new HashMap<>(Map.of("Accept", "application/json"));
        var body = "payload".getBytes(StandardCharsets.UTF_8);

        var response = transport.request("POST", URL, headers, body, Duration.ofSeconds(5));

        assertThat(response.status()).isEqualTo(200);
        var sent = inner.lastRequest();
        assertThat(sent.header("Authorization")).isEqualTo("Bearer token-1");
        assertThat(sent.header("Accept")).isEqualTo("application/json");
        assertThat(sent.bodyText()).isEqualTo("payload");
        assertThat(sent.timeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(headers).containsOnlyKeys("Accept");
    }

    @Test
    void refreshesAndRetriesOnUnauthorized() {
        var transport = new AuthorizedTransport(credentials, inner);
        inner.respond(401, "stale").respond(200, "ok");

        var response = transport.request("GET", URL, Map.of("X-Trace", "abc"));

        assertThat(response.text()).isEqualTo("ok");
        assertThat(credentials.getRefreshCount()).isEqualTo(2);
        assertThat(inner.getRequests()).hasSize(2);
        assertThat(inner.getRequests().get(0).header("Authorization")).isEqualTo("Bearer token-1");
        assertThat(inner.getRequests().get(1).header("Authorization")).isEqualTo("Bearer token-2");
        assertThat(inner.getRequests().get(1).header("X-Trace")).isEqualTo("abc");
    }

    @Test
    void singleRefreshThenStaleResponseIsReturned() {
        var config = new AuthorizedTransportConfig();
        config.setMaxRefreshAttempts(1);
        var transport = new AuthorizedTransport(credentials, inner, config);
        credentials.refresh(inner);
        inner.respond(401, "stale").respond(401, "still stale");
        Map<String, String> original = new HashMap<>(Map.of("X-Trace", "abc"));

        var response = transport.request("GET", URL, original);

        assertThat(response.status()).isEqualTo(401);
        assertThat(credentials.getRefreshCount()).isEqualTo(2);
        assertThat(inner.getRequests()).hasSize(2);
        var retry = inner.getRequests().get(1);
        assertThat(retry.headers()).containsOnlyKeys("X-Trace", "Authorization");
        assertThat(retry.header("Authorization")).isEqualTo("Bearer token-2");
        assertThat(original).containsOnly(Map.entry("X-Trace", "abc"));
    }

    @Test
    void givesUpAfterMaxRefreshAttempts() {
        var config = new AuthorizedTransportConfig();
        config.setMaxRefreshAttempts(1);
        var transport = new AuthorizedTransport(credentials, inner, config);
        inner.respond(401, "stale").respond(401, "still stale");

        var response = transport.request("GET", URL, Map.of());

        assertThat(response.status()).isEqualTo(401);
        assertThat(response.text()).isEqualTo("still stale");
        assertThat(inner.getRequests()).hasSize(2);
    }

    @Test
    void defaultConfigRetriesTwice() {
        var transport = new AuthorizedTransport(credentials, inner);
        inner.respond(401, "").respond(401, "").respond(401, "");

        var response = transport.request("GET", URL, null);

        assertThat(response.status()).isEqualTo(401);
        assertThat(inner.getRequests()).hasSize(3);
    }

    @Test
    void otherStatusesAreReturnedAsIs() {
        var transport = new AuthorizedTransport(credentials, inner);
        inner.respond(403, "forbidden");

        var response = transport.request("GET", URL, Map.of());

        assertThat(response.status()).isEqualTo(403);
        assertThat(credentials.getRefreshCount()).isEqualTo(1);
        assertThat(inner.getRequests()).hasSize(1);
    }

    @Test
    void refreshStatusCodesAreConfigurable() {
        var config = new AuthorizedTransportConfig();
        config.setRefreshStatusCodes(Set.of(401, 403));
        var transport = new AuthorizedTransport(credentials, inner, config);
        inner.respond(403, "forbidden").respond(200, "ok");

        var response = transport.request("GET", URL, Map.of());

        assertThat(response.status()).isEqualTo(200);
        assertThat(credentials.getRefreshCount()).isEqualTo(2);
    }

    @Test
    void validTokenIsNotRefreshedBeforeRequest() {
        var transport = new AuthorizedTransport(credentials, inner);
        inner.respond(200, "a").respond(200, "b");

        transport.request("GET", URL, Map.of());
        transport.request("GET", URL, Map.of());

        assertThat(credentials.getRefreshCount()).isEqualTo(1);
    }
}
