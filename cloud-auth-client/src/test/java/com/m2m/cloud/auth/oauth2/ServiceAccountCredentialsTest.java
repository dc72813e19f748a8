package com.m2m.cloud.auth.oauth2;

import com.m2m.cloud.auth.TestClock;
import com.m2m.cloud.auth.TestKeys;
import com.m2m.cloud.auth.error.AuthParseException;
import com.m2m.cloud.auth.error.RefreshException;
import com.m2m.cloud.auth.jwt.JwtCodec;
import com.m2m.cloud.auth.transport.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceAccountCredentialsTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

    private TestClock clock;
    private JwtCodec codec;
    private RecordingTransport transport;
    private ServiceAccountCredentials unscoped;

    @BeforeEach
    void setUp() {
        clock = new TestClock(NOW);
        codec = new JwtCodec(clock);
        transport = new RecordingTransport();
        unscoped = ServiceAccountCredentials.fromServiceAccountInfo(TestKeys.serviceAccountInfo(), clock);
    }

    private Map<String, Object> sentAssertion() {
        var assertion = FormBody.parse(transport.lastRequest().bodyText()).get("assertion");
        return codec.decode(assertion, TestKeys.publicKeyPem(), TestKeys.TOKEN_URI);
    }

    @Test
    void unscopedCredentialsCanNotRefresh() {
        assertThat(unscoped.requiresScopes()).isTrue();

        assertThatThrownBy(() -> unscoped.refresh(transport))
            .isInstanceOf(RefreshException.class);
        assertThat(transport.getRequests()).isEmpty();
    }

    @Test
    void withScopesReturnsScopedCopy() {
        var scoped = unscoped.withScopes("https://www.example.com/auth/cloud-platform  email");

        assertThat(scoped).isNotSameAs(unscoped);
        assertThat(scoped.requiresScopes()).isFalse();
        assertThat(scoped.getScopes()).containsExactly("https://www.example.com/auth/cloud-platform", "email");
        assertThat(unscoped.getScopes()).isNull();
    }

    @Test
    void refreshExchangesSignedAssertion() {
        var scoped = unscoped.withScopes(List.of("scope-a", "scope-b"));
        transport.respondJson(200, "{\"access_token\":\"ya29.sa\",\"expires_in\":3599}");

        scoped.refresh(transport);

        assertThat(transport.lastRequest().url()).isEqualTo(TestKeys.TOKEN_URI);
        assertThat(FormBody.parse(transport.lastRequest().bodyText()))
            .containsEntry("grant_type", TokenEndpointClient.JWT_GRANT_TYPE);
        assertThat(sentAssertion())
            .containsEntry("iss", TestKeys.CLIENT_EMAIL)
            .containsEntry("aud", TestKeys.TOKEN_URI)
            .containsEntry("scope", "scope-a scope-b")
            .doesNotContainKey("sub");
        assertThat(scoped.getToken()).isEqualTo("ya29.sa");
        assertThat(scoped.getExpiry()).isEqualTo(NOW.plusSeconds(3599));
    }

    @Test
    void assertionCarriesSubjectAndExtraClaims() {
        var delegated = unscoped.withScopes(List.of("scope-a"))
            .withSubject("user@example.com")
            .withClaims(Map.of("target_audience", "https://svc.example.com"));
        transport.respondJson(200, "{\"access_token\":\"ya29.user\",\"expires_in\":3599}");

        delegated.refresh(transport);

        assertThat(sentAssertion())
            .containsEntry("sub", "user@example.com")
            .containsEntry("target_audience", "https://svc.example.com");
        assertThat(codec.decodeHeader(FormBody.parse(transport.lastRequest().bodyText()).get("assertion")))
            .containsEntry("kid", TestKeys.PRIVATE_KEY_ID);
    }

    @Test
    void fromServiceAccountInfoRequiresTokenUri() {
        var info = TestKeys.serviceAccountInfo();
        info.remove("token_uri");

        assertThatThrownBy(() -> ServiceAccountCredentials.fromServiceAccountInfo(info))
            .isInstanceOf(AuthParseException.class)
            .hasMessageContaining("token_uri");
    }

    @Test
    void rejectedAssertionIsRefreshError() {
        var scoped = unscoped.withScopes(List.of("scope-a"));
        transport.respondJson(400, "{\"error\":\"invalid_scope\"}");

        assertThatThrownBy(() -> scoped.refresh(transport))
            .isInstanceOf(RefreshException.class)
            .hasMessage("invalid_scope");
        assertThat(scoped.getToken()).isNull();
    }
}
