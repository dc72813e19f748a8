package com.m2m.cloud.auth.compute;

import com.fasterxml.jackson.databind.node.TextNode;
import com.m2m.cloud.auth.TestClock;
import com.m2m.cloud.auth.error.TransportException;
import com.m2m.cloud.auth.transport.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetadataClientTest {

    private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
    private static final String ROOT = "http://metadata.google.internal/computeMetadata/v1/";

    private MetadataClient metadata;
    private RecordingTransport transport;

    @BeforeEach
    void setUp() {
        metadata = new MetadataClient(new TestClock(NOW));
        transport = new RecordingTransport();
    }

    @Test
    void pingSucceedsOnOk() {
        transport.respond(200, "");

        assertThat(metadata.ping(transport)).isTrue();

        var request = transport.lastRequest();
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.url()).isEqualTo("http://169.254.169.254");
        assertThat(request.header("Metadata-Flavor")).isEqualTo("Google");
        assertThat(request.timeout()).isEqualTo(MetadataClient.DEFAULT_PING_TIMEOUT);
    }

    @Test
    void pingFailsOnOtherStatus() {
        transport.respond(500, "");

        assertThat(metadata.ping(transport)).isFalse();
    }

    @Test
    void pingFailsWhenUnreachable() {
        transport.fail(new TransportException("connect timed out"));

        assertThat(metadata.ping(transport)).isFalse();
    }

    @Test
    void pingFailsOnAnyTransportError() {
        transport.fail(new IllegalStateException("connection reset"));

        assertThat(metadata.ping(transport)).isFalse();
    }

    @Test
    void getParsesJsonResponses() {
        transport.respondJson(200, "{\"email\":\"robot@example.com\",\"scopes\":[\"a\"]}");

        var node = metadata.get(transport, "instance/service-accounts/default/?recursive=true");

        assertThat(node.path("email").asText()).isEqualTo("robot@example.com");
        assertThat(transport.lastRequest().url())
            .isEqualTo(ROOT + "instance/service-accounts/default/?recursive=true");
        assertThat(transport.lastRequest().header("metadata-flavor")).isEqualTo("Google");
    }

    @Test
    void getReturnsTextForOtherContentTypes() {
        transport.respond(200, "us-central1-a");

        var node = metadata.get(transport, "instance/zone");

        assertThat(node).isEqualTo(TextNode.valueOf("us-central1-a"));
    }

    @Test
    void getFailsOnNotFound() {
        transport.respond(404, "not found here");

        assertThatThrownBy(() -> metadata.get(transport, "instance/missing"))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("404")
            .hasMessageContaining("not found here");
    }

    @Test
    void getProjectIdReadsProjectPath() {
        transport.respond(200, "example-project");

        assertThat(metadata.getProjectId(transport)).isEqualTo("example-project");
        assertThat(transport.lastRequest().url()).isEqualTo(ROOT + "project/project-id");
    }

    @Test
    void projectIdThatIsNotTextIsNull() {
        transport.respondJson(200, "{\"x\":1}");

        assertThat(metadata.getProjectId(transport)).isNull();
    }

    @Test
    void blankProjectIdIsNull() {
        transport.respond(200, "  ");

        assertThat(metadata.getProjectId(transport)).isNull();
    }

    @Test
    void serviceAccountInfoOfNamedAccount() {
        transport.respondJson(200, "{\"email\":\"other@example.com\"}");

        var info = metadata.getServiceAccountInfo(transport, "other@example.com");

        assertThat(info.path("email").asText()).isEqualTo("other@example.com");
        assertThat(transport.lastRequest().url())
            .isEqualTo(ROOT + "instance/service-accounts/other@example.com/?recursive=true");
    }

    @Test
    void serviceAccountTokenExpiresAfterExpiresIn() {
        transport.respondJson(200, "{\"access_token\":\"ya29.gce\",\"expires_in\":3599,\"token_type\":\"Bearer\"}");

        var token = metadata.getServiceAccountToken(transport);

        assertThat(token.tokenValue()).isEqualTo("ya29.gce");
        assertThat(token.expiry()).isEqualTo(NOW.plusSeconds(3599));
        assertThat(transport.lastRequest().url()).isEqualTo(ROOT + "instance/service-accounts/default/token");
    }

    @Test
    void forHostUsesHostForReadsAndPings() {
        var emulator = MetadataClient.forHost("localhost:8080", new TestClock(NOW));

        assertThat(emulator.getRoot()).isEqualTo("http://localhost:8080/computeMetadata/v1/");
        assertThat(emulator.getPingRoot()).isEqualTo("http://localhost:8080");
    }
}
