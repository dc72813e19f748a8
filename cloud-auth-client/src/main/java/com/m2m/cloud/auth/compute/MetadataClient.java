package com.m2m.cloud.auth.compute;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.m2m.cloud.auth.AccessToken;
import com.m2m.cloud.auth.error.AuthParseException;
import com.m2m.cloud.auth.error.TransportException;
import com.m2m.cloud.auth.transport.Response;
import com.m2m.cloud.auth.transport.Transport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the instance metadata service available to workloads on Compute Engine and related
 * platforms.
 */
@Slf4j
public class MetadataClient {
    public static final String DEFAULT_HOST = "metadata.google.internal";
    public static final String DEFAULT_IP = "169.254.169.254";
    public static final Map<String, String> METADATA_HEADERS = Map.of("Metadata-Flavor", "Google");
    public static final Duration DEFAULT_PING_TIMEOUT = Duration.ofSeconds(3);
    public static final String DEFAULT_SERVICE_ACCOUNT = "default";

    @Getter
    private final String root;
    @Getter
    private final String pingRoot;
    private final Duration pingTimeout;
    private final ObjectMapper mapper;
    private final Clock clock;

    public MetadataClient() {
        this(Clock.systemUTC());
    }

    public MetadataClient(Clock clock) {
        this(rootFor(DEFAULT_HOST), "http://" + DEFAULT_IP, DEFAULT_PING_TIMEOUT, clock);
    }

    public MetadataClient(String root, String pingRoot, Duration pingTimeout, Clock clock) {
        this.root = Objects.requireNonNull(root, "root");
        this.pingRoot = Objects.requireNonNull(pingRoot, "pingRoot");
        this.pingTimeout = pingTimeout;
        this.mapper = new ObjectMapper();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Client talking to {@code host} for both metadata reads and pings, for emulators and tests.
     */
    public static MetadataClient forHost(String host, Clock clock) {
        return new MetadataClient(rootFor(host), "http://" + host, DEFAULT_PING_TIMEOUT, clock);
    }

    private static String rootFor(String host) {
        return "http://" + host + "/computeMetadata/v1/";
    }

    /**
     * Checks whether the metadata service is reachable. Never throws.
     */
    public boolean ping(Transport transport) {
        try {
            Response response = transport.request("GET", pingRoot, METADATA_HEADERS, null, pingTimeout);
            log.debug("Metadata server ping answered {}", response.status());
            return response.status() == 200;
        } catch (RuntimeException e) {
            log.debug("Metadata server is not reachable: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Fetches {@code root + path}. JSON responses are parsed, anything else is returned as a
     * {@link TextNode}.
     *
     * @throws TransportException on a non-2xx response
     */
    public JsonNode get(Transport transport, String path) {
        String url = root + path;
        Response response = transport.request("GET", url, METADATA_HEADERS);
        String body = response.text();

        if (!response.isSuccessful()) {
            throw new TransportException("Failed to retrieve " + url + " from the metadata server. Status "
                + response.status() + ", response: " + body);
        }

        String contentType = response.header("Content-Type");
        if (contentType != null && contentType.startsWith("application/json")) {
            try {
                return mapper.readTree(body);
            } catch (JsonProcessingException e) {
                throw new AuthParseException("Metadata server returned invalid JSON for " + url, e);
            }
        }
        return TextNode.valueOf(body);
    }

    /**
     * @return the project id, or {@code null} if the server answered with anything but a non-blank string
     */
    public String getProjectId(Transport transport) {
        JsonNode projectId = get(transport, "project/project-id");
        if (!projectId.isTextual() || projectId.asText().isBlank()) {
            return null;
        }
        return projectId.asText();
    }

    public JsonNode getServiceAccountInfo(Transport transport) {
        return getServiceAccountInfo(transport, DEFAULT_SERVICE_ACCOUNT);
    }

    /**
     * Returns the whole metadata subtree of a service account (email, aliases, scopes).
     */
    public JsonNode getServiceAccountInfo(Transport transport, String serviceAccount) {
        return get(transport, serviceAccountPath(serviceAccount) + "/?recursive=true");
    }

    public AccessToken getServiceAccountToken(Transport transport) {
        return getServiceAccountToken(transport, DEFAULT_SERVICE_ACCOUNT);
    }

    /**
     * Fetches an access token for a service account attached to the instance.
     */
    public AccessToken getServiceAccountToken(Transport transport, String serviceAccount) {
        JsonNode tokenResponse = get(transport, serviceAccountPath(serviceAccount) + "/token");
        if (!tokenResponse.hasNonNull("access_token")) {
            throw new AuthParseException("Metadata token response has no access_token");
        }
        long expiresIn = tokenResponse.path("expires_in").asLong(0);
        return new AccessToken(tokenResponse.get("access_token").asText(), clock.instant().plusSeconds(expiresIn));
    }

    private static String serviceAccountPath(String serviceAccount) {
        return "instance/service-accounts/" + serviceAccount;
    }
}
