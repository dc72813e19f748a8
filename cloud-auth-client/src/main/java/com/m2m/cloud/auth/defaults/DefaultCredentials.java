package com.m2m.cloud.auth.defaults;

import com.m2m.cloud.auth.Credentials;

import java.util.Objects;
import java.util.Optional;

/**
 * Credentials found by discovery, with the project they belong to when it could be determined.
 */
public record DefaultCredentials(Credentials credentials, String projectId) {

    public DefaultCredentials {
        Objects.requireNonNull(credentials, "credentials");
    }

    public Optional<String> project() {
        return Optional.ofNullable(projectId);
    }

    public DefaultCredentials withProjectId(String projectId) {
        return new DefaultCredentials(credentials, projectId);
    }
}
