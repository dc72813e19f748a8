package com.m2m.cloud.auth.defaults;

import java.util.Optional;

/**
 * One step of the default credentials chain. An empty result means "try the next step".
 */
@FunctionalInterface
public interface CredentialsSource {

    Optional<DefaultCredentials> find();
}
