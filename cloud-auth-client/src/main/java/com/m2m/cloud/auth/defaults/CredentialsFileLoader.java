package com.m2m.cloud.auth.defaults;

import com.m2m.cloud.auth.CredentialsJson;
import com.m2m.cloud.auth.JwtCredentials;
import com.m2m.cloud.auth.error.DefaultCredentialsException;
import com.m2m.cloud.auth.error.InvalidCredentialTypeException;
import com.m2m.cloud.auth.oauth2.OAuth2Credentials;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.m2m.cloud.auth.CredentialsJson.optionalString;
import static com.m2m.cloud.auth.CredentialsJson.requireString;

/**
 * Loads a service account key or stored authorized user credentials from a JSON file.
 */
public class CredentialsFileLoader {
    public static final String AUTHORIZED_USER_TYPE = "authorized_user";
    public static final String SERVICE_ACCOUNT_TYPE = "service_account";
    public static final List<String> VALID_TYPES = List.of(AUTHORIZED_USER_TYPE, SERVICE_ACCOUNT_TYPE);

    /**
     * Token endpoint authorized user credentials are refreshed against.
     */
    public static final String GOOGLE_OAUTH2_TOKEN_ENDPOINT = "https://accounts.google.com/o/oauth2/token";

    private final Clock clock;

    public CredentialsFileLoader() {
        this(Clock.systemUTC());
    }

    public CredentialsFileLoader(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Authorized user files carry no project, service account files may carry {@code project_id}.
     *
     * @throws com.m2m.cloud.auth.error.AuthParseException if the file is not JSON or misses a field
     * @throws InvalidCredentialTypeException              if {@code type} is not one of {@link #VALID_TYPES}
     * @throws DefaultCredentialsException                 if the file can not be read or its key is unusable
     */
    public DefaultCredentials load(Path file) {
        Map<String, Object> info;
        try {
            info = CredentialsJson.read(file);
        } catch (UncheckedIOException e) {
            throw new DefaultCredentialsException("Unable to read credentials file " + file, e.getCause());
        }

        String type = optionalString(info, "type");

        if (AUTHORIZED_USER_TYPE.equals(type)) {
            var credentials = new OAuth2Credentials(
                null,
                requireString(info, "refresh_token"),
                GOOGLE_OAUTH2_TOKEN_ENDPOINT,
                requireString(info, "client_id"),
                requireString(info, "client_secret"),
                null,
                clock);
            return new DefaultCredentials(credentials, null);
        }

        if (SERVICE_ACCOUNT_TYPE.equals(type)) {
            try {
                var credentials = JwtCredentials.fromServiceAccountInfo(info, null, clock);
                return new DefaultCredentials(credentials, optionalString(info, "project_id"));
            } catch (IllegalArgumentException e) {
                throw new DefaultCredentialsException("File " + file + " holds an unusable private key", e);
            }
        }

        throw new InvalidCredentialTypeException("The file " + file + " does not have a valid type. Type is "
            + type + ", expected one of " + VALID_TYPES + ".");
    }
}
