package com.m2m.cloud.auth.defaults;

import com.m2m.cloud.auth.compute.ComputeEngineCredentials;
import com.m2m.cloud.auth.compute.MetadataClient;
import com.m2m.cloud.auth.error.AuthParseException;
import com.m2m.cloud.auth.error.DefaultCredentialsException;
import com.m2m.cloud.auth.error.TransportException;
import com.m2m.cloud.auth.transport.JdkHttpTransport;
import com.m2m.cloud.auth.transport.Transport;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Discovers Application Default Credentials.
 *
 * <p>Sources are tried in order and the first that yields credentials wins:
 * <ol>
 *     <li>the key file named by {@value #CREDENTIALS_ENV},</li>
 *     <li>the credentials stored by {@code gcloud auth application-default login} in the Cloud SDK
 *     configuration directory, with the SDK's active project,</li>
 *     <li>the App Engine standard identity, which this library does not support,</li>
 *     <li>the Compute Engine metadata service, with the instance's project.</li>
 * </ol>
 * A project set through {@value #PROJECT_ENV} or {@value #LEGACY_PROJECT_ENV} overrides the one
 * the source reported.
 */
@Slf4j
public class DefaultCredentialsProvider {
    public static final String CREDENTIALS_ENV = "GOOGLE_APPLICATION_CREDENTIALS";
    public static final String PROJECT_ENV = "GOOGLE_CLOUD_PROJECT";
    public static final String LEGACY_PROJECT_ENV = "GCLOUD_PROJECT";
    public static final String CLOUDSDK_CONFIG_ENV = "CLOUDSDK_CONFIG";
    public static final String METADATA_HOST_ENV = "GCE_METADATA_HOST";

    static final String CLOUDSDK_CONFIG_DIRECTORY = "gcloud";
    static final String CLOUDSDK_CREDENTIALS_FILENAME = "application_default_credentials.json";

    static final String HELP_MESSAGE = "Could not automatically determine credentials. Please set "
        + CREDENTIALS_ENV + " or explicitly create credentials and re-run the application. For more "
        + "information, please see https://developers.google.com/accounts/docs/application-default-credentials.";

    private final Environment environment;
    private final Transport transport;
    private final CredentialsFileLoader loader;
    private final MetadataClient metadata;

    public DefaultCredentialsProvider() {
        this(new SystemEnvironment(), new JdkHttpTransport());
    }

    public DefaultCredentialsProvider(Environment environment, Transport transport) {
        this(environment, transport, new CredentialsFileLoader(), metadataClientFor(environment));
    }

    public DefaultCredentialsProvider(Environment environment, Transport transport,
                                      CredentialsFileLoader loader, MetadataClient metadata) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    private static MetadataClient metadataClientFor(Environment environment) {
        String host = environment.getenv(METADATA_HOST_ENV);
        return host == null ? new MetadataClient() : MetadataClient.forHost(host, Clock.systemUTC());
    }

    /**
     * @throws DefaultCredentialsException if no source yields credentials, or a matched source is
     *                                     unusable
     */
    public DefaultCredentials getDefault() {
        String explicitProjectId = explicitProjectId();

        for (CredentialsSource source : sources()) {
            Optional<DefaultCredentials> found = source.find();
            if (found.isPresent()) {
                DefaultCredentials credentials = found.get();
                return explicitProjectId != null ? credentials.withProjectId(explicitProjectId) : credentials;
            }
        }
        throw new DefaultCredentialsException(HELP_MESSAGE);
    }

    List<CredentialsSource> sources() {
        return List.of(
            this::explicitEnvironmentCredentials,
            this::cloudSdkCredentials,
            this::appEngineCredentials,
            this::computeEngineCredentials);
    }

    private String explicitProjectId() {
        String projectId = nonBlank(environment.getenv(PROJECT_ENV));
        return projectId != null ? projectId : nonBlank(environment.getenv(LEGACY_PROJECT_ENV));
    }

    private static String nonBlank(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    Optional<DefaultCredentials> explicitEnvironmentCredentials() {
        String explicitFile = environment.getenv(CREDENTIALS_ENV);
        if (explicitFile == null) {
            return Optional.empty();
        }
        log.debug("Loading credentials from {} named by {}", explicitFile, CREDENTIALS_ENV);
        return Optional.of(loader.load(Path.of(explicitFile)));
    }

    Optional<DefaultCredentials> cloudSdkCredentials() {
        Path configDirectory = cloudSdkConfigDirectory();
        Path credentialsFile = configDirectory.resolve(CLOUDSDK_CREDENTIALS_FILENAME);
        if (!Files.exists(credentialsFile)) {
            log.debug("No Cloud SDK credentials at {}", credentialsFile);
            return Optional.empty();
        }

        log.debug("Loading Cloud SDK credentials from {}", credentialsFile);
        DefaultCredentials credentials = loader.load(credentialsFile);
        if (credentials.projectId() == null) {
            credentials = credentials.withProjectId(CloudSdkConfig.readProjectId(configDirectory).orElse(null));
        }
        return Optional.of(credentials);
    }

    Optional<DefaultCredentials> appEngineCredentials() {
        log.debug("App Engine standard identity is not supported, skipping");
        return Optional.empty();
    }

    Optional<DefaultCredentials> computeEngineCredentials() {
        if (!metadata.ping(transport)) {
            log.debug("Metadata server is not available, skipping Compute Engine credentials");
            return Optional.empty();
        }

        String projectId;
        try {
            projectId = metadata.getProjectId(transport);
        } catch (TransportException | AuthParseException e) {
            log.warn("Unable to read the project id from the metadata server: {}", e.getMessage());
            projectId = null;
        }
        return Optional.of(new DefaultCredentials(new ComputeEngineCredentials(metadata), projectId));
    }

    Path cloudSdkConfigDirectory() {
        String override = environment.getenv(CLOUDSDK_CONFIG_ENV);
        if (override != null) {
            return Path.of(override);
        }

        String osName = environment.getProperty("os.name");
        if (osName != null && osName.startsWith("Windows")) {
            String appData = environment.getenv("APPDATA");
            if (appData != null) {
                return Path.of(appData, CLOUDSDK_CONFIG_DIRECTORY);
            }
            String drive = environment.getenv("SystemDrive");
            return Path.of(drive != null ? drive : "C:", "\\", CLOUDSDK_CONFIG_DIRECTORY);
        }
        return Path.of(environment.getProperty("user.home"), ".config", CLOUDSDK_CONFIG_DIRECTORY);
    }
}
