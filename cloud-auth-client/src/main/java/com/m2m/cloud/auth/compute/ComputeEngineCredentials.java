package com.m2m.cloud.auth.compute;

import com.m2m.cloud.auth.AccessToken;
import com.m2m.cloud.auth.Credentials;
import com.m2m.cloud.auth.error.AuthParseException;
import com.m2m.cloud.auth.error.RefreshException;
import com.m2m.cloud.auth.error.TransportException;
import com.m2m.cloud.auth.transport.Transport;
import lombok.Getter;

import java.time.Clock;
import java.util.Objects;

/**
 * Credentials of the service account attached to the instance, fetched from the metadata
 * service on each refresh. No secret is held locally.
 */
public class ComputeEngineCredentials extends Credentials {

    private final MetadataClient metadata;
    @Getter
    private final String serviceAccount;

    public ComputeEngineCredentials() {
        this(new MetadataClient(), MetadataClient.DEFAULT_SERVICE_ACCOUNT, Clock.systemUTC());
    }

    public ComputeEngineCredentials(MetadataClient metadata) {
        this(metadata, MetadataClient.DEFAULT_SERVICE_ACCOUNT, Clock.systemUTC());
    }

    public ComputeEngineCredentials(MetadataClient metadata, String serviceAccount, Clock clock) {
        super(clock);
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.serviceAccount = Objects.requireNonNull(serviceAccount, "serviceAccount");
    }

    @Override
    public void refresh(Transport transport) {
        AccessToken accessToken;
        try {
            accessToken = metadata.getServiceAccountToken(transport, serviceAccount);
        } catch (TransportException | AuthParseException e) {
            throw new RefreshException("Failed to fetch a token from the metadata server: " + e.getMessage(), e);
        }
        this.token = accessToken.tokenValue();
        this.expiry = accessToken.expiry();
    }
}
