package com.m2m.cloud.auth;

import com.m2m.cloud.auth.transport.Transport;

import java.time.Clock;
import java.time.Duration;

/**
 * Issues {@code token-1}, {@code token-2}, ... and counts refreshes.
 */
public class StubCredentials extends Credentials {

    private final Duration lifetime;
    private int refreshCount;

    public StubCredentials(Clock clock, Duration lifetime) {
        super(clock);
        this.lifetime = lifetime;
    }

    @Override
    public void refresh(Transport transport) {
        refreshCount++;
        token = "token-" + refreshCount;
        expiry = lifetime == null ? null : clock.instant().plus(lifetime);
    }

    public int getRefreshCount() {
        return refreshCount;
    }
}
