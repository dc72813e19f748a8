package com.m2m.cloud.auth.transport;

import java.util.Set;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class AuthorizedTransportConfig {

    private Set<Integer> refreshStatusCodes = Set.of(401);
    private int maxRefreshAttempts = 2;

    public boolean isRefreshStatus(int status) {
        return refreshStatusCodes != null && refreshStatusCodes.contains(status);
    }

}
