package com.m2m.cloud.auth;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Credentials whose access is limited to a set of OAuth2 scopes.
 */
public interface Scoped {

    /**
     * @return the scopes, or {@code null} if none were set
     */
    List<String> getScopes();

    /**
     * Whether the credential is unusable until {@link #withScopes(Collection)} is called.
     */
    default boolean requiresScopes() {
        return false;
    }

    /**
     * Returns a copy of the credential limited to {@code scopes}; the receiver is unchanged.
     *
     * @throws UnsupportedOperationException if the scopes were fixed when the token was issued
     */
    Credentials withScopes(Collection<String> scopes);

    default Credentials withScopes(String scopes) {
        return withScopes(splitScopes(scopes));
    }

    default boolean hasScopes(Collection<String> required) {
        List<String> scopes = getScopes();
        return scopes != null && scopes.containsAll(required);
    }

    static List<String> splitScopes(String scopes) {
        if (scopes == null || scopes.isBlank()) {
            return List.of();
        }
        return Arrays.stream(scopes.trim().split("\\s+")).toList();
    }
}
