package com.m2m.cloud.auth;

import com.m2m.cloud.auth.jwt.RsaSigner;
import com.m2m.cloud.auth.jwt.Signer;

import java.util.Map;

import static com.m2m.cloud.auth.CredentialsJson.optionalString;
import static com.m2m.cloud.auth.CredentialsJson.requireString;

/**
 * The fields of a {@code service_account} key file this library uses.
 */
public record ServiceAccountKey(String clientEmail,
                                String privateKeyId,
                                String privateKey,
                                String tokenUri,
                                String projectId) {

    public static ServiceAccountKey fromInfo(Map<String, ?> info) {
        return new ServiceAccountKey(
            requireString(info, "client_email"),
            requireString(info, "private_key_id"),
            requireString(info, "private_key"),
            optionalString(info, "token_uri"),
            optionalString(info, "project_id"));
    }

    public Signer signer() {
        return RsaSigner.fromString(privateKey, privateKeyId);
    }

    @Override
    public String toString() {
        return "ServiceAccountKey[clientEmail=" + clientEmail + ", privateKeyId=" + privateKeyId
            + ", projectId=" + projectId + "]";
    }
}
