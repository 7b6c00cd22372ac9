package io.buildbucket.client.auth;

import java.util.List;

/**
 * Source of access tokens for calls to BuildBucket.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    /**
     * Obtain a token for the given service account, valid for the requested scopes.
     *
     * @param serviceAccountJson the service account credentials, may be null if the provider does not need them
     * @param scopes OAuth scopes the token must cover
     *
     * @return the token
     * @throws TokenAcquisitionException if no token could be obtained
     */
    AccessToken createAccessToken(String serviceAccountJson, List<String> scopes);
}
