package io.buildbucket.client.auth;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.Validate;

/**
 * Hands out a token that was issued up front, e.g. one passed in through configuration.
 */
public class StaticAccessTokenProvider implements AccessTokenProvider {

    private final AccessToken token;
    private final Clock clock;

    public StaticAccessTokenProvider(String token) {
        this(new AccessToken("Bearer", Validate.notBlank(token, "access token must not be blank"), null),
                Clock.systemUTC());
    }

    public StaticAccessTokenProvider(AccessToken token, Clock clock) {
        this.token = Objects.requireNonNull(token, "token");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public AccessToken createAccessToken(String serviceAccountJson, List<String> scopes) {
        if (token.hasExpired(clock.instant())) {
            throw new TokenAcquisitionException("Configured access token expired at " + token.expiry());
        }
        return token;
    }
}
