package io.buildbucket.client.auth;

import java.time.Instant;

/**
 * An OAuth access token. {@code type} is the authorization scheme, normally {@code Bearer}.
 */
public record AccessToken(String type, String data, Instant expiry) {

    public boolean hasExpired(Instant now) {
        return expiry != null && !now.isBefore(expiry);
    }

    @Override
    public String toString() {
        return "AccessToken[type=" + type + ", expiry=" + expiry + "]";
    }
}
