package io.buildbucket.client;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import lombok.Builder;

/**
 * Settings for {@link BuildBucketClient}.
 *
 * @param uri the service URI, method names are appended to it
 * @param scopes OAuth scopes requested for every call
 * @param serviceAccountJson credentials handed to the token provider, may be null
 * @param accessToken a pre-issued token, if set no token provider is needed
 * @param requestTimeout timeout for a single HTTP round trip
 */
@Builder(builderClassName = "Builder", toBuilder = true)
public record BuildBucketClientConfig(String uri, List<String> scopes, String serviceAccountJson,
        String accessToken, Duration requestTimeout) {

    public static final String DEFAULT_URI = "https://cr-buildbucket.appspot.com/prpc/buildbucket.v2.Builds";
    public static final List<String> DEFAULT_SCOPES = List.of("https://www.googleapis.com/auth/userinfo.email");
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    public BuildBucketClientConfig {
        uri = uri == null ? DEFAULT_URI : uri;
        scopes = scopes == null ? DEFAULT_SCOPES : List.copyOf(scopes);
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS) : requestTimeout;
    }

    public Optional<String> optionalAccessToken() {
        return Optional.ofNullable(accessToken);
    }

    @Override
    public String toString() {
        return "BuildBucketClientConfig[uri=" + uri + ", scopes=" + scopes + ", serviceAccountJson="
                + (serviceAccountJson == null ? "unset" : "***") + ", accessToken="
                + (accessToken == null ? "unset" : "***") + ", requestTimeout=" + requestTimeout + "]";
    }

    public static BuildBucketClientConfig load() {
        return load(ConfigProvider.getConfig());
    }

    public static BuildBucketClientConfig load(Config config) {
        return BuildBucketClientConfig.builder()
                .uri(config.getOptionalValue("buildbucket.uri", String.class).orElse(DEFAULT_URI))
                .scopes(config.getOptionalValues("buildbucket.scopes", String.class).orElse(DEFAULT_SCOPES))
                .serviceAccountJson(config.getOptionalValue("buildbucket.service-account", String.class).orElse(null))
                .accessToken(config.getOptionalValue("buildbucket.access-token", String.class).orElse(null))
                .requestTimeout(Duration.ofSeconds(config.getOptionalValue("buildbucket.request-timeout", Integer.class)
                        .orElse(DEFAULT_REQUEST_TIMEOUT_SECONDS)))
                .build();
    }
}
