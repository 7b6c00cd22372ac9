package io.buildbucket.client;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.buildbucket.client.auth.AccessToken;
import io.buildbucket.client.auth.AccessTokenProvider;
import io.buildbucket.client.auth.StaticAccessTokenProvider;
import io.buildbucket.client.dto.BatchRequest;
import io.buildbucket.client.dto.BatchResponse;
import io.buildbucket.client.dto.Build;
import io.buildbucket.client.dto.BuildBucketRequest;
import io.buildbucket.client.dto.CancelBuildRequest;
import io.buildbucket.client.dto.GetBuildRequest;
import io.buildbucket.client.dto.ScheduleBuildRequest;
import io.buildbucket.client.dto.SearchBuildsRequest;
import io.buildbucket.client.dto.SearchBuildsResponse;
import io.buildbucket.client.json.BuildBucketJson;
import io.buildbucket.client.transport.HttpTransport;
import io.buildbucket.client.transport.HttpTransportResponse;
import io.buildbucket.client.transport.JdkHttpTransport;

/**
 * Client for the BuildBucket pRPC API.
 * <p>
 * Every call fetches a fresh token from the {@link AccessTokenProvider}, POSTs the JSON encoded request to
 * {@code <uri>/<method>} and decodes the response. Instances hold no mutable state and can be shared between threads.
 */
public class BuildBucketClient {

    private static final Logger logger = LoggerFactory.getLogger(BuildBucketClient.class);

    /**
     * Prefix the service puts in front of every JSON response body to prevent it being evaluated as script.
     */
    public static final String RPC_RESPONSE_PREAMBLE = ")]}'";

    private static final ObjectMapper MAPPER = BuildBucketJson.createObjectMapper();

    private final String uri;
    private final List<String> scopes;
    private final String serviceAccountJson;
    private final HttpTransport transport;
    private final AccessTokenProvider accessTokenProvider;

    public BuildBucketClient(BuildBucketClientConfig config, HttpTransport transport,
            AccessTokenProvider accessTokenProvider) {
        this.uri = Objects.requireNonNull(config.uri(), "uri");
        this.scopes = config.scopes();
        this.serviceAccountJson = config.serviceAccountJson();
        this.transport = Objects.requireNonNull(transport, "transport");
        this.accessTokenProvider = Objects.requireNonNull(accessTokenProvider, "accessTokenProvider");
    }

    /**
     * Creates a client that talks HTTP through the JDK client and uses the configured access token.
     *
     * @throws IllegalStateException if the configuration has no access token
     */
    public static BuildBucketClient create(BuildBucketClientConfig config) {
        String token = config.optionalAccessToken()
                .orElseThrow(() -> new IllegalStateException(
                        "buildbucket.access-token is not set, supply an AccessTokenProvider instead"));
        return create(config, new StaticAccessTokenProvider(token));
    }

    public static BuildBucketClient create(BuildBucketClientConfig config, AccessTokenProvider accessTokenProvider) {
        return new BuildBucketClient(config, new JdkHttpTransport(config.requestTimeout()), accessTokenProvider);
    }

    public Build scheduleBuild(ScheduleBuildRequest request) {
        return invoke(RpcMethod.SCHEDULE_BUILD, request);
    }

    public Build cancelBuild(CancelBuildRequest request) {
        return invoke(RpcMethod.CANCEL_BUILD, request);
    }

    public Build getBuild(GetBuildRequest request) {
        return invoke(RpcMethod.GET_BUILD, request);
    }

    public SearchBuildsResponse searchBuilds(SearchBuildsRequest request) {
        return invoke(RpcMethod.SEARCH_BUILDS, request);
    }

    /**
     * Sends several requests in one call. Errors of individual entries are reported inside the response, they do not
     * cause this method to throw.
     */
    public BatchResponse batch(BatchRequest request) {
        return invoke(RpcMethod.BATCH, request);
    }

    /**
     * Calls {@code method} with {@code request}.
     *
     * @return the decoded response
     * @throws BuildBucketException if the service answers with a non-2xx status
     * @throws BuildBucketDecodeException if the response body cannot be decoded
     * @throws UncheckedIOException if the HTTP call fails
     */
    public <Q extends BuildBucketRequest, R> R invoke(RpcMethod<Q, R> method, Q request) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(request, "request");

        AccessToken token = accessTokenProvider.createAccessToken(serviceAccountJson, scopes);
        URI target = URI.create(uri + "/" + method.getName());
        byte[] body = encode(request);
        Map<String, String> headers = Map.of(
                "content-type", "application/json",
                "accept", "application/json",
                "authorization", "Bearer " + token.data());

        logger.debug("Calling {} at {}", method, target);
        HttpTransportResponse response;
        try {
            response = transport.post(target, headers, body);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to call " + target, e);
        }

        String text = response.bodyAsString();
        if (!response.isSuccessful()) {
            logger.warn("{} returned HTTP {}", method, response.statusCode());
            throw new BuildBucketException(response.statusCode(), text);
        }
        return decode(method, text);
    }

    private byte[] encode(BuildBucketRequest request) {
        try {
            return MAPPER.writeValueAsString(request).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to encode " + request.getClass().getSimpleName(), e);
        }
    }

    static <R> R decode(RpcMethod<?, R> method, String text) {
        if (!text.startsWith(RPC_RESPONSE_PREAMBLE)) {
            throw new BuildBucketDecodeException(method,
                    "Response to " + method + " does not start with the expected " + RPC_RESPONSE_PREAMBLE + " prefix");
        }
        String json = text.substring(RPC_RESPONSE_PREAMBLE.length());
        try {
            R result = MAPPER.readValue(json, method.getResponseType());
            if (result == null) {
                throw new BuildBucketDecodeException(method, "Response to " + method + " has no JSON payload");
            }
            return result;
        } catch (JsonProcessingException e) {
            throw new BuildBucketDecodeException(method, "Unable to decode response to " + method, e);
        }
    }
}
