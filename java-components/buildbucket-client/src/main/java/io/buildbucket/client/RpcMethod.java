package io.buildbucket.client;

import java.util.List;

import io.buildbucket.client.dto.BatchRequest;
import io.buildbucket.client.dto.BatchResponse;
import io.buildbucket.client.dto.Build;
import io.buildbucket.client.dto.BuildBucketRequest;
import io.buildbucket.client.dto.CancelBuildRequest;
import io.buildbucket.client.dto.GetBuildRequest;
import io.buildbucket.client.dto.ScheduleBuildRequest;
import io.buildbucket.client.dto.SearchBuildsRequest;
import io.buildbucket.client.dto.SearchBuildsResponse;

/**
 * One of the BuildBucket RPC methods. The name is the path segment appended to the service URI, and the response
 * type is what a successful call decodes to.
 *
 * @param <Q> the request type
 * @param <R> the response type
 */
public final class RpcMethod<Q extends BuildBucketRequest, R> {

    public static final RpcMethod<ScheduleBuildRequest, Build> SCHEDULE_BUILD = new RpcMethod<>("ScheduleBuild",
            Build.class);
    public static final RpcMethod<CancelBuildRequest, Build> CANCEL_BUILD = new RpcMethod<>("CancelBuild",
            Build.class);
    public static final RpcMethod<GetBuildRequest, Build> GET_BUILD = new RpcMethod<>("GetBuild", Build.class);
    public static final RpcMethod<SearchBuildsRequest, SearchBuildsResponse> SEARCH_BUILDS = new RpcMethod<>(
            "SearchBuilds", SearchBuildsResponse.class);
    public static final RpcMethod<BatchRequest, BatchResponse> BATCH = new RpcMethod<>("Batch", BatchResponse.class);

    private static final List<RpcMethod<?, ?>> VALUES = List.of(SCHEDULE_BUILD, CANCEL_BUILD, GET_BUILD,
            SEARCH_BUILDS, BATCH);

    private final String name;
    private final Class<R> responseType;

    private RpcMethod(String name, Class<R> responseType) {
        this.name = name;
        this.responseType = responseType;
    }

    public static List<RpcMethod<?, ?>> values() {
        return VALUES;
    }

    public String getName() {
        return name;
    }

    public Class<R> getResponseType() {
        return responseType;
    }

    @Override
    public String toString() {
        return name;
    }
}
