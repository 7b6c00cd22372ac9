package io.buildbucket.client.dto;

/**
 * A request that can be sent to one of the BuildBucket RPC methods.
 */
public sealed interface BuildBucketRequest
        permits ScheduleBuildRequest, CancelBuildRequest, GetBuildRequest, SearchBuildsRequest, BatchRequest {

}
