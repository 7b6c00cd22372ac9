package io.buildbucket.client.dto;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Bundles several requests into a single call. The service answers each one independently, in order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchRequest(List<Request> requests) implements BuildBucketRequest {

    public BatchRequest {
        requests = requests == null ? List.of() : List.copyOf(requests);
    }

    public static BatchRequest of(BuildBucketRequest... requests) {
        return new BatchRequest(Stream.of(requests).map(Request::of).toList());
    }

    /**
     * One entry of a batch. Exactly one of the fields is set.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Request(
            GetBuildRequest getBuild,
            SearchBuildsRequest searchBuilds,
            ScheduleBuildRequest scheduleBuild,
            CancelBuildRequest cancelBuild) {

        public Request {
            long set = Stream.of(getBuild, searchBuilds, scheduleBuild, cancelBuild).filter(Objects::nonNull).count();
            if (set != 1) {
                throw new IllegalArgumentException("A batch entry must hold exactly one request, got " + set);
            }
        }

        public static Request of(BuildBucketRequest request) {
            Objects.requireNonNull(request, "request");
            if (request instanceof GetBuildRequest getBuild) {
                return new Request(getBuild, null, null, null);
            } else if (request instanceof SearchBuildsRequest searchBuilds) {
                return new Request(null, searchBuilds, null, null);
            } else if (request instanceof ScheduleBuildRequest scheduleBuild) {
                return new Request(null, null, scheduleBuild, null);
            } else if (request instanceof CancelBuildRequest cancelBuild) {
                return new Request(null, null, null, cancelBuild);
            }
            throw new IllegalArgumentException("Batches cannot be nested");
        }
    }
}
