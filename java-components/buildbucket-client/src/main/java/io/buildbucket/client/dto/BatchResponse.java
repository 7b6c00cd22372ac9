package io.buildbucket.client.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Responses to a {@link BatchRequest}, in request order. Individual entries may carry an {@link GrpcStatus error}
 * even though the call as a whole succeeded.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record BatchResponse(List<Response> responses) {

    public BatchResponse {
        responses = responses == null ? List.of() : List.copyOf(responses);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Response(
            Build getBuild,
            SearchBuildsResponse searchBuilds,
            Build scheduleBuild,
            Build cancelBuild,
            GrpcStatus error) {

        public boolean hasError() {
            return error != null;
        }
    }
}
