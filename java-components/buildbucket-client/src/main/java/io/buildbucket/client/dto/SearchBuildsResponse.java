package io.buildbucket.client.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

/**
 * A page of builds. {@code nextPageToken} is absent on the last page.
 */
@Builder(builderClassName = "Builder")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SearchBuildsResponse(List<Build> builds, String nextPageToken) {

    public SearchBuildsResponse {
        builds = builds == null ? List.of() : List.copyOf(builds);
    }
}
