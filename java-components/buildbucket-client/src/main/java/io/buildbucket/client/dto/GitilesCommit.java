package io.buildbucket.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

/**
 * A commit in a Gitiles repository. {@code id} is the full commit hash.
 */
@Builder(builderClassName = "Builder")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitilesCommit(String host, String project, String id, String ref, Integer position) {

}
