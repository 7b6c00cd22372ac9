package io.buildbucket.client.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;

/**
 * Filter for {@link SearchBuildsRequest}. Unset fields do not constrain the search.
 */
@Builder(builderClassName = "Builder")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record BuildPredicate(
        @JsonProperty("builder") BuilderId builderId,
        Status status,
        String createdBy,
        List<StringPair> tags,
        Boolean includeExperimental) {

    public BuildPredicate {
        tags = Copies.list(tags);
    }
}
