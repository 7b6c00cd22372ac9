package io.buildbucket.client.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

/**
 * Build input: the properties and commit a build was scheduled with.
 */
@Builder(builderClassName = "Builder")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Input(Map<String, Object> properties, GitilesCommit gitilesCommit, Trinary experimental) {

    public Input {
        properties = Copies.map(properties);
    }
}
