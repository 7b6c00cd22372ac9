package io.buildbucket.client.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

@Builder(builderClassName = "Builder")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Output(Map<String, Object> properties, GitilesCommit gitilesCommit, String summaryMarkdown) {

    public Output {
        properties = Copies.map(properties);
    }
}
