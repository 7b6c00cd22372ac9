package io.buildbucket.client.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;

@Builder(builderClassName = "Builder")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record CancelBuildRequest(
        @JsonFormat(shape = JsonFormat.Shape.STRING) Long id,
        String summaryMarkdown,
        String fields) implements BuildBucketRequest {

}
