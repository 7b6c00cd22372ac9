package io.buildbucket.client.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;

/**
 * Looks up a build either by {@code id}, or by {@code builderId} together with {@code buildNumber}.
 */
@Builder(builderClassName = "Builder")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GetBuildRequest(
        @JsonFormat(shape = JsonFormat.Shape.STRING) Long id,
        @JsonProperty("builder") BuilderId builderId,
        Integer buildNumber,
        String fields) implements BuildBucketRequest {

}
