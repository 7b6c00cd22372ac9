package io.buildbucket.client.dto;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;

/**
 * Schedules a new build. Either {@code builderId} or {@code templateBuildId} must be set.
 */
@Builder(builderClassName = "Builder")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleBuildRequest(
        String requestId,
        @JsonFormat(shape = JsonFormat.Shape.STRING) Long templateBuildId,
        @JsonProperty("builder") BuilderId builderId,
        Trinary canary,
        Trinary experimental,
        Map<String, Object> properties,
        GitilesCommit gitilesCommit,
        List<StringPair> tags,
        List<RequestedDimension> dimensions,
        Integer priority,
        @JsonProperty("notify") NotificationConfig notification,
        String fields) implements BuildBucketRequest {

    public ScheduleBuildRequest {
        properties = Copies.map(properties);
        tags = Copies.list(tags);
        dimensions = Copies.list(dimensions);
    }
}
