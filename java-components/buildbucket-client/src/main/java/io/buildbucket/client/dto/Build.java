package io.buildbucket.client.dto;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;

/**
 * A single build as reported by BuildBucket.
 */
@Builder(builderClassName = "Builder")
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Build(
        @JsonFormat(shape = JsonFormat.Shape.STRING) Long id,
        @JsonProperty("builder") BuilderId builderId,
        Integer number,
        String createdBy,
        String canceledBy,
        Instant createTime,
        Instant startTime,
        Instant endTime,
        Instant updateTime,
        Status status,
        String summaryMarkdown,
        Trinary critical,
        Input input,
        Output output,
        List<StringPair> tags) {

    public Build {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
