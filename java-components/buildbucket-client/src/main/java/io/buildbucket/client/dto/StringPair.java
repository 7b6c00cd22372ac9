package io.buildbucket.client.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A key/value pair, used for build tags.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StringPair(String key, String value) {

    /**
     * Flattens a multimap of tags into the ordered pair list the service expects, one pair per value.
     */
    public static List<StringPair> fromMap(Map<String, List<String>> tags) {
        List<StringPair> result = new ArrayList<>();
        tags.forEach((key, values) -> values.forEach(v -> result.add(new StringPair(key, v))));
        return result;
    }
}
