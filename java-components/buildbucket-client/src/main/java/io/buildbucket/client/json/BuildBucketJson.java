package io.buildbucket.client.json;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

/**
 * Builds the {@link ObjectMapper} used for the BuildBucket wire format.
 */
public final class BuildBucketJson {

    private BuildBucketJson() {
    }

    public static ObjectMapper createObjectMapper() {
        SimpleModule timestamps = new SimpleModule("buildbucket-timestamps")
                .addSerializer(Instant.class, ToStringSerializer.instance)
                .addDeserializer(Instant.class, new TimestampDeserializer());
        return new ObjectMapper()
                .registerModule(timestamps)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_USING_DEFAULT_VALUE, true);
    }
}
