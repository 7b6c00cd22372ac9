package io.buildbucket.client.dto;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

public enum Trinary {
    @JsonEnumDefaultValue
    UNSET,
    YES,
    NO
}
