package io.buildbucket.client.dto;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

public enum Status {
    @JsonEnumDefaultValue
    STATUS_UNSPECIFIED,
    SCHEDULED,
    STARTED,
    /**
     * Matches any of the ended statuses when used in a search predicate.
     */
    ENDED_MASK,
    SUCCESS,
    FAILURE,
    INFRA_FAILURE,
    CANCELED;

    public boolean isEnded() {
        return this == SUCCESS || this == FAILURE || this == INFRA_FAILURE || this == CANCELED;
    }
}
