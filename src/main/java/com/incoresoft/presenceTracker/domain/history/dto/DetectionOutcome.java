package com.incoresoft.presenceTracker.domain.history.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionOutcome {
    /** known identity with a confirmed session, verified visit report written */
    VERIFIED("verified"),
    /** below the unknown threshold, incident archived */
    UNKNOWN_INCIDENT("unknown_incident"),
    /** grey zone or not yet confirmed, history only */
    OBSERVED("observed");

    private final String wireName;

    DetectionOutcome(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
