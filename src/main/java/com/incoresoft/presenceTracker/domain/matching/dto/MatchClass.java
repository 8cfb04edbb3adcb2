package com.incoresoft.presenceTracker.domain.matching.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Three-way classification of a best-match similarity.
 */
public enum MatchClass {
    /** at or above the known threshold: candidate for a presence session */
    KNOWN("known"),
    /** matched, but neither promoted to known nor logged as unknown */
    GREY_ZONE("grey_zone"),
    /** below the unknown threshold: incident-worthy */
    UNKNOWN("unknown");

    private final String wireName;

    MatchClass(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static MatchClass of(double similarity, double knownThreshold, double unknownThreshold) {
        if (similarity >= knownThreshold) return KNOWN;
        if (similarity < unknownThreshold) return UNKNOWN;
        return GREY_ZONE;
    }
}
