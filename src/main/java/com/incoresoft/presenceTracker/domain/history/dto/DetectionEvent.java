package com.incoresoft.presenceTracker.domain.history.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;
import com.incoresoft.presenceTracker.domain.matching.dto.MatchClass;
import com.incoresoft.presenceTracker.domain.shared.dto.BoundingBox;

import java.time.Instant;

/**
 * One face resolution of one frame, as kept in the history ledger.
 * Motion and similarity values are rounded to one decimal on creation.
 *
 * @param identityLabel registered name for known faces, {@code unknown} otherwise
 * @param location      null for events restored from report files
 */
public record DetectionEvent(
        @JsonProperty("user") String identityLabel,
        @JsonProperty("similarity") double similarity,
        @JsonProperty("emotion") Emotion emotion,
        @JsonProperty("motion") double instantaneousMotion,
        @JsonProperty("total_motion") double cumulativeMotion,
        @JsonProperty("is_known") boolean known,
        @JsonProperty("classification") MatchClass classification,
        @JsonProperty("outcome") DetectionOutcome outcome,
        @JsonProperty("location") BoundingBox location,
        @JsonProperty("timestamp") Instant timestamp) {

    public static final String UNKNOWN_LABEL = "unknown";

    public DetectionEvent {
        similarity = round1(similarity);
        instantaneousMotion = round1(instantaneousMotion);
        cumulativeMotion = round1(cumulativeMotion);
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
