package com.incoresoft.presenceTracker.domain.history.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate over the retained history window.
 *
 * @param emotionCounts every label of the fixed set, zero-filled, in label order
 */
public record HistoryStats(
        @JsonProperty("total_users") int totalUsers,
        @JsonProperty("total_detections") int totalDetections,
        @JsonProperty("known_detections") int knownDetections,
        @JsonProperty("unknown_detections") int unknownDetections,
        @JsonProperty("recent_detections") int recentDetections,
        @JsonProperty("average_motion") double averageMotion,
        @JsonProperty("emotion_counts") Map<String, Integer> emotionCounts) {
}
