package com.incoresoft.presenceTracker.domain.history.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param history most recent first
 * @param total   number of retained events matching the filter, before the limit
 */
public record HistoryPage(
        @JsonProperty("history") List<DetectionEvent> history,
        @JsonProperty("total") int total) {
}
