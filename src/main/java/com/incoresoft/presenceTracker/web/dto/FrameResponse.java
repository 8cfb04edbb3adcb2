package com.incoresoft.presenceTracker.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incoresoft.presenceTracker.domain.history.dto.DetectionEvent;

import java.util.List;

public record FrameResponse(
        @JsonProperty("detections") List<DetectionEvent> detections,
        @JsonProperty("total_faces") int totalFaces) {

    public static FrameResponse of(List<DetectionEvent> detections) {
        return new FrameResponse(detections, detections.size());
    }
}
