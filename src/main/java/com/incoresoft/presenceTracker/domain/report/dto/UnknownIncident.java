package com.incoresoft.presenceTracker.domain.report.dto;

import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;

import java.time.Instant;

/**
 * @param faceImage JPEG crop to archive, may be empty
 */
public record UnknownIncident(
        double similarity,
        Emotion emotion,
        byte[] faceImage,
        double cumulativeMotion,
        Instant timestamp) {
}
