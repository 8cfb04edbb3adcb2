package com.incoresoft.presenceTracker.domain.report.dto;

import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;

import java.time.Duration;
import java.time.Instant;

public record VerifiedVisit(
        String identityName,
        double similarity,
        Emotion dominantEmotion,
        double cumulativeMotion,
        Duration presenceDuration,
        Instant timestamp) {
}
