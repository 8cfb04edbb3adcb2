package com.incoresoft.presenceTracker.domain.session.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only copy of a presence session at one point in time.
 *
 * @param since          start of the current Pending or Confirmed phase, null when Idle
 * @param emotionCounts  per-label counts since confirmation; empty unless Confirmed
 */
public record PresenceSnapshot(
        @JsonProperty("identity") String identityName,
        @JsonProperty("phase") PresencePhase phase,
        @JsonProperty("since") Instant since,
        @JsonProperty("cumulative_motion") double cumulativeMotion,
        @JsonIgnore Map<Emotion, Integer> emotionCounts) {

    public PresenceSnapshot {
        Map<Emotion, Integer> copy = new EnumMap<>(Emotion.class);
        copy.putAll(emotionCounts);
        emotionCounts = Collections.unmodifiableMap(copy);
    }

    @JsonIgnore
    public boolean isConfirmed() {
        return phase == PresencePhase.CONFIRMED;
    }

    @JsonProperty("emotion_counts")
    public Map<String, Integer> emotionCountsByLabel() {
        Map<String, Integer> byLabel = new LinkedHashMap<>();
        emotionCounts.forEach((e, c) -> byLabel.put(e.label(), c));
        return byLabel;
    }

    /** Time spent confirmed, zero in any other phase. */
    public Duration confirmedFor(Instant now) {
        if (!isConfirmed() || since == null || now.isBefore(since)) return Duration.ZERO;
        return Duration.between(since, now);
    }

    /** Most frequent label; ties resolve to the earlier label of the fixed set. */
    public Optional<Emotion> dominantEmotion() {
        Emotion best = null;
        int bestCount = 0;
        for (Emotion e : Emotion.values()) {
            int c = emotionCounts.getOrDefault(e, 0);
            if (c > bestCount) {
                best = e;
                bestCount = c;
            }
        }
        return Optional.ofNullable(best);
    }
}
