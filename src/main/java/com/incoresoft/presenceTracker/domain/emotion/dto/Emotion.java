package com.incoresoft.presenceTracker.domain.emotion.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed label set of the emotion classifier. Declaration order is the classifier's output index order.
 */
public enum Emotion {
    ANGRY("angry"),
    DISGUSTED("disgusted"),
    SAD("sad"),
    FEARFUL("fearful"),
    HAPPY("happy"),
    SURPRISED("surprised"),
    NEUTRAL("neutral");

    private final String label;

    Emotion(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<Emotion> fromLabel(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Emotion e : values()) {
            if (e.label.equals(normalized)) return Optional.of(e);
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Emotion fromJson(String raw) {
        return fromLabel(raw).orElseThrow(() -> new IllegalArgumentException("Unknown emotion label: " + raw));
    }
}
