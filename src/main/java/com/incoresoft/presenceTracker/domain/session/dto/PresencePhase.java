package com.incoresoft.presenceTracker.domain.session.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PresencePhase {
    IDLE,
    PENDING,
    CONFIRMED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
