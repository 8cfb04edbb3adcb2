package com.incoresoft.presenceTracker.domain.identity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record IdentitySummary(
        @JsonProperty("name") String name,
        @JsonProperty("registration_date") Instant registrationDate) {
}
