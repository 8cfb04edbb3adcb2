package com.incoresoft.presenceTracker.domain.identity.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record IdentityListResponse(
        @JsonProperty("users") List<IdentitySummary> users,
        @JsonProperty("total") int total) {
}
