package com.incoresoft.presenceTracker.domain.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class EmotionResponse {
    @JsonProperty("label") private String label;
    @JsonProperty("status") private String status;
}
