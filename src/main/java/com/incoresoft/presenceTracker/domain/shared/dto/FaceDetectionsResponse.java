package com.incoresoft.presenceTracker.domain.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

@Data
public class FaceDetectionsResponse {
  @JsonProperty("data")
  private List<DetectedFaceDto> data;
  @JsonProperty("status")
  private String status;
}
