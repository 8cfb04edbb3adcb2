package com.incoresoft.presenceTracker.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incoresoft.presenceTracker.domain.shared.dto.DetectedFaceDto;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * Faces already extracted by an upstream detector, one entry per face of the frame.
 */
@Data
public class FrameRequest {
    @NotNull
    @Valid
    @JsonProperty("faces")
    private List<DetectedFaceDto> faces;
}
