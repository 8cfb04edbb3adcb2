package com.incoresoft.presenceTracker.domain.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

/**
 * One face as returned by the face API detector, also accepted as-is by POST /api/frames.
 */
@Data
public class DetectedFaceDto {
    @NotNull
    @JsonProperty("location")
    private BoundingBox location;
    @NotEmpty
    @JsonProperty("encoding")
    private List<Double> encoding;
    @JsonProperty("face_image")
    private String faceImage; // base64 JPEG crop, optional
}
