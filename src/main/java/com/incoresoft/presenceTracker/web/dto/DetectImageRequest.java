package com.incoresoft.presenceTracker.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class DetectImageRequest {
    @NotBlank
    @JsonProperty("image")
    private String image;
}
