package com.incoresoft.presenceTracker.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RegisterIdentityRequest {
    @NotBlank
    @JsonProperty("name")
    private String name;
    /** base64 JPEG/PNG, data URL prefix allowed */
    @NotBlank
    @JsonProperty("image")
    private String image;
}
