package com.incoresoft.presenceTracker.domain.shared.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.incoresoft.presenceTracker.domain.motion.dto.FaceCenter;

/**
 * Face location in pixel coordinates, in detector order (top, right, bottom, left).
 */
public record BoundingBox(
        @JsonProperty("top") int top,
        @JsonProperty("right") int right,
        @JsonProperty("bottom") int bottom,
        @JsonProperty("left") int left) {

    /** Integer center, same rounding as the detector's pixel grid. */
    public FaceCenter center() {
        return new FaceCenter((left + right) / 2, (top + bottom) / 2);
    }

    public boolean isEmpty() {
        return bottom <= top || right <= left;
    }
}
