package com.incoresoft.presenceTracker.domain.session.dto;

import com.incoresoft.presenceTracker.domain.shared.dto.BoundingBox;

/**
 * One detected face of one frame. Not retained past the frame.
 *
 * @param croppedImage JPEG bytes of the face, empty when the detector sent none
 */
public record ObservedFace(BoundingBox boundingBox, double[] featureVector, byte[] croppedImage) {

    public ObservedFace {
        if (boundingBox == null) throw new IllegalArgumentException("Face location is required");
        if (featureVector == null || featureVector.length == 0) {
            throw new IllegalArgumentException("Face encoding is required");
        }
        croppedImage = croppedImage == null ? new byte[0] : croppedImage;
    }
}
