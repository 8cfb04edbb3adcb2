package com.incoresoft.presenceTracker.domain.emotion.service;

import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;

public interface EmotionClassifier {

    /**
     * @param faceImage JPEG bytes of the cropped face, may be empty
     * @return one label of the fixed set, never null
     */
    Emotion classify(byte[] faceImage);
}
