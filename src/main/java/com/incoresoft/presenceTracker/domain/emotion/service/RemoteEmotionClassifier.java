package com.incoresoft.presenceTracker.domain.emotion.service;

import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;
import com.incoresoft.presenceTracker.repository.FaceApiRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Classifies through the face API. Any failure degrades to {@link Emotion#NEUTRAL}
 * so a flaky model never breaks frame processing.
 */
@Slf4j
@RequiredArgsConstructor
public class RemoteEmotionClassifier implements EmotionClassifier {

    private final FaceApiRepository repo;

    @Override
    public Emotion classify(byte[] faceImage) {
        if (faceImage == null || faceImage.length == 0) return Emotion.NEUTRAL;
        try {
            return repo.classifyEmotion(faceImage)
                    .flatMap(Emotion::fromLabel)
                    .orElse(Emotion.NEUTRAL);
        } catch (Exception ex) {
            log.warn("Emotion classification failed: {}", ex.getMessage());
            return Emotion.NEUTRAL;
        }
    }
}
