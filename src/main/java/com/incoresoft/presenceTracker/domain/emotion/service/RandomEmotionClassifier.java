package com.incoresoft.presenceTracker.domain.emotion.service;

import com.incoresoft.presenceTracker.domain.emotion.dto.Emotion;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Stand-in used when no emotion model is available: uniform over the label set.
 */
public class RandomEmotionClassifier implements EmotionClassifier {
    private static final Emotion[] LABELS = Emotion.values();

    private final Supplier<Random> random;

    public RandomEmotionClassifier() {
        this(ThreadLocalRandom::current);
    }

    public RandomEmotionClassifier(Supplier<Random> random) {
        this.random = random;
    }

    @Override
    public Emotion classify(byte[] faceImage) {
        return LABELS[random.get().nextInt(LABELS.length)];
    }
}
