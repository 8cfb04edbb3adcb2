package com.incoresoft.presenceTracker.domain.matching.service;

/**
 * {@code (1 - euclideanDistance) * 100}, clamped to [0, 100].
 * Tuned for unit-scale face encodings, where a distance of 0.6 is the usual same-person cut-off.
 */
public class EuclideanSimilarity implements SimilarityFunction {

    @Override
    public double similarity(double[] observed, double[] reference) {
        if (observed == null || reference == null || observed.length != reference.length) {
            return 0;
        }
        double sum = 0;
        for (int i = 0; i < observed.length; i++) {
            double d = observed[i] - reference[i];
            sum += d * d;
        }
        double score = (1 - Math.sqrt(sum)) * 100;
        return Math.max(0, Math.min(100, score));
    }
}
