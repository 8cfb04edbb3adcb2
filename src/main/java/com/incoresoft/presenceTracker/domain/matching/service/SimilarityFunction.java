package com.incoresoft.presenceTracker.domain.matching.service;

/**
 * Scores two feature vectors. Implementations must return a value in [0, 100].
 */
@FunctionalInterface
public interface SimilarityFunction {
    double similarity(double[] observed, double[] reference);
}
