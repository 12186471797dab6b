package com.raditha.similarity.detection;

import com.raditha.similarity.config.InvalidOptionsException;
import com.raditha.similarity.config.SimilarityOptions;

/**
 * Filtering options shared by every detector.
 *
 * @param threshold Pairs scoring below this are dropped
 * @param minLines  Functions with fewer lines of code are not compared
 * @param crossFile When false only pairs from the same file are eligible
 */
public record DetectionOptions(double threshold, int minLines, boolean crossFile) {

    public DetectionOptions {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new InvalidOptionsException("threshold must be in (0, 1], got " + threshold);
        }
        if (minLines < 0) {
            throw new InvalidOptionsException("minLines must be >= 0, got " + minLines);
        }
    }

    public static DetectionOptions from(SimilarityOptions options) {
        return new DetectionOptions(options.threshold(), options.minLines(), options.crossFile());
    }
}
