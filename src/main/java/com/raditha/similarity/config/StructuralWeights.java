package com.raditha.similarity.config;

import com.raditha.similarity.model.StructuralFeatures;

/**
 * Weights for combining per-feature distances of the structural detector.
 *
 * @param branchWeight    Weight for branch count distance (0.0-1.0)
 * @param loopWeight      Weight for loop count distance (0.0-1.0)
 * @param depthWeight     Weight for nesting depth distance (0.0-1.0)
 * @param statementWeight Weight for statement count distance (0.0-1.0)
 * @param parameterWeight Weight for parameter count distance (0.0-1.0)
 */
public record StructuralWeights(
        double branchWeight,
        double loopWeight,
        double depthWeight,
        double statementWeight,
        double parameterWeight) {

    /**
     * Validate weights are non-negative and sum to 1.0.
     */
    public StructuralWeights {
        double[] all = { branchWeight, loopWeight, depthWeight, statementWeight, parameterWeight };
        double sum = 0.0;
        for (double w : all) {
            if (w < 0.0 || Double.isNaN(w)) {
                throw new InvalidOptionsException("Structural weights must be non-negative, got " + w);
            }
            sum += w;
        }
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new InvalidOptionsException(
                    String.format("Weights must sum to 1.0, got %.3f", sum));
        }
    }

    /**
     * Balanced weights (default): control flow and body length dominate.
     */
    public static StructuralWeights balanced() {
        return new StructuralWeights(0.25, 0.25, 0.15, 0.25, 0.10);
    }

    /**
     * Control-flow weights: emphasizes branches, loops and nesting.
     */
    public static StructuralWeights controlFlow() {
        return new StructuralWeights(0.30, 0.30, 0.25, 0.10, 0.05);
    }

    /**
     * Weighted normalized distance in [0,1]. Each feature contributes
     * {@code |a - b| / max(a, b, 1)}.
     */
    public double distance(StructuralFeatures a, StructuralFeatures b) {
        double[] weights = { branchWeight, loopWeight, depthWeight, statementWeight, parameterWeight };
        int[] left = a.toArray();
        int[] right = b.toArray();
        double total = 0.0;
        for (int i = 0; i < weights.length; i++) {
            total += weights[i] * featureDistance(left[i], right[i]);
        }
        return Math.min(1.0, total);
    }

    private static double featureDistance(int a, int b) {
        int max = Math.max(Math.max(a, b), 1);
        return Math.abs(a - b) / (double) max;
    }
}
