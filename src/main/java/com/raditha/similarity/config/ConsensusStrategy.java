package com.raditha.similarity.config;

import com.raditha.similarity.model.DetectorId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rule deciding which cross-detector agreements become reported groups.
 * <p>
 * Thresholds must lie in (0,1]. Weighted strategies may only reference
 * detectors that are enabled for the run; that check happens in the
 * aggregator because it depends on the run's detector set.
 */
public interface ConsensusStrategy {

    /**
     * Short name used in provenance tags, e.g. "majority".
     */
    String name();

    /**
     * Keep edges reported by at least {@code ceil(threshold * enabledDetectors)} detectors.
     */
    record Majority(double threshold) implements ConsensusStrategy {
        public Majority {
            requireThreshold(threshold);
        }

        @Override
        public String name() {
            return "majority";
        }
    }

    /**
     * Keep edges reported by every enabled detector.
     */
    record Intersection() implements ConsensusStrategy {
        @Override
        public String name() {
            return "intersection";
        }
    }

    /**
     * Keep edges reported by any enabled detector.
     */
    record Union() implements ConsensusStrategy {
        @Override
        public String name() {
            return "union";
        }
    }

    /**
     * Keep edges whose summed detector weights reach the threshold.
     */
    record Weighted(Map<DetectorId, Double> weights, double threshold) implements ConsensusStrategy {
        public Weighted {
            requireThreshold(threshold);
            if (weights == null || weights.isEmpty()) {
                throw new InvalidOptionsException("Weighted consensus requires at least one detector weight");
            }
            for (Map.Entry<DetectorId, Double> entry : weights.entrySet()) {
                Double w = entry.getValue();
                if (w == null || w < 0.0 || w.isNaN() || w.isInfinite()) {
                    throw new InvalidOptionsException("Invalid weight for " + entry.getKey() + ": " + w);
                }
            }
            weights = Collections.unmodifiableMap(new EnumMap<>(weights));
        }

        public double weightOf(DetectorId detector) {
            return weights.getOrDefault(detector, 0.0);
        }

        @Override
        public String name() {
            return "weighted";
        }
    }

    static ConsensusStrategy majority() {
        return new Majority(0.5);
    }

    static ConsensusStrategy intersection() {
        return new Intersection();
    }

    static ConsensusStrategy union() {
        return new Union();
    }

    private static void requireThreshold(double threshold) {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new InvalidOptionsException("Consensus threshold must be in (0, 1], got " + threshold);
        }
    }
}
