package com.raditha.similarity.detection;

import com.raditha.similarity.config.StructuralWeights;
import com.raditha.similarity.config.TuningConfig;
import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SimilarityPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compares structural feature vectors (branches, loops, nesting depth,
 * statements, parameters) with a weighted normalized distance.
 * <p>
 * Functions are binned by {@code floor(log2(tokenCount))}; each bin is compared
 * with itself and the next bin up, after a token count size filter. Score is
 * {@code 1 - distance}. Tolerates edits that change the Merkle hash, such as
 * reordered statements, at the cost of precision.
 */
public class StructuralWeightedDetector implements SimilarityDetector {

    private static final Logger logger = LoggerFactory.getLogger(StructuralWeightedDetector.class);

    private final StructuralWeights weights;
    private final SizeFilter sizeFilter;

    public StructuralWeightedDetector(TuningConfig tuning) {
        this.weights = tuning.structuralWeights();
        this.sizeFilter = new SizeFilter(tuning.sizeRatio());
    }

    @Override
    public DetectorId id() {
        return DetectorId.STRUCTURAL_WEIGHTED;
    }

    @Override
    public List<SimilarityPair> detect(List<FunctionRepresentation> representations, DetectionOptions options) {
        List<FunctionRepresentation> eligible = CandidateFilter.eligible(representations, options);
        TreeMap<Integer, List<FunctionRepresentation>> buckets = new TreeMap<>();
        for (FunctionRepresentation r : eligible) {
            buckets.computeIfAbsent(sizeBucket(r.tokenCount()), k -> new ArrayList<>()).add(r);
        }

        List<SimilarityPair> pairs = new ArrayList<>();
        int compared = 0;
        for (Map.Entry<Integer, List<FunctionRepresentation>> entry : buckets.entrySet()) {
            List<FunctionRepresentation> bucket = entry.getValue();
            List<FunctionRepresentation> next = buckets.getOrDefault(entry.getKey() + 1, List.of());
            for (int i = 0; i < bucket.size(); i++) {
                for (int j = i + 1; j < bucket.size(); j++) {
                    compared += compare(bucket.get(i), bucket.get(j), options, pairs);
                }
                for (FunctionRepresentation other : next) {
                    compared += compare(bucket.get(i), other, options, pairs);
                }
            }
        }

        logger.debug("structural-weighted: compared {} pairs in {} size buckets, {} above threshold",
                compared, buckets.size(), pairs.size());
        return CandidateFilter.ordered(pairs);
    }

    /**
     * Score one pair, appending it when it passes every filter.
     *
     * @return 1 if the pair was scored, 0 if it was filtered out beforehand
     */
    private int compare(FunctionRepresentation a, FunctionRepresentation b, DetectionOptions options,
                        List<SimilarityPair> sink) {
        if (!CandidateFilter.inScope(a, b, options) || !sizeFilter.shouldCompare(a.tokenCount(), b.tokenCount())) {
            return 0;
        }
        double distance = weights.distance(a.features(), b.features());
        double score = 1.0 - distance;
        if (score >= options.threshold()) {
            sink.add(new SimilarityPair(a.functionId(), b.functionId(), id(), score, "similar structure",
                    Map.of("distance", distance,
                            "sizeRatio", (double) Math.min(a.tokenCount(), b.tokenCount())
                                    / Math.max(Math.max(a.tokenCount(), b.tokenCount()), 1))));
        }
        return 1;
    }

    /**
     * Log-scale size bin of a token count.
     */
    static int sizeBucket(int tokenCount) {
        return 31 - Integer.numberOfLeadingZeros(Math.max(tokenCount, 1));
    }
}
