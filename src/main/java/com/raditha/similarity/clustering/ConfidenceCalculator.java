package com.raditha.similarity.clustering;

import com.raditha.similarity.model.Adjustment;
import com.raditha.similarity.model.ConfidenceScore;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SimilarityPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Calculates the final confidence of a reported pair.
 * <p>
 * Starts from the detector's score and applies additive adjustments:
 * identical display names raise confidence, overload-like signature variants
 * and very large groups lower it. The result is clamped to [0,1].
 */
public class ConfidenceCalculator {

    private static final Logger logger = LoggerFactory.getLogger(ConfidenceCalculator.class);

    static final double SAME_NAME_BONUS = 0.05;
    static final double OVERLOAD_PENALTY = 0.1;
    static final double LARGE_GROUP_PENALTY = 0.05;
    static final int LARGE_GROUP_SIZE = 8;

    private final Map<String, FunctionRepresentation> representations;

    /**
     * @param representations Function representations by id, used for names and signatures
     */
    public ConfidenceCalculator(Map<String, FunctionRepresentation> representations) {
        this.representations = representations;
    }

    /**
     * Score a pair on its own; overload variants are counted between the two functions.
     *
     * @param pair      Detector pair
     * @param groupSize Size of the group the pair belongs to
     */
    public ConfidenceScore score(SimilarityPair pair, int groupSize) {
        return score(pair, groupSize, overloadVariants(List.of(pair.firstId(), pair.secondId())));
    }

    /**
     * Score a pair inside a group.
     *
     * @param pair             Detector pair
     * @param groupSize        Size of the group the pair belongs to
     * @param overloadVariants Additional signature variants sharing a name in the group
     * @return Confidence score between 0.0 and 1.0 with its adjustments
     */
    public ConfidenceScore score(SimilarityPair pair, int groupSize, int overloadVariants) {
        double base = pair.score();
        List<Adjustment> adjustments = new ArrayList<>();

        FunctionRepresentation first = representations.get(pair.firstId());
        FunctionRepresentation second = representations.get(pair.secondId());
        if (first != null && second != null && first.displayName() != null
                && first.displayName().equals(second.displayName())) {
            adjustments.add(new Adjustment("identical display name", SAME_NAME_BONUS));
        }
        if (overloadVariants > 0) {
            // likely intentional overloads rather than copies
            adjustments.add(new Adjustment("overload variants: " + overloadVariants,
                    -OVERLOAD_PENALTY * overloadVariants));
        }
        if (groupSize > LARGE_GROUP_SIZE) {
            adjustments.add(new Adjustment("large group: " + groupSize, -LARGE_GROUP_PENALTY));
        }

        double score = base;
        for (Adjustment adjustment : adjustments) {
            score += adjustment.delta();
            logger.debug("{} | {} [{}]: {} {}", pair.firstId(), pair.secondId(), pair.detector(),
                    adjustment.reason(), String.format("%+.2f", adjustment.delta()));
        }
        return new ConfidenceScore(Math.max(0.0, Math.min(1.0, score)), base, adjustments);
    }

    /**
     * Count overload-like variants: for every display name, each distinct
     * signature beyond the first is one variant.
     */
    public int overloadVariants(Collection<String> memberIds) {
        Map<String, Set<Long>> signaturesByName = new TreeMap<>();
        for (String id : memberIds) {
            FunctionRepresentation r = representations.get(id);
            if (r != null && r.displayName() != null) {
                signaturesByName.computeIfAbsent(r.displayName(), k -> new HashSet<>()).add(r.signatureHash());
            }
        }
        int variants = 0;
        for (Set<Long> signatures : signaturesByName.values()) {
            variants += signatures.size() - 1;
        }
        return variants;
    }
}
