package com.raditha.similarity.detection;

import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SimilarityPair;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Uniform filters applied by every detector before emitting pairs.
 */
final class CandidateFilter {

    private static final Comparator<SimilarityPair> PAIR_ORDER =
            Comparator.comparing(SimilarityPair::firstId).thenComparing(SimilarityPair::secondId);

    private CandidateFilter() {
    }

    /**
     * Functions large enough to compare, ordered by id.
     */
    static List<FunctionRepresentation> eligible(List<FunctionRepresentation> representations,
                                                 DetectionOptions options) {
        return representations.stream()
                .filter(r -> r.linesOfCode() >= options.minLines())
                .sorted(Comparator.comparing(FunctionRepresentation::functionId))
                .toList();
    }

    /**
     * Same-file restriction when cross-file matching is off.
     */
    static boolean inScope(FunctionRepresentation a, FunctionRepresentation b, DetectionOptions options) {
        return options.crossFile() || Objects.equals(a.filePath(), b.filePath());
    }

    static List<SimilarityPair> ordered(List<SimilarityPair> pairs) {
        return pairs.stream().sorted(PAIR_ORDER).toList();
    }
}
