package com.raditha.similarity.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A connected group of similar functions agreed upon by the consensus rule.
 *
 * @param members               Function ids, sorted, at least two
 * @param similarity            Mean of the contributing detector scores on internal edges
 * @param confidence            Mean final confidence of the internal edges
 * @param detector              Provenance, "consensus-&lt;strategy&gt;"
 * @param contributingDetectors Detectors that reported at least one kept edge
 * @param explanation           Distinct explanations of the kept edges
 * @param metadata              Aggregated facts (edge count, detector votes, ...)
 * @param refactoringImpact     Payoff estimate from size and complexity
 * @param combinedLinesOfCode   Sum of member lines of code
 * @param pairs                 Kept detector pairs on internal edges
 * @param scoredPairs           Per pair confidence, empty until the group is scored
 */
public record SimilarityGroup(
        List<String> members,
        double similarity,
        double confidence,
        String detector,
        List<DetectorId> contributingDetectors,
        String explanation,
        Map<String, Object> metadata,
        RefactoringImpact refactoringImpact,
        int combinedLinesOfCode,
        List<SimilarityPair> pairs,
        List<ScoredPair> scoredPairs) {

    public SimilarityGroup {
        if (members == null || members.size() < 2) {
            throw new IllegalArgumentException("A similarity group needs at least two members");
        }
        members = members.stream().sorted().toList();
        contributingDetectors = List.copyOf(contributingDetectors);
        pairs = List.copyOf(pairs);
        scoredPairs = scoredPairs == null ? List.of() : List.copyOf(scoredPairs);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    public int size() {
        return members.size();
    }

    /**
     * Ranking key: similarity weighted by how much code the group covers.
     */
    public double priority() {
        return similarity * combinedLinesOfCode;
    }

    public SimilarityGroup withScoring(double newConfidence, List<ScoredPair> newScoredPairs,
                                       Map<String, Object> extraMetadata) {
        Map<String, Object> merged = new TreeMap<>(metadata);
        merged.putAll(extraMetadata);
        return new SimilarityGroup(members, similarity, newConfidence, detector, contributingDetectors,
                explanation, merged, refactoringImpact, combinedLinesOfCode, pairs, newScoredPairs);
    }

    /**
     * Format group summary for display.
     */
    public String formatSummary() {
        return String.format("%d functions, %.1f%% similar, confidence %.2f, impact %s (%s)",
                members.size(), similarity * 100, confidence, refactoringImpact, detector);
    }
}
