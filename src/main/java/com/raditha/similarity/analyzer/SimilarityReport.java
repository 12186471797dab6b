package com.raditha.similarity.analyzer;

import com.raditha.similarity.config.SimilarityOptions;
import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.SimilarityGroup;
import com.raditha.similarity.model.SkipRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one similarity analysis run.
 *
 * @param groups              Reported groups, highest priority first
 * @param warnings            Degraded detectors and dropped inputs
 * @param skipped             Functions excluded from comparison
 * @param pairCounts          Pairs reported by each detector that ran
 * @param functionCount       Functions received
 * @param representationCount Functions that were compared
 * @param options             Options of the run
 */
public record SimilarityReport(
        List<SimilarityGroup> groups,
        List<String> warnings,
        List<SkipRecord> skipped,
        Map<DetectorId, Integer> pairCounts,
        int functionCount,
        int representationCount,
        SimilarityOptions options) {

    public SimilarityReport {
        groups = List.copyOf(groups);
        warnings = List.copyOf(warnings);
        skipped = List.copyOf(skipped);
        pairCounts = pairCounts.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(pairCounts));
    }

    public boolean hasGroups() {
        return !groups.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "Found %d similarity groups among %d functions (%d skipped, %d warnings, threshold: %.0f%%, consensus: %s)",
                groups.size(),
                representationCount,
                skipped.size(),
                warnings.size(),
                options.threshold() * 100,
                options.consensus().name());
    }
}
