package com.raditha.similarity.config;

import com.raditha.similarity.model.DetectorId;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Options for one similarity analysis run.
 *
 * @param threshold        Minimum similarity score to report, in (0,1]
 * @param minLines         Functions shorter than this are not compared
 * @param crossFile        When false only pairs inside the same file are eligible
 * @param enabledDetectors Detector tags to run; empty means every detector whose inputs are available
 * @param consensus        Rule for merging detector outputs
 */
public record SimilarityOptions(
        double threshold,
        int minLines,
        boolean crossFile,
        List<String> enabledDetectors,
        ConsensusStrategy consensus) {

    /**
     * Validate options. Any violation fails the run before a detector starts.
     */
    public SimilarityOptions {
        if (!(threshold > 0.0 && threshold <= 1.0)) {
            throw new InvalidOptionsException("threshold must be in (0, 1], got " + threshold);
        }
        if (minLines < 0) {
            throw new InvalidOptionsException("minLines must be >= 0, got " + minLines);
        }
        if (consensus == null) {
            throw new InvalidOptionsException("consensus strategy cannot be null");
        }
        enabledDetectors = enabledDetectors == null ? List.of() : List.copyOf(enabledDetectors);
        for (String tag : enabledDetectors) {
            DetectorId.fromTag(tag);
        }
    }

    /**
     * Moderate preset: 80% threshold, 5 lines, cross-file, majority consensus.
     * Good default for most projects.
     */
    public static SimilarityOptions moderate() {
        return new SimilarityOptions(0.80, 5, true, List.of(), ConsensusStrategy.majority());
    }

    /**
     * Strict preset: only very similar functions, every detector must agree.
     */
    public static SimilarityOptions strict() {
        return new SimilarityOptions(0.95, 7, true, List.of(), ConsensusStrategy.intersection());
    }

    /**
     * Lenient preset: any detector may report, lower threshold.
     * Finds more candidates at the cost of false positives.
     */
    public static SimilarityOptions lenient() {
        return new SimilarityOptions(0.70, 3, true, List.of(), ConsensusStrategy.union());
    }

    public static SimilarityOptions forPreset(String preset) {
        return switch (preset == null ? "moderate" : preset.toLowerCase()) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            case "moderate" -> moderate();
            default -> throw new InvalidOptionsException("Unknown preset '" + preset + "'");
        };
    }

    /**
     * Resolved detector ids, in declaration order of {@link DetectorId}.
     */
    public Set<DetectorId> enabledDetectorIds() {
        Set<DetectorId> ids = new LinkedHashSet<>();
        for (DetectorId id : DetectorId.values()) {
            for (String tag : enabledDetectors) {
                if (DetectorId.fromTag(tag) == id) {
                    ids.add(id);
                }
            }
        }
        return ids;
    }

    public SimilarityOptions withThreshold(double newThreshold) {
        return new SimilarityOptions(newThreshold, minLines, crossFile, enabledDetectors, consensus);
    }

    public SimilarityOptions withMinLines(int newMinLines) {
        return new SimilarityOptions(threshold, newMinLines, crossFile, enabledDetectors, consensus);
    }

    public SimilarityOptions withCrossFile(boolean newCrossFile) {
        return new SimilarityOptions(threshold, minLines, newCrossFile, enabledDetectors, consensus);
    }

    public SimilarityOptions withConsensus(ConsensusStrategy newConsensus) {
        return new SimilarityOptions(threshold, minLines, crossFile, enabledDetectors, newConsensus);
    }

    public SimilarityOptions withEnabledDetectors(String... tags) {
        return new SimilarityOptions(threshold, minLines, crossFile, new ArrayList<>(List.of(tags)), consensus);
    }
}
