package com.raditha.similarity.analyzer;

import com.raditha.similarity.Functions;
import com.raditha.similarity.ann.EmbeddingProvider;
import com.raditha.similarity.config.ConsensusStrategy;
import com.raditha.similarity.config.SimilarityOptions;
import com.raditha.similarity.config.TuningConfig;
import com.raditha.similarity.detection.DetectionOptions;
import com.raditha.similarity.detection.DetectorRegistry;
import com.raditha.similarity.detection.SimilarityDetector;
import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.FunctionInfo;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SimilarityGroup;
import com.raditha.similarity.model.SimilarityPair;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityManagerPropertiesTest {

    private static final int CLUSTER_SIZE = 3;
    private static final List<DetectorId> SCRIPTED = List.of(
            DetectorId.EXACT_HASH, DetectorId.STRUCTURAL_WEIGHTED, DetectorId.LSH_FINGERPRINT);

    private final SimilarityManager manager = new SimilarityManager();

    @Property(tries = 20)
    void selfSimilarityIsPerfect(@ForAll @IntRange(min = 1, max = 14) int copies) {
        List<FunctionInfo> functions = new ArrayList<>();
        for (int i = 0; i <= copies; i++) {
            functions.add(Functions.sum("src/F" + i + ".java#sum", "src/F" + i + ".java", "a" + i, "b" + i, "c" + i));
        }
        SimilarityOptions options = SimilarityOptions.strict().withMinLines(1);

        List<SimilarityGroup> groups = manager.detectSimilarities(functions, options);

        assertEquals(1, groups.size());
        assertEquals(copies + 1, groups.get(0).size());
        assertEquals(1.0, groups.get(0).similarity(), 1e-9);
    }

    @Property(tries = 20)
    void reportedGroupsRespectThreshold(@ForAll @IntRange(min = 50, max = 100) int percent) {
        List<FunctionInfo> functions = List.of(
                Functions.sum("a", "A.java", "x", "y", "z"),
                Functions.sum("b", "B.java", "p", "q", "r"),
                Functions.function("c", "log", "C.java", Functions.loggingBody("m", "n", false), "String"),
                Functions.function("d", "log", "D.java", Functions.loggingBody("m", "n", true), "String"));
        SimilarityOptions options = SimilarityOptions.lenient().withMinLines(1).withThreshold(percent / 100.0);

        for (SimilarityGroup group : manager.detectSimilarities(functions, options)) {
            assertTrue(group.similarity() >= options.threshold());
            assertTrue(group.size() >= 2);
            assertTrue(group.confidence() >= 0.0 && group.confidence() <= 1.0);
        }
    }

    @Property(tries = 50)
    void raisingThresholdNeverAddsGroups(@ForAll("clusterLevels") List<List<Integer>> levels,
                                         @ForAll @IntRange(min = 0, max = 4) int first,
                                         @ForAll @IntRange(min = 0, max = 4) int second) {
        SimilarityManager scripted = scriptedManager(levels);
        List<FunctionInfo> functions = clusterFunctions(levels.size());
        double low = threshold(Math.min(first, second));
        double high = threshold(Math.max(first, second));

        for (ConsensusStrategy strategy : List.of(ConsensusStrategy.union(), ConsensusStrategy.majority(),
                ConsensusStrategy.intersection())) {
            int lowCount = scripted.detectSimilarities(functions, scriptedOptions(low, strategy)).size();
            int highCount = scripted.detectSimilarities(functions, scriptedOptions(high, strategy)).size();
            assertTrue(highCount <= lowCount,
                    strategy.name() + ": " + highCount + " groups at " + high + ", " + lowCount + " at " + low);
        }
    }

    @Property(tries = 50)
    void strategiesAreOrderedByGroupCount(@ForAll("clusterLevels") List<List<Integer>> levels,
                                          @ForAll @IntRange(min = 0, max = 4) int level) {
        SimilarityManager scripted = scriptedManager(levels);
        List<FunctionInfo> functions = clusterFunctions(levels.size());
        double threshold = threshold(level);

        int intersection = scripted.detectSimilarities(functions,
                scriptedOptions(threshold, ConsensusStrategy.intersection())).size();
        int majority = scripted.detectSimilarities(functions,
                scriptedOptions(threshold, ConsensusStrategy.majority())).size();
        int union = scripted.detectSimilarities(functions,
                scriptedOptions(threshold, ConsensusStrategy.union())).size();

        assertTrue(intersection <= majority, intersection + " > " + majority);
        assertTrue(majority <= union, majority + " > " + union);
    }

    /**
     * Per cluster, one score level per scripted detector: 0 means not reported,
     * 1..5 map to scores 0.6..1.0 on every edge of the cluster.
     */
    @Provide
    Arbitrary<List<List<Integer>>> clusterLevels() {
        return Arbitraries.integers().between(0, 5).list().ofSize(SCRIPTED.size())
                .list().ofMinSize(1).ofMaxSize(4);
    }

    // thresholds sit between score levels so group means never round across them
    private static double threshold(int level) {
        return 0.55 + 0.1 * level;
    }

    private static String member(int cluster, int index) {
        return "k" + cluster + "m" + index;
    }

    private static List<FunctionInfo> clusterFunctions(int clusters) {
        List<FunctionInfo> functions = new ArrayList<>();
        for (int k = 0; k < clusters; k++) {
            for (int m = 0; m < CLUSTER_SIZE; m++) {
                String id = member(k, m);
                functions.add(Functions.sum(id, id + ".java", "a", "b", "c"));
            }
        }
        return functions;
    }

    private static SimilarityOptions scriptedOptions(double threshold, ConsensusStrategy strategy) {
        List<String> tags = SCRIPTED.stream().map(DetectorId::tag).toList();
        return new SimilarityOptions(threshold, 1, true, tags, strategy);
    }

    private static SimilarityManager scriptedManager(List<List<Integer>> levels) {
        DetectorRegistry registry = new DetectorRegistry(TuningConfig.defaults());
        for (int d = 0; d < SCRIPTED.size(); d++) {
            List<Integer> perCluster = new ArrayList<>();
            for (List<Integer> cluster : levels) {
                perCluster.add(cluster.get(d));
            }
            registry = registry.replace(new CliqueDetector(SCRIPTED.get(d), perCluster));
        }
        return new SimilarityManager(TuningConfig.defaults(), EmbeddingProvider.NONE, null, registry);
    }

    /**
     * Reports every edge of a cluster with one score, so clusters never bridge
     * and never split under a higher threshold.
     */
    private static final class CliqueDetector implements SimilarityDetector {
        private final DetectorId id;
        private final List<Integer> levels;

        CliqueDetector(DetectorId id, List<Integer> levels) {
            this.id = id;
            this.levels = levels;
        }

        @Override
        public DetectorId id() {
            return id;
        }

        @Override
        public List<SimilarityPair> detect(List<FunctionRepresentation> representations, DetectionOptions options) {
            List<SimilarityPair> pairs = new ArrayList<>();
            for (int k = 0; k < levels.size(); k++) {
                int level = levels.get(k);
                double score = 0.5 + 0.1 * level;
                if (level == 0 || score < options.threshold()) {
                    continue;
                }
                for (int i = 0; i < CLUSTER_SIZE; i++) {
                    for (int j = i + 1; j < CLUSTER_SIZE; j++) {
                        pairs.add(SimilarityPair.of(member(k, i), member(k, j), id, score, "scripted"));
                    }
                }
            }
            return pairs;
        }
    }
}
