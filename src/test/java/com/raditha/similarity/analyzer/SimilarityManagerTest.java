package com.raditha.similarity.analyzer;

import com.raditha.similarity.Functions;
import com.raditha.similarity.ann.EmbeddingProvider;
import com.raditha.similarity.clustering.AggregationException;
import com.raditha.similarity.config.ConsensusStrategy;
import com.raditha.similarity.config.InvalidOptionsException;
import com.raditha.similarity.config.SimilarityOptions;
import com.raditha.similarity.config.TuningConfig;
import com.raditha.similarity.detection.DetectorRegistry;
import com.raditha.similarity.detection.SimilarityDetector;
import com.raditha.similarity.model.Adjustment;
import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.FunctionInfo;
import com.raditha.similarity.model.ScoredPair;
import com.raditha.similarity.model.SimilarityGroup;
import com.raditha.similarity.representation.RepresentationCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SimilarityManagerTest {

    private SimilarityManager manager;
    private SimilarityOptions options;
    private List<FunctionInfo> functions;

    @BeforeEach
    void setUp() {
        manager = new SimilarityManager();
        options = SimilarityOptions.moderate().withThreshold(0.9).withMinLines(1);
        functions = List.of(
                Functions.sum("src/Orders.java#sum", "src/Orders.java", "acc", "item", "prices"),
                Functions.sum("src/Invoices.java#sum", "src/Invoices.java", "total", "line", "amounts"),
                Functions.function("src/Report.java#classify", "classify", "src/Report.java",
                        Functions.classifyBody("value", "limit", "label"), "int", "int", "String"));
    }

    @Test
    void testRenamedCopiesFormOneGroup() {
        List<SimilarityGroup> groups = manager.detectSimilarities(functions, options);

        assertEquals(1, groups.size());
        SimilarityGroup group = groups.get(0);
        assertEquals(List.of("src/Invoices.java#sum", "src/Orders.java#sum"), group.members());
        assertEquals(1.0, group.similarity(), 1e-9);
        assertEquals(1.0, group.confidence(), 1e-9);
        assertEquals("consensus-majority", group.detector());
        assertEquals(List.of(DetectorId.EXACT_HASH, DetectorId.STRUCTURAL_WEIGHTED,
                DetectorId.CANONICAL_MERKLE, DetectorId.LSH_FINGERPRINT), group.contributingDetectors());
        assertEquals(20, group.combinedLinesOfCode());
        assertEquals(0, group.metadata().get("overloadVariants"));
    }

    @Test
    void testGroupsCarryPerPairConfidence() {
        SimilarityGroup group = manager.detectSimilarities(functions, options).get(0);

        assertEquals(4, group.scoredPairs().size());
        for (ScoredPair scored : group.scoredPairs()) {
            assertTrue(group.pairs().contains(scored.pair()));
            assertEquals(1.0, scored.confidence().baseScore(), 1e-9);
            assertEquals(1.0, scored.confidence().finalScore(), 1e-9);
            assertEquals(List.of(new Adjustment("identical display name", 0.05)),
                    scored.confidence().adjustments());
        }
        assertEquals(List.of(DetectorId.EXACT_HASH, DetectorId.STRUCTURAL_WEIGHTED,
                        DetectorId.CANONICAL_MERKLE, DetectorId.LSH_FINGERPRINT),
                group.scoredPairs().stream().map(scored -> scored.pair().detector()).toList());
    }

    @Test
    void testManyExactCopiesSurviveIntersection() {
        List<FunctionInfo> copies = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            copies.add(Functions.sum("src/C" + i + ".java#sum", "src/C" + i + ".java", "a" + i, "b" + i, "c" + i));
        }

        SimilarityReport report = manager.analyze(copies, SimilarityOptions.strict().withMinLines(1));

        assertEquals(1, report.groups().size());
        assertEquals(12, report.groups().get(0).size());
        assertEquals(66, report.pairCounts().get(DetectorId.LSH_FINGERPRINT));
        assertEquals(66, report.pairCounts().get(DetectorId.EXACT_HASH));
    }

    @Test
    void testRunsAreIdempotent() {
        List<SimilarityGroup> first = manager.detectSimilarities(functions, options);
        List<SimilarityGroup> second = manager.detectSimilarities(functions, options);
        List<FunctionInfo> reversed = new ArrayList<>(functions);
        Collections.reverse(reversed);

        assertEquals(first, second);
        assertEquals(first, manager.detectSimilarities(reversed, options));
    }

    @Test
    void testReportCarriesCountsAndSummary() {
        SimilarityReport report = manager.analyze(functions, options);

        assertTrue(report.hasGroups());
        assertFalse(report.hasWarnings());
        assertEquals(3, report.functionCount());
        assertEquals(3, report.representationCount());
        assertEquals(1, report.pairCounts().get(DetectorId.CANONICAL_MERKLE));
        assertFalse(report.pairCounts().containsKey(DetectorId.SEMANTIC_ANN));
        assertTrue(report.getSummary().startsWith("Found 1 similarity groups among 3 functions"));
    }

    @Test
    void testReorderedStatementsFoundByStructureOnly() {
        List<FunctionInfo> reordered = List.of(
                Functions.function("src/A.java#audit", "audit", "src/A.java",
                        Functions.loggingBody("message", "count", false), "String"),
                Functions.function("src/B.java#trace", "trace", "src/B.java",
                        Functions.loggingBody("text", "hits", true), "String"));
        SimilarityOptions structural = options.withThreshold(0.8)
                .withEnabledDetectors("structural-weighted", "canonical-merkle")
                .withConsensus(ConsensusStrategy.union());

        List<SimilarityGroup> groups = manager.detectSimilarities(reordered, structural);

        assertEquals(1, groups.size());
        assertEquals(List.of(DetectorId.STRUCTURAL_WEIGHTED), groups.get(0).contributingDetectors());

        SimilarityOptions merkleOnly = structural.withEnabledDetectors("canonical-merkle");
        assertTrue(manager.detectSimilarities(reordered, merkleOnly).isEmpty());
    }

    @Test
    void testSemanticDetectorWithoutEmbeddingsDegrades() {
        SimilarityOptions semantic = options.withEnabledDetectors("semantic-ann");

        SimilarityReport report = manager.analyze(functions, semantic);

        assertFalse(report.hasGroups());
        assertEquals(List.of("semantic-ann unavailable: no embeddings supplied"), report.warnings());
    }

    @Test
    void testEmbeddingsEnableSemanticDetector() {
        EmbeddingProvider provider = mock(EmbeddingProvider.class);
        when(provider.getEmbedding("src/Orders.java#sum")).thenReturn(new float[] { 1f, 0f, 0f });
        when(provider.getEmbedding("src/Invoices.java#sum")).thenReturn(new float[] { 0.9f, 0.1f, 0f });
        when(provider.getEmbedding("src/Report.java#classify")).thenReturn(new float[] { 0f, 0f, 1f });
        SimilarityManager withEmbeddings = new SimilarityManager(TuningConfig.defaults(), provider);

        SimilarityReport report = withEmbeddings.analyze(functions, options);

        assertEquals(1, report.pairCounts().get(DetectorId.SEMANTIC_ANN));
        assertTrue(report.groups().get(0).contributingDetectors().contains(DetectorId.SEMANTIC_ANN));
    }

    @Test
    void testFailingDetectorIsDegraded() {
        SimilarityDetector failing = mock(SimilarityDetector.class);
        when(failing.id()).thenReturn(DetectorId.LSH_FINGERPRINT);
        when(failing.unavailableReason(any())).thenReturn(Optional.empty());
        when(failing.detect(any(), any())).thenThrow(new IllegalStateException("index corrupted"));
        DetectorRegistry registry = new DetectorRegistry(TuningConfig.defaults()).replace(failing);
        SimilarityManager degraded = new SimilarityManager(TuningConfig.defaults(), EmbeddingProvider.NONE,
                null, registry);

        SimilarityReport report = degraded.analyze(functions, options);

        assertEquals(List.of("lsh-fingerprint failed: index corrupted"), report.warnings());
        assertEquals(1, report.groups().size());
        assertFalse(report.groups().get(0).contributingDetectors().contains(DetectorId.LSH_FINGERPRINT));
    }

    @Test
    void testInvalidOptions() {
        assertThrows(InvalidOptionsException.class, () -> manager.detectSimilarities(functions, null));

        SimilarityOptions weighted = options.withEnabledDetectors("exact-hash")
                .withConsensus(new ConsensusStrategy.Weighted(Map.of(DetectorId.SEMANTIC_ANN, 1.0), 0.5));
        AggregationException e = assertThrows(AggregationException.class,
                () -> manager.detectSimilarities(functions, weighted));
        assertTrue(e.getUnknownDetectors().contains(DetectorId.SEMANTIC_ANN));
    }

    @Test
    void testEmptyAndSkippedInput() {
        assertTrue(manager.detectSimilarities(List.of(), options).isEmpty());

        FunctionInfo broken = new FunctionInfo("src/Broken.java#f", "f", "src/Broken.java", 1, 10, null,
                List.of(), null, null);
        List<FunctionInfo> withBroken = new ArrayList<>(functions);
        withBroken.add(broken);
        SimilarityReport report = manager.analyze(withBroken, options);

        assertEquals(1, report.skipped().size());
        assertEquals("src/Broken.java#f", report.skipped().get(0).functionId());
        assertEquals(1, report.groups().size());
    }

    @Test
    void testThresholdAndMinLinesFilterGroups() {
        assertTrue(manager.detectSimilarities(functions, options.withMinLines(11)).isEmpty());
        assertTrue(manager.detectSimilarities(functions, options.withCrossFile(false)).isEmpty());
    }

    @Test
    void testInterruptCancelsRun() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> manager.detectSimilarities(functions, options));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testCacheIsReusedAcrossRuns() {
        RepresentationCache cache = new RepresentationCache();
        SimilarityManager cached = new SimilarityManager(TuningConfig.defaults(), EmbeddingProvider.NONE, cache);

        List<SimilarityGroup> first = cached.detectSimilarities(functions, options);
        List<SimilarityGroup> second = cached.detectSimilarities(functions, options);

        assertEquals(first, second);
        assertEquals(3, cache.getHits());
        assertEquals(3, cache.getMisses());
    }
}
