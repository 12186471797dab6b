package com.raditha.similarity.ann;

import com.raditha.similarity.ann.NeighborIndex.Neighbor;
import com.raditha.similarity.config.TuningConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClusterIndexTest {

    private ClusterIndex index;

    @BeforeEach
    void setUp() {
        index = new ClusterIndex(3, 2, TuningConfig.DEFAULT_SEED);
        addGroups(index);
    }

    private static void addGroups(NeighborIndex target) {
        target.add("x1", new float[] { 1f, 0f, 0f });
        target.add("x2", new float[] { 0.95f, 0.05f, 0f });
        target.add("x3", new float[] { 0.9f, 0.1f, 0f });
        target.add("x4", new float[] { 0.97f, 0f, 0.03f });
        target.add("z1", new float[] { 0f, 0f, 1f });
        target.add("z2", new float[] { 0f, 0.05f, 0.95f });
        target.add("z3", new float[] { 0.1f, 0f, 0.9f });
        target.add("z4", new float[] { 0f, 0.1f, 0.9f });
    }

    @Test
    void testSearchStaysInClosestCluster() {
        List<Neighbor> neighbors = index.search(new float[] { 1f, 0f, 0f }, 10);

        assertEquals(2, index.clusterCount());
        assertEquals(4, neighbors.size());
        assertEquals("x1", neighbors.get(0).id());
        assertEquals(1.0, neighbors.get(0).similarity(), 1e-6);
        assertTrue(neighbors.stream().allMatch(n -> n.id().startsWith("x")));
        for (int i = 1; i < neighbors.size(); i++) {
            assertTrue(neighbors.get(i - 1).similarity() >= neighbors.get(i).similarity());
        }
    }

    @Test
    void testFullSearchFractionVisitsEveryCluster() {
        ClusterIndex exhaustive = new ClusterIndex(3, 2, TuningConfig.DEFAULT_SEED, 1.0);
        addGroups(exhaustive);

        List<Neighbor> neighbors = exhaustive.search(new float[] { 1f, 0f, 0f }, 10);

        assertEquals(8, neighbors.size());
        assertEquals("x1", neighbors.get(0).id());
        assertTrue(neighbors.get(7).id().startsWith("z"));
        assertEquals(3, exhaustive.search(new float[] { 0f, 0f, 1f }, 3).size());
    }

    @Test
    void testClusterCountIsCappedByVectors() {
        ClusterIndex small = new ClusterIndex(3, 50, 7L);
        small.add("a", new float[] { 1f, 0f, 0f });
        small.add("b", new float[] { 0f, 1f, 0f });
        small.add("c", new float[] { 0f, 0f, 1f });

        assertEquals(3, small.clusterCount());
        assertEquals("b", small.search(new float[] { 0f, 1f, 0f }, 1).get(0).id());
    }

    @Test
    void testIdenticalEmbeddingsStayTogether() {
        ClusterIndex copies = new ClusterIndex(2, 3, 1L);
        for (int i = 0; i < 5; i++) {
            copies.add("copy" + i, new float[] { 0.6f, 0.8f });
        }

        List<Neighbor> neighbors = copies.search(new float[] { 0.6f, 0.8f }, 10);

        assertEquals(3, copies.clusterCount());
        assertEquals(5, neighbors.size());
        assertEquals("copy0", neighbors.get(0).id());
        assertEquals("copy4", neighbors.get(4).id());
    }

    @Test
    void testInsertAfterSearchRebuildsPartitions() {
        assertEquals(4, index.search(new float[] { 0f, 0f, 1f }, 10).size());

        index.add("z5", new float[] { 0f, 0f, 0.99f });

        List<Neighbor> neighbors = index.search(new float[] { 0f, 0f, 1f }, 10);
        assertEquals(5, neighbors.size());
        assertTrue(neighbors.stream().anyMatch(n -> n.id().equals("z5")));
        assertEquals(9, index.size());
    }

    @Test
    void testSameSeedSameResults() {
        ClusterIndex twin = new ClusterIndex(3, 2, TuningConfig.DEFAULT_SEED);
        addGroups(twin);
        float[] query = { 0.5f, 0.1f, 0.5f };

        assertEquals(index.search(query, 8), twin.search(query, 8));
    }

    @Test
    void testInvalidShape() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> index.add("w", new float[] { 1f, 2f }));
        assertTrue(e.getMessage().contains("Embedding dimension mismatch"));
        assertThrows(IllegalArgumentException.class, () -> new ClusterIndex(3, 0, 1L));
        assertThrows(IllegalArgumentException.class, () -> new ClusterIndex(3, 2, 1L, 0.0));
        assertTrue(new ClusterIndex(3, 2, 1L).search(new float[] { 1f, 0f, 0f }, 5).isEmpty());
    }
}
