package com.raditha.similarity.lsh;

import com.raditha.similarity.config.TuningConfig;
import com.raditha.similarity.model.Fingerprint;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SimHashTest {

    private SimHash simHash;

    @BeforeEach
    void setUp() {
        simHash = new SimHash(64, 3, 5, TuningConfig.DEFAULT_SEED);
    }

    static List<String> tokens(String prefix, int count) {
        List<String> tokens = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            tokens.add(prefix + i);
        }
        return tokens;
    }

    @Test
    void testDeterministic() {
        List<String> tokens = tokens("tok", 40);

        assertEquals(simHash.compute(tokens), simHash.compute(new ArrayList<>(tokens)));
        assertEquals(simHash.compute(tokens),
                new SimHash(64, 3, 5, TuningConfig.DEFAULT_SEED).compute(tokens));
    }

    @Test
    void testNearDuplicatesAreCloserThanUnrelated() {
        List<String> base = tokens("tok", 40);
        List<String> near = new ArrayList<>(base);
        near.set(20, "other");
        List<String> unrelated = tokens("x", 40);

        Fingerprint a = simHash.compute(base);
        Fingerprint b = simHash.compute(near);
        Fingerprint c = simHash.compute(unrelated);

        assertTrue(a.hammingDistance(b) > 0);
        assertTrue(a.hammingDistance(b) < a.hammingDistance(c),
                "one changed token should move the fingerprint less than a different stream");
    }

    @Test
    void testEmptyStreamIsAllZero() {
        Fingerprint empty = simHash.compute(List.of());

        assertEquals(new Fingerprint(new long[] { 0L }, 64), empty);
    }

    @Test
    void testWideFingerprint() {
        SimHash wide = new SimHash(128, 3, 5, TuningConfig.DEFAULT_SEED);

        Fingerprint fp = wide.compute(tokens("tok", 40));
        assertEquals(128, fp.bits());
        assertEquals(2, fp.words().length);
        assertEquals(128, wide.getBits());
    }

    @Test
    void testShingles() {
        Map<String, Integer> shingles = simHash.shingleWeights(List.of("a", "b", "a", "b", "a"));

        assertEquals(2, shingles.get("3:a b a"));
        assertEquals(1, shingles.get("3:b a b"));
        assertEquals(1, shingles.get("5:a b a b a"));
        assertEquals(1, simHash.shingleWeights(List.of("a", "b")).get("a b"));
    }

    @Test
    void testRejectsInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new SimHash(32, 3, 5, 1L));
        assertThrows(IllegalArgumentException.class, () -> new SimHash(64, 4, 3, 1L));
    }

    @Property(tries = 30)
    void identicalStreamsHaveIdenticalFingerprints(@ForAll @IntRange(min = 1, max = 200) int length) {
        SimHash hash = new SimHash(64, 3, 5, TuningConfig.DEFAULT_SEED);
        List<String> tokens = tokens("t", length);

        assertEquals(0, hash.compute(tokens).hammingDistance(hash.compute(List.copyOf(tokens))));
    }
}
