package com.raditha.similarity.lsh;

import com.raditha.similarity.model.Fingerprint;
import com.raditha.similarity.model.SimilarityPair.PairKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * LSH index using the banding technique over bit fingerprints.
 * The fingerprint is split into equal bands; functions whose bits agree on a
 * whole band land in the same bucket and become candidate pairs.
 * <p>
 * The index is filled once and only read afterwards. A bucket larger than
 * {@code maxBucketSize} yields no near-duplicate candidates; only members with
 * identical full fingerprints are still paired inside it.
 */
public class FingerprintLSHIndex {

    private static final Logger logger = LoggerFactory.getLogger(FingerprintLSHIndex.class);

    private final int numBands;
    private final int bandWidth;
    private final int maxBucketSize;
    private final Map<BandKey, List<String>> buckets = new HashMap<>();
    private final Map<String, Fingerprint> fingerprints = new HashMap<>();
    private int oversizedBuckets;

    private record BandKey(int band, long bits) {
    }

    /**
     * @param numBands      Number of bands k
     * @param bandWidth     Bits per band; must divide 64
     * @param maxBucketSize Largest bucket that still produces candidates
     */
    public FingerprintLSHIndex(int numBands, int bandWidth, int maxBucketSize) {
        if (numBands < 1 || bandWidth < 1 || bandWidth > 64 || 64 % bandWidth != 0) {
            throw new IllegalArgumentException(
                    String.format("Invalid banding: %d bands of %d bits", numBands, bandWidth));
        }
        this.numBands = numBands;
        this.bandWidth = bandWidth;
        this.maxBucketSize = maxBucketSize;
    }

    /**
     * Index a fingerprint under each of its bands.
     */
    public void add(String functionId, Fingerprint fingerprint) {
        if (fingerprint.bits() != numBands * bandWidth) {
            throw new IllegalArgumentException(String.format(
                    "Fingerprint width %d does not match %d bands * %d bits",
                    fingerprint.bits(), numBands, bandWidth));
        }
        fingerprints.put(functionId, fingerprint);
        for (int b = 0; b < numBands; b++) {
            BandKey key = new BandKey(b, fingerprint.band(b, bandWidth));
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(functionId);
        }
    }

    /**
     * Candidate pairs with the number of bands they share, ordered by pair.
     */
    public Map<PairKey, Integer> candidatePairs() {
        Map<PairKey, Integer> candidates = new TreeMap<>();
        oversizedBuckets = 0;
        for (Map.Entry<BandKey, List<String>> bucket : buckets.entrySet()) {
            List<String> members = bucket.getValue();
            if (members.size() < 2) {
                continue;
            }
            if (members.size() > maxBucketSize) {
                oversizedBuckets++;
                logger.debug("Oversized LSH bucket of band {} with {} members (limit {}), keeping exact matches only",
                        bucket.getKey().band(), members.size(), maxBucketSize);
                for (List<String> identical : splitByFingerprint(members)) {
                    addPairs(identical, candidates);
                }
                continue;
            }
            addPairs(members, candidates);
        }
        return candidates;
    }

    private List<List<String>> splitByFingerprint(List<String> members) {
        Map<Fingerprint, List<String>> byFingerprint = new LinkedHashMap<>();
        for (String member : members) {
            byFingerprint.computeIfAbsent(fingerprints.get(member), k -> new ArrayList<>()).add(member);
        }
        return new ArrayList<>(byFingerprint.values());
    }

    private static void addPairs(List<String> members, Map<PairKey, Integer> candidates) {
        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                if (!members.get(i).equals(members.get(j))) {
                    candidates.merge(PairKey.of(members.get(i), members.get(j)), 1, Integer::sum);
                }
            }
        }
    }

    public int getOversizedBuckets() {
        return oversizedBuckets;
    }

    public int getBucketCount() {
        return buckets.size();
    }
}
