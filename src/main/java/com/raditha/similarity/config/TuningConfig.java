package com.raditha.similarity.config;

/**
 * Algorithm constants for the representation builder and detectors.
 * <p>
 * The LSH trade-off lives here: with {@code fingerprintBits = B} split into
 * {@code bands = k} bands of {@code B / k} bits, two fingerprints at Hamming
 * similarity {@code s} collide in at least one band with probability
 * {@code 1 - (1 - s^(B/k))^k}. More bands raise recall and candidate volume.
 *
 * @param fingerprintBits  Fingerprint width B, 64 or 128
 * @param bands            Number of LSH bands k; B/k must divide 64
 * @param shingleMin       Smallest token n-gram used for fingerprints
 * @param shingleMax       Largest token n-gram used for fingerprints
 * @param maxBucketSize    LSH buckets larger than this are skipped as boilerplate
 * @param seed             Seed for hyperplanes; fixed so output is reproducible
 * @param structuralWeights Feature weights for the structural detector
 * @param sizeRatio        Minimum token count ratio (smaller/larger) for structural comparison
 * @param annPlanes        Hyperplanes per ANN table
 * @param annTables        Number of ANN hash tables
 * @param annTopK          Neighbours retrieved per function
 * @param annAlgorithm     Index behind the semantic detector
 * @param annClusters      Upper bound on k-means partitions for the hierarchical index
 */
public record TuningConfig(
        int fingerprintBits,
        int bands,
        int shingleMin,
        int shingleMax,
        int maxBucketSize,
        long seed,
        StructuralWeights structuralWeights,
        double sizeRatio,
        int annPlanes,
        int annTables,
        int annTopK,
        AnnAlgorithm annAlgorithm,
        int annClusters) {

    public static final long DEFAULT_SEED = 0x5DEECE66DL;

    public TuningConfig {
        if (fingerprintBits != 64 && fingerprintBits != 128) {
            throw new InvalidOptionsException("fingerprintBits must be 64 or 128, got " + fingerprintBits);
        }
        if (bands <= 0 || fingerprintBits % bands != 0) {
            throw new InvalidOptionsException(
                    String.format("bands (%d) must evenly divide fingerprintBits (%d)", bands, fingerprintBits));
        }
        if (64 % (fingerprintBits / bands) != 0) {
            throw new InvalidOptionsException(
                    String.format("band width %d must divide 64", fingerprintBits / bands));
        }
        if (shingleMin < 1 || shingleMax < shingleMin) {
            throw new InvalidOptionsException(
                    String.format("Invalid shingle range [%d, %d]", shingleMin, shingleMax));
        }
        if (maxBucketSize < 2) {
            throw new InvalidOptionsException("maxBucketSize must be >= 2, got " + maxBucketSize);
        }
        if (structuralWeights == null) {
            throw new InvalidOptionsException("structuralWeights cannot be null");
        }
        if (!(sizeRatio >= 0.0 && sizeRatio <= 1.0)) {
            throw new InvalidOptionsException("sizeRatio must be in [0, 1], got " + sizeRatio);
        }
        if (annPlanes < 1 || annPlanes > 30) {
            throw new InvalidOptionsException("annPlanes must be in [1, 30], got " + annPlanes);
        }
        if (annTables < 1) {
            throw new InvalidOptionsException("annTables must be >= 1, got " + annTables);
        }
        if (annTopK < 1) {
            throw new InvalidOptionsException("annTopK must be >= 1, got " + annTopK);
        }
        if (annAlgorithm == null) {
            throw new InvalidOptionsException("annAlgorithm cannot be null");
        }
        if (annClusters < 1) {
            throw new InvalidOptionsException("annClusters must be >= 1, got " + annClusters);
        }
    }

    /**
     * 64-bit fingerprints in 8 bands of 8 bits, 3..5-gram shingles, hyperplane ANN.
     */
    public static TuningConfig defaults() {
        return new TuningConfig(64, 8, 3, 5, 10, DEFAULT_SEED,
                StructuralWeights.balanced(), 0.5, 6, 4, 10, AnnAlgorithm.LSH, 50);
    }

    /**
     * Bits per LSH band.
     */
    public int bandWidth() {
        return fingerprintBits / bands;
    }

    public TuningConfig withLsh(int newBits, int newBands) {
        return new TuningConfig(newBits, newBands, shingleMin, shingleMax, maxBucketSize, seed,
                structuralWeights, sizeRatio, annPlanes, annTables, annTopK, annAlgorithm, annClusters);
    }

    public TuningConfig withMaxBucketSize(int newMaxBucketSize) {
        return new TuningConfig(fingerprintBits, bands, shingleMin, shingleMax, newMaxBucketSize, seed,
                structuralWeights, sizeRatio, annPlanes, annTables, annTopK, annAlgorithm, annClusters);
    }

    public TuningConfig withStructuralWeights(StructuralWeights newWeights) {
        return new TuningConfig(fingerprintBits, bands, shingleMin, shingleMax, maxBucketSize, seed,
                newWeights, sizeRatio, annPlanes, annTables, annTopK, annAlgorithm, annClusters);
    }

    public TuningConfig withAnn(AnnAlgorithm newAlgorithm, int newClusters) {
        return new TuningConfig(fingerprintBits, bands, shingleMin, shingleMax, maxBucketSize, seed,
                structuralWeights, sizeRatio, annPlanes, annTables, annTopK, newAlgorithm, newClusters);
    }
}
