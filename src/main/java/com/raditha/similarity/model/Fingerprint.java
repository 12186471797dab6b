package com.raditha.similarity.model;

import java.util.Arrays;

/**
 * Fixed width bit vector produced by random hyperplane projection.
 * Bit {@code i} lives in word {@code i / 64} at position {@code i % 64}.
 *
 * @param words Packed bits
 * @param bits  Fingerprint width, 64 or 128
 */
public record Fingerprint(long[] words, int bits) {

    public Fingerprint {
        if (bits != 64 && bits != 128) {
            throw new IllegalArgumentException("Fingerprint width must be 64 or 128, got " + bits);
        }
        if (words == null || words.length != bits / 64) {
            throw new IllegalArgumentException("Expected " + (bits / 64) + " words for " + bits + " bits");
        }
        words = words.clone();
    }

    @Override
    public long[] words() {
        return words.clone();
    }

    public boolean bit(int index) {
        return (words[index >>> 6] & (1L << (index & 63))) != 0;
    }

    /**
     * Number of differing bits.
     */
    public int hammingDistance(Fingerprint other) {
        if (other.bits != bits) {
            throw new IllegalArgumentException("Cannot compare fingerprints of width " + bits + " and " + other.bits);
        }
        int distance = 0;
        for (int i = 0; i < words.length; i++) {
            distance += Long.bitCount(words[i] ^ other.words[i]);
        }
        return distance;
    }

    /**
     * Similarity in [0,1] derived from the Hamming distance: {@code 1 - d / bits}.
     */
    public double similarity(Fingerprint other) {
        return 1.0 - (double) hammingDistance(other) / bits;
    }

    /**
     * Extract a band of consecutive bits as an unsigned value.
     * Bands never straddle a word because the width divides 64.
     *
     * @param bandIndex Band number
     * @param bandWidth Bits per band (1..64, must divide 64)
     */
    public long band(int bandIndex, int bandWidth) {
        int start = bandIndex * bandWidth;
        long word = words[start >>> 6] >>> (start & 63);
        return bandWidth == 64 ? word : word & ((1L << bandWidth) - 1);
    }

    public String toHex() {
        StringBuilder sb = new StringBuilder();
        for (int i = words.length - 1; i >= 0; i--) {
            sb.append(String.format("%016x", words[i]));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint that)) return false;
        return bits == that.bits && Arrays.equals(words, that.words);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(words) + bits;
    }

    @Override
    public String toString() {
        return "Fingerprint[" + bits + "]" + toHex();
    }
}
