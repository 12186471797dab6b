package com.raditha.similarity.normalization;

import java.nio.charset.StandardCharsets;

/**
 * 64-bit FNV-1a hashing and the position sensitive combiner used for Merkle
 * hashes.
 */
public final class Fnv {

    static final long OFFSET_BASIS = 0xcbf29ce484222325L;
    static final long PRIME = 0x100000001b3L;

    private Fnv() {
    }

    public static long hash(String text) {
        return hash(OFFSET_BASIS, text);
    }

    /**
     * Continue an FNV-1a hash with the UTF-8 bytes of {@code text}.
     */
    public static long hash(long seed, String text) {
        long h = seed;
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            h ^= (b & 0xff);
            h *= PRIME;
        }
        return h;
    }

    /**
     * Fold ordered child hashes into a parent hash. The position takes part in
     * the mix so swapping two different children changes the result.
     */
    public static long mix(long parent, long[] children) {
        long result = parent;
        for (int position = 0; position < children.length; position++) {
            result = (result ^ ((children[position] + position) << 1)) * PRIME;
        }
        return result;
    }

    /**
     * MurmurHash3 finalizer, spreads the bits of a 64-bit value.
     */
    public static long scramble(long value) {
        long h = value;
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }
}
