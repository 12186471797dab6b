package com.raditha.similarity.detection;

/**
 * Skips function pairs whose token counts are too far apart to be
 * structurally similar.
 */
public class SizeFilter {

    private final double minSizeRatio;

    /**
     * @param minSizeRatio Minimum ratio of smaller to larger token count (0.0 to 1.0)
     */
    public SizeFilter(double minSizeRatio) {
        if (minSizeRatio < 0.0 || minSizeRatio > 1.0) {
            throw new IllegalArgumentException("Size ratio must be between 0.0 and 1.0");
        }
        this.minSizeRatio = minSizeRatio;
    }

    /**
     * Check if two token counts are close enough to be compared.
     *
     * @return true if the pair should be compared, false if it should be skipped
     */
    public boolean shouldCompare(int size1, int size2) {
        if (size1 == size2) {
            return true;
        }
        int maxSize = Math.max(size1, size2);
        int minSize = Math.min(size1, size2);
        return (double) minSize / maxSize >= minSizeRatio;
    }
}
