package com.raditha.similarity.model;

/**
 * One additive change applied to a base confidence.
 *
 * @param reason Short reason code
 * @param delta  Signed amount added to the score
 */
public record Adjustment(String reason, double delta) {
}
