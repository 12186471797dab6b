package com.raditha.similarity.model;

/**
 * A function left out of the representation set, with the reason.
 */
public record SkipRecord(String functionId, String reason) {
}
