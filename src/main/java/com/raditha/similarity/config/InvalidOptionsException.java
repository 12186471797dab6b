package com.raditha.similarity.config;

import com.raditha.similarity.SimilarityException;

/**
 * Thrown when analysis options or tuning values are out of range.
 * Raised before any detector runs.
 */
public class InvalidOptionsException extends SimilarityException {

    public InvalidOptionsException(String message) {
        super(message);
    }
}
