package com.raditha.similarity;

/**
 * Root of the similarity engine's unchecked exceptions.
 */
public class SimilarityException extends RuntimeException {

    public SimilarityException(String message) {
        super(message);
    }

    public SimilarityException(String message, Throwable cause) {
        super(message, cause);
    }
}
