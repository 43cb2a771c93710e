package com.z254.strongbox.metrics.domain;

/**
 * Thrown when work is attempted after the tick was cancelled or its deadline passed.
 */
public class CollectionCancelledException extends RuntimeException {

    public CollectionCancelledException(String message) {
        super(message);
    }
}
