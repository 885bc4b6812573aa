package com.agentfederation.core.exception;

/**
 * A dense trust vector did not carry exactly one score per category.
 */
public class DimensionMismatchException extends FederationException {
    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super("Geometry", "Expected " + expected + "-dimensional vector, got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
