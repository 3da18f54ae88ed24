package com.workplaceintel.occupancy.engine;

/**
 * A join did not find exactly one partner. Indicates a mismatch between the dimensions
 * and the data joined onto the grid, never an expected data-quality condition.
 */
public class InconsistentKeyException extends FactBuildException {

    public InconsistentKeyException(String message) {
        super(message);
    }
}
