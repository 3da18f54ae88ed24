package com.workplaceintel.occupancy.engine;

/**
 * Base for structural failures that abort a fact build. A build that raises one of these
 * writes no output.
 */
public class FactBuildException extends RuntimeException {

    public FactBuildException(String message) {
        super(message);
    }

    public FactBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
