package com.workplaceintel.occupancy.input;

import com.workplaceintel.occupancy.engine.FactBuildException;

public class MalformedInputException extends FactBuildException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
