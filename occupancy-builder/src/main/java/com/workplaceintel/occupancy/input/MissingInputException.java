package com.workplaceintel.occupancy.input;

import com.workplaceintel.occupancy.engine.FactBuildException;

import java.nio.file.Path;
import java.util.List;

/**
 * One or more upstream datasets are absent. Raised before any stage runs.
 */
public class MissingInputException extends FactBuildException {

    private final List<Path> missing;

    public MissingInputException(List<Path> missing) {
        super("Missing required input(s): " + missing);
        this.missing = List.copyOf(missing);
    }

    public List<Path> getMissing() {
        return missing;
    }
}
