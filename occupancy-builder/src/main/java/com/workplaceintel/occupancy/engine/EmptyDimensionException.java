package com.workplaceintel.occupancy.engine;

public class EmptyDimensionException extends FactBuildException {

    private final String dimension;

    public EmptyDimensionException(String dimension) {
        super("Dimension '" + dimension + "' has no rows; cannot expand the fact grid");
        this.dimension = dimension;
    }

    public String getDimension() {
        return dimension;
    }
}
