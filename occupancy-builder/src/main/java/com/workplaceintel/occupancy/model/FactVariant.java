package com.workplaceintel.occupancy.model;

/**
 * The two published shapes of the occupancy fact.
 */
public enum FactVariant {

    /** date × location × line of business */
    BY_LINE_OF_BUSINESS("FactOccupancy.csv"),

    /** date × location, attendance summed across lines of business */
    AGGREGATED("FactOccupancyAggregated.csv");

    private final String fileName;

    FactVariant(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }

    public boolean includesLineOfBusiness() {
        return this == BY_LINE_OF_BUSINESS;
    }
}
