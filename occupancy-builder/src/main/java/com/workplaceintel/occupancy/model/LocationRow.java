package com.workplaceintel.occupancy.model;

/**
 * One office in the Location dimension. {@code officeLocation} is the normalised office name
 * used as the natural key everywhere else in the pipeline.
 */
public record LocationRow(int locationKey, String officeLocation) {}
