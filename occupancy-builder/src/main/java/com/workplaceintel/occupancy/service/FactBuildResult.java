package com.workplaceintel.occupancy.service;

import com.workplaceintel.occupancy.model.FactTable;

/**
 * Both fact variants of one build, fully computed and not yet persisted.
 */
public record FactBuildResult(FactTable byLineOfBusiness, FactTable aggregated) {}
