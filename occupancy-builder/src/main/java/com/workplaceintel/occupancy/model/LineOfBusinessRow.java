package com.workplaceintel.occupancy.model;

public record LineOfBusinessRow(int lobKey, String lineOfBusiness) {}
