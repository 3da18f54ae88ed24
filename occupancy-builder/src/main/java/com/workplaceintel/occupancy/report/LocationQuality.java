package com.workplaceintel.occupancy.report;

/**
 * Weekday data-quality figures for one office.
 *
 * @param meanOccupancyRate mean over rows with a known rate; null when the office never had capacity
 */
public record LocationQuality(String officeLocation,
                              int rows,
                              Double meanOccupancyRate,
                              int unresolvedWithAttendance,
                              int overCapacityDays) {}
