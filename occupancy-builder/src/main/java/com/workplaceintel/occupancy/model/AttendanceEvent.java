package com.workplaceintel.occupancy.model;

import java.time.LocalDate;

/**
 * A single cleaned badge-in observation: one person, one day, one office.
 * Identity of the person is already stripped upstream; only the grouped count matters here.
 */
public record AttendanceEvent(LocalDate date, String officeLocation, String lineOfBusiness) {}
