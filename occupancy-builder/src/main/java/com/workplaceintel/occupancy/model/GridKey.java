package com.workplaceintel.occupancy.model;

import java.time.LocalDate;

/**
 * Natural key of a grid cell. {@code lineOfBusiness} is null for the aggregated variant.
 */
public record GridKey(LocalDate date, String officeLocation, String lineOfBusiness) {

    public static GridKey of(FactRow row) {
        return new GridKey(row.getDate(), row.getLocationName(), row.getLobName());
    }

    public static GridKey of(AttendanceEvent event, FactVariant variant) {
        return new GridKey(event.date(), event.officeLocation(),
                variant.includesLineOfBusiness() ? event.lineOfBusiness() : null);
    }
}
