package com.workplaceintel.occupancy.model;

import java.time.LocalDate;

/**
 * Desk count recorded for an office, valid from {@code effectiveDate} until a later snapshot
 * for the same office supersedes it.
 *
 * @param capacity desk count; null, zero or negative means no valid capacity is known
 */
public record CapacitySnapshot(String officeLocation, LocalDate effectiveDate, Integer capacity) {

    public boolean isValid() {
        return capacity != null && capacity > 0;
    }
}
