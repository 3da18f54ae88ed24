package com.workplaceintel.occupancy.engine;

import java.time.LocalDate;
import java.time.temporal.IsoFields;

/**
 * ISO-8601 week identity. The week-based year differs from the calendar year near
 * year boundaries, e.g. 2024-12-30 falls in 2025-W01.
 */
public record IsoWeek(int weekBasedYear, int week) implements Comparable<IsoWeek> {

    public static IsoWeek of(LocalDate date) {
        return new IsoWeek(date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    @Override
    public int compareTo(IsoWeek other) {
        int byYear = Integer.compare(weekBasedYear, other.weekBasedYear);
        return byYear != 0 ? byYear : Integer.compare(week, other.week);
    }

    @Override
    public String toString() {
        return String.format("%d-W%02d", weekBasedYear, week);
    }
}
