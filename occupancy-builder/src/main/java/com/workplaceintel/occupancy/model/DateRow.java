package com.workplaceintel.occupancy.model;

import java.time.LocalDate;

/**
 * One row of the Date dimension.
 *
 * @param date     calendar date
 * @param dateKey  surrogate key in YYYYMMDD form, e.g. 20250131
 * @param year     calendar year
 * @param month    calendar month, 1-12
 * @param weekend  true for Saturday and Sunday
 */
public record DateRow(LocalDate date, int dateKey, int year, int month, boolean weekend) {

    public static DateRow of(LocalDate date) {
        int key = date.getYear() * 10000 + date.getMonthValue() * 100 + date.getDayOfMonth();
        boolean weekend = date.getDayOfWeek().getValue() >= 6;
        return new DateRow(date, key, date.getYear(), date.getMonthValue(), weekend);
    }
}
