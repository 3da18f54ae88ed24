package com.workplaceintel.occupancy.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

/**
 * One cell of the occupancy fact grid.
 *
 * Rows are created by the grid expander with zero attendance and then enriched in place
 * by each later stage (filler, capacity resolver, occupancy calculator, hybrid classifier).
 * The line-of-business columns are null in the aggregated variant.
 */
@Data
@Builder
public class FactRow {

    // ── Keys ────────────────────────────────────────────────────────────────
    private int dateKey;
    private int locationKey;
    private Integer lobKey;

    // ── Descriptive attributes ──────────────────────────────────────────────
    private LocalDate date;
    private String locationName;
    private String lobName;
    private int year;
    private int month;
    private boolean weekend;

    // ── Measures ────────────────────────────────────────────────────────────
    /** Number of attendance events for this cell; 0 when none were observed, never null */
    private int attendanceCount;

    /** Desk count carried forward from the latest valid snapshot; null when none exists yet */
    private Integer capacity;

    /** attendanceCount / capacity, null unless capacity is positive */
    private Double occupancyRate;

    /** True when this date is one of the office's anchor days for its ISO week */
    private boolean hybridDay;
}
