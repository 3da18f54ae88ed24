package com.workplaceintel.occupancy.engine;

import com.workplaceintel.occupancy.model.FactRow;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Occupancy rate per row. Unknown capacity stays unknown: the rate is never coerced to 0 or 1.
 */
@Component
public class OccupancyCalculator {

    public void apply(List<FactRow> grid) {
        for (FactRow row : grid) {
            row.setOccupancyRate(rate(row.getAttendanceCount(), row.getCapacity()));
        }
    }

    public static Double rate(int attendanceCount, Integer capacity) {
        if (capacity == null || capacity <= 0) return null;
        return attendanceCount / (double) capacity;
    }
}
