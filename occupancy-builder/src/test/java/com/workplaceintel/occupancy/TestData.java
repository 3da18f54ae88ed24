package com.workplaceintel.occupancy;

import com.workplaceintel.occupancy.model.AttendanceEvent;
import com.workplaceintel.occupancy.model.CapacitySnapshot;
import com.workplaceintel.occupancy.model.DateRow;
import com.workplaceintel.occupancy.model.FactRow;
import com.workplaceintel.occupancy.model.LineOfBusinessRow;
import com.workplaceintel.occupancy.model.LocationRow;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Small builders shared by the tests.
 */
public final class TestData {

    private TestData() {}

    public static LocalDate d(String iso) {
        return LocalDate.parse(iso);
    }

    public static List<DateRow> dates(String fromInclusive, String toInclusive) {
        List<DateRow> rows = new ArrayList<>();
        for (LocalDate day = d(fromInclusive); !day.isAfter(d(toInclusive)); day = day.plusDays(1)) {
            rows.add(DateRow.of(day));
        }
        return rows;
    }

    public static LocationRow location(int key, String name) {
        return new LocationRow(key, name);
    }

    public static LineOfBusinessRow lob(int key, String name) {
        return new LineOfBusinessRow(key, name);
    }

    public static List<AttendanceEvent> attendance(String date, String office, String lob, int people) {
        return Collections.nCopies(people, new AttendanceEvent(d(date), office, lob));
    }

    public static CapacitySnapshot snapshot(String office, String date, Integer capacity) {
        return new CapacitySnapshot(office, d(date), capacity);
    }

    /**
     * A bare grid row as the expander would produce it, with the given attendance.
     */
    public static FactRow row(String date, String office, String lob, int attendance) {
        DateRow dateRow = DateRow.of(d(date));
        return FactRow.builder()
                .dateKey(dateRow.dateKey())
                .date(dateRow.date())
                .year(dateRow.year())
                .month(dateRow.month())
                .weekend(dateRow.weekend())
                .locationKey(Math.abs(office.hashCode() % 100))
                .locationName(office)
                .lobKey(lob == null ? null : Math.abs(lob.hashCode() % 100))
                .lobName(lob)
                .attendanceCount(attendance)
                .build();
    }
}
