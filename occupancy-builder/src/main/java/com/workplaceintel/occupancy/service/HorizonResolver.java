package com.workplaceintel.occupancy.service;

import com.workplaceintel.occupancy.config.OccupancyBuilderProperties;
import com.workplaceintel.occupancy.engine.EmptyDimensionException;
import com.workplaceintel.occupancy.engine.Horizon;
import com.workplaceintel.occupancy.input.PipelineInputs;
import com.workplaceintel.occupancy.model.AttendanceEvent;
import com.workplaceintel.occupancy.model.CapacitySnapshot;
import com.workplaceintel.occupancy.model.DateRow;
import com.workplaceintel.occupancy.model.FactVariant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.Optional;

/**
 * Decides the date window each fact variant covers.
 *
 * Per-LOB fact:     Date dimension start .. latest capacity snapshot.
 * Aggregated fact:  first attendance date .. min(last attendance date, month-end of latest snapshot).
 *
 * Without snapshots the cutoff falls back to the last attendance date; without attendance
 * both ends fall back to the Date dimension bounds. Configured start/cutoff dates win over
 * anything derived.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HorizonResolver {

    private final OccupancyBuilderProperties properties;

    public Horizon resolve(PipelineInputs inputs, FactVariant variant) {
        LocalDate dimStart = inputs.dates().stream().map(DateRow::date)
                .min(Comparator.naturalOrder())
                .orElseThrow(() -> new EmptyDimensionException("date"));
        LocalDate dimEnd = inputs.dates().stream().map(DateRow::date)
                .max(Comparator.naturalOrder())
                .orElseThrow(() -> new EmptyDimensionException("date"));

        Optional<LocalDate> firstAttendance = inputs.attendance().stream().map(AttendanceEvent::date)
                .min(Comparator.naturalOrder());
        Optional<LocalDate> lastAttendance = inputs.attendance().stream().map(AttendanceEvent::date)
                .max(Comparator.naturalOrder());
        Optional<LocalDate> lastSnapshot = inputs.capacity().stream().map(CapacitySnapshot::effectiveDate)
                .max(Comparator.naturalOrder());

        LocalDate start;
        LocalDate cutoff;
        if (variant == FactVariant.BY_LINE_OF_BUSINESS) {
            start = dimStart;
            cutoff = lastSnapshot.or(() -> lastAttendance).orElse(dimEnd);
        } else {
            start = firstAttendance.orElse(dimStart);
            LocalDate attendanceEnd = lastAttendance.orElse(dimEnd);
            cutoff = lastSnapshot
                    .map(d -> YearMonth.from(d).atEndOfMonth())
                    .map(monthEnd -> monthEnd.isBefore(attendanceEnd) ? monthEnd : attendanceEnd)
                    .orElse(attendanceEnd);
        }

        OccupancyBuilderProperties.Horizon override = properties.getHorizon();
        if (override.getStartDate() != null) start = override.getStartDate();
        if (override.getCutoffDate() != null) cutoff = override.getCutoffDate();

        Horizon horizon = new Horizon(start, cutoff);
        log.info("{} horizon {}", variant, horizon);
        return horizon;
    }
}
