package com.workplaceintel.occupancy.report;

import com.workplaceintel.occupancy.model.FactRow;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Data-quality conditions that are expected in real data and therefore reported, not raised.
 *
 * @param mergeIssueRows per-LOB rows with attendance but no valid capacity, by office then date
 * @param overCapacityRows per-LOB rows with occupancy_rate above 1.0, by office then date
 */
public record DataQualitySummary(int factRows,
                                 int aggregatedRows,
                                 LocalDate factFirstDate,
                                 LocalDate factLastDate,
                                 LocalDate aggregatedFirstDate,
                                 LocalDate aggregatedLastDate,
                                 long locationsInFact,
                                 int locationsInDimension,
                                 long linesOfBusinessInFact,
                                 Double weekdayMeanOccupancy,
                                 Double weekendMeanOccupancy,
                                 long unresolvedCapacityRows,
                                 long hybridDayRows,
                                 LocalDate latestAttendanceDate,
                                 LocalDate latestSnapshotDate,
                                 Long snapshotGapDays,
                                 List<FactRow> mergeIssueRows,
                                 List<FactRow> overCapacityRows,
                                 List<LocationQuality> byLocation) {

    public long unresolvedWithAttendanceRows() {
        return mergeIssueRows.size();
    }

    public List<String> toLines() {
        return List.of(
                "== Summary ==",
                format("Fact rows: %,d; Agg rows: %,d", factRows, aggregatedRows),
                format("Fact date range: %s to %s", orNa(factFirstDate), orNa(factLastDate)),
                format("Agg date range: %s to %s", orNa(aggregatedFirstDate), orNa(aggregatedLastDate)),
                format("Locations: %d (dim: %d)", locationsInFact, locationsInDimension),
                format("LOBs: %d (in fact)", linesOfBusinessInFact),
                format("Mean occupancy (weekday): %s; (weekend): %s",
                        mean(weekdayMeanOccupancy), mean(weekendMeanOccupancy)),
                format("Rows without valid capacity: %,d (%s)", unresolvedCapacityRows, pct(unresolvedCapacityRows)),
                format("Rows with attendance>0 and no capacity: %,d (%s)",
                        unresolvedWithAttendanceRows(), pct(unresolvedWithAttendanceRows())),
                format("Rows with occupancy_rate > 1.0: %,d (%s)", overCapacityRows.size(), pct(overCapacityRows.size())),
                format("Hybrid day rows: %,d (%s)", hybridDayRows, pct(hybridDayRows)),
                format("Latest attendance: %s, latest capacity snapshot: %s, gap: %s days",
                        orNa(latestAttendanceDate), orNa(latestSnapshotDate), orNa(snapshotGapDays)));
    }

    private String pct(long n) {
        return factRows == 0 ? "n/a" : format("%.1f%%", n * 100.0 / factRows);
    }

    private static String mean(Double value) {
        return value == null ? "n/a" : format("%.3f", value);
    }

    private static String orNa(Object value) {
        return value == null ? "n/a" : value.toString();
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
