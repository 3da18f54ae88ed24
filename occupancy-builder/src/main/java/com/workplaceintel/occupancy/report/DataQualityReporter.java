package com.workplaceintel.occupancy.report;

import com.opencsv.CSVWriter;
import com.workplaceintel.occupancy.config.OccupancyBuilderProperties;
import com.workplaceintel.occupancy.input.PipelineInputs;
import com.workplaceintel.occupancy.model.AttendanceEvent;
import com.workplaceintel.occupancy.model.CapacitySnapshot;
import com.workplaceintel.occupancy.model.FactRow;
import com.workplaceintel.occupancy.model.FactTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Summarises the per-LOB fact for data-quality review: date coverage, weekday and weekend
 * occupancy, rows whose capacity could not be resolved, over-capacity days and how stale
 * the capacity snapshots are.
 *
 * Files written under the report directory:
 *   validation_summary.txt       headline counts
 *   by_location_summary.csv      weekday figures per office, worst offices first
 *   deskcount_merge_issues.csv   only when some row has attendance but no valid capacity
 *   over_capacity_days.csv       only when at least one row has occupancy_rate > 1.0
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DataQualityReporter {

    private final OccupancyBuilderProperties properties;

    public DataQualitySummary summarize(FactTable fact, FactTable aggregated, PipelineInputs inputs) {
        List<FactRow> rows = fact.rows();
        Comparator<FactRow> byOfficeThenDate =
                Comparator.comparing(FactRow::getLocationName).thenComparing(FactRow::getDate);

        List<FactRow> mergeIssues = rows.stream()
                .filter(DataQualityReporter::isMergeIssue)
                .sorted(byOfficeThenDate)
                .toList();

        List<FactRow> overCapacity = rows.stream()
                .filter(DataQualityReporter::isOverCapacity)
                .sorted(byOfficeThenDate)
                .toList();

        LocalDate latestAttendance = inputs.attendance().stream().map(AttendanceEvent::date)
                .max(Comparator.naturalOrder()).orElse(null);
        LocalDate latestSnapshot = inputs.capacity().stream().map(CapacitySnapshot::effectiveDate)
                .max(Comparator.naturalOrder()).orElse(null);
        Long gap = latestAttendance != null && latestSnapshot != null
                ? ChronoUnit.DAYS.between(latestSnapshot, latestAttendance)
                : null;

        return new DataQualitySummary(
                fact.size(),
                aggregated.size(),
                firstDate(fact),
                lastDate(fact),
                firstDate(aggregated),
                lastDate(aggregated),
                rows.stream().map(FactRow::getLocationName).distinct().count(),
                inputs.locations().size(),
                rows.stream().map(FactRow::getLobName).filter(Objects::nonNull).distinct().count(),
                meanRate(rows.stream().filter(r -> !r.isWeekend()).toList()),
                meanRate(rows.stream().filter(FactRow::isWeekend).toList()),
                fact.unresolvedCapacityCount(),
                fact.hybridDayCount(),
                latestAttendance,
                latestSnapshot,
                gap,
                mergeIssues,
                overCapacity,
                byLocation(rows));
    }

    public void write(DataQualitySummary summary) {
        Path outDir = Paths.get(properties.getReport().getOutputDir());
        try {
            Files.createDirectories(outDir);
            Files.write(outDir.resolve("validation_summary.txt"), summary.toLines(), StandardCharsets.UTF_8);

            writeCsv(outDir.resolve("by_location_summary.csv"),
                    new String[]{"office_location", "rows", "mean_occupancy_rate", "merge_issues", "over_capacity_days"},
                    summary.byLocation().stream().map(l -> new String[]{
                            l.officeLocation(),
                            String.valueOf(l.rows()),
                            l.meanOccupancyRate() == null ? "" : String.format(Locale.ROOT, "%.4f", l.meanOccupancyRate()),
                            String.valueOf(l.unresolvedWithAttendance()),
                            String.valueOf(l.overCapacityDays())
                    }).toList());

            if (!summary.mergeIssueRows().isEmpty()) {
                writeCsv(outDir.resolve("deskcount_merge_issues.csv"),
                        new String[]{"date", "office_location", "line_of_business", "attendance_count", "capacity"},
                        summary.mergeIssueRows().stream().map(r -> new String[]{
                                r.getDate().toString(),
                                r.getLocationName(),
                                r.getLobName() == null ? "" : r.getLobName(),
                                String.valueOf(r.getAttendanceCount()),
                                ""
                        }).toList());
            } else {
                Files.deleteIfExists(outDir.resolve("deskcount_merge_issues.csv"));
            }

            if (!summary.overCapacityRows().isEmpty()) {
                writeCsv(outDir.resolve("over_capacity_days.csv"),
                        new String[]{"date", "office_location", "line_of_business", "attendance_count", "capacity", "occupancy_rate"},
                        summary.overCapacityRows().stream().map(r -> new String[]{
                                r.getDate().toString(),
                                r.getLocationName(),
                                r.getLobName() == null ? "" : r.getLobName(),
                                String.valueOf(r.getAttendanceCount()),
                                String.valueOf(r.getCapacity()),
                                String.valueOf(r.getOccupancyRate())
                        }).toList());
            } else {
                Files.deleteIfExists(outDir.resolve("over_capacity_days.csv"));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write data-quality report to " + outDir, e);
        }

        summary.toLines().forEach(line -> log.info("[quality] {}", line));
        log.info("Data-quality report written to {}", outDir);
    }

    /**
     * Weekday rows only. Ordered so the offices needing attention come first: most unresolved
     * capacity with attendance, then most over-capacity days, then lowest mean rate.
     */
    List<LocationQuality> byLocation(List<FactRow> rows) {
        Map<String, List<FactRow>> weekdayRows = rows.stream()
                .filter(r -> !r.isWeekend())
                .collect(Collectors.groupingBy(FactRow::getLocationName, TreeMap::new, Collectors.toList()));

        List<LocationQuality> result = new ArrayList<>();
        for (Map.Entry<String, List<FactRow>> entry : weekdayRows.entrySet()) {
            List<FactRow> g = entry.getValue();
            Double mean = meanRate(g);
            int unresolved = (int) g.stream().filter(DataQualityReporter::isMergeIssue).count();
            int overCap = (int) g.stream().filter(DataQualityReporter::isOverCapacity).count();
            result.add(new LocationQuality(entry.getKey(), g.size(), mean, unresolved, overCap));
        }

        result.sort(Comparator.comparingInt(LocationQuality::unresolvedWithAttendance).reversed()
                .thenComparing(Comparator.comparingInt(LocationQuality::overCapacityDays).reversed())
                .thenComparing(LocationQuality::meanOccupancyRate, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(LocationQuality::officeLocation));
        return result;
    }

    /**
     * Mean over rows with a known rate; null when none has one.
     */
    private static Double meanRate(List<FactRow> rows) {
        OptionalDouble average = rows.stream()
                .filter(r -> r.getOccupancyRate() != null)
                .mapToDouble(FactRow::getOccupancyRate)
                .average();
        return average.isPresent() ? average.getAsDouble() : null;
    }

    private static LocalDate firstDate(FactTable table) {
        return table.rows().stream().map(FactRow::getDate).min(Comparator.naturalOrder()).orElse(null);
    }

    private static LocalDate lastDate(FactTable table) {
        return table.rows().stream().map(FactRow::getDate).max(Comparator.naturalOrder()).orElse(null);
    }

    private static boolean isMergeIssue(FactRow r) {
        return r.getCapacity() == null && r.getAttendanceCount() > 0;
    }

    private static boolean isOverCapacity(FactRow r) {
        return r.getOccupancyRate() != null && r.getOccupancyRate() > 1.0;
    }

    private void writeCsv(Path path, String[] headers, List<String[]> rows) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(headers, false);
            for (String[] row : rows) {
                writer.writeNext(row, false);
            }
        }
    }
}
