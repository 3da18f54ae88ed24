package com.workplaceintel.occupancy.output;

import com.opencsv.CSVWriter;
import com.workplaceintel.occupancy.config.OccupancyBuilderProperties;
import com.workplaceintel.occupancy.model.FactRow;
import com.workplaceintel.occupancy.model.FactTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a fact table to CSV.
 *
 * Output path pattern: {outputDir}/{variant file name}
 * e.g. facts/FactOccupancy.csv and facts/FactOccupancyAggregated.csv
 *
 * Null capacity and occupancy rate are written as empty cells so reporting tools read them
 * as missing rather than zero. Files are written to temporary siblings first ({@link #stage})
 * and moved into place together ({@link #publish}), so readers never see a half-written fact
 * or one variant from a newer build than the other.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FactCsvWriter {

    private final OccupancyBuilderProperties properties;

    static final String[] LOB_HEADERS = {
            "date_key", "location_key", "lob_key",
            "date", "location_name", "lob_name",
            "year", "month", "is_weekend",
            "attendance_count", "capacity", "occupancy_rate",
            "is_hybrid_day"
    };

    static final String[] AGGREGATED_HEADERS = {
            "date_key", "location_key",
            "date", "location_name",
            "year", "month", "is_weekend",
            "attendance_count", "capacity", "occupancy_rate",
            "is_hybrid_day"
    };

    /**
     * Writes and publishes a single table.
     */
    public Path write(FactTable table) {
        List<StagedFact> staged = stage(List.of(table));
        try {
            return publish(staged).get(0);
        } finally {
            discard(staged);
        }
    }

    /**
     * Writes every table to a temporary sibling of its target. Nothing visible to readers
     * changes. If any table fails, the temporary files already written are removed.
     */
    public List<StagedFact> stage(List<FactTable> tables) {
        Path outputDir = Paths.get(properties.getOutput().getOutputDir());
        ensureDirectory(outputDir);

        List<StagedFact> staged = new ArrayList<>();
        try {
            for (FactTable table : tables) {
                Path target = outputDir.resolve(table.variant().fileName());
                StagedFact fact = new StagedFact(table,
                        target.resolveSibling(target.getFileName() + ".tmp"),
                        target);
                staged.add(fact);
                writeCsv(fact);
            }
        } catch (RuntimeException e) {
            discard(staged);
            throw e;
        }
        return staged;
    }

    /**
     * Moves staged files over their targets as a group. Previous targets are kept aside
     * until every move succeeded and are restored if any move fails.
     */
    public List<Path> publish(List<StagedFact> staged) {
        for (StagedFact fact : staged) {
            if (Files.isDirectory(fact.target())) {
                throw new UncheckedIOException(new IOException("Output target is a directory: " + fact.target()));
            }
        }

        List<StagedFact> touched = new ArrayList<>();
        try {
            for (StagedFact fact : staged) {
                touched.add(fact);
                if (Files.exists(fact.target())) {
                    Files.move(fact.target(), fact.backup(), StandardCopyOption.REPLACE_EXISTING);
                }
                Files.move(fact.temp(), fact.target(), StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            rollBack(touched, e);
            throw new UncheckedIOException("Publishing facts failed, previous output restored", e);
        }

        List<Path> published = new ArrayList<>();
        for (StagedFact fact : staged) {
            deleteIfExists(fact.backup());
            log.info("Written {} {} rows to CSV: {}", fact.table().size(), fact.table().variant(), fact.target());
            published.add(fact.target());
        }
        return published;
    }

    /**
     * Removes whatever temporary files are still present. Safe to call after {@link #publish}.
     */
    public void discard(List<StagedFact> staged) {
        for (StagedFact fact : staged) {
            deleteIfExists(fact.temp());
        }
    }

    private void writeCsv(StagedFact fact) {
        boolean withLob = fact.table().variant().includesLineOfBusiness();
        deleteIfExists(fact.backup());

        try (Writer out = Files.newBufferedWriter(fact.temp(), StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().isIncludeHeader()) {
                writer.writeNext(withLob ? LOB_HEADERS : AGGREGATED_HEADERS, false);
            }

            for (FactRow r : fact.table().rows()) {
                writer.writeNext(withLob ? toLobRow(r) : toAggregatedRow(r), false);
            }

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", fact.temp(), e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed for " + fact.target(), e);
        }
    }

    private void rollBack(List<StagedFact> touched, IOException cause) {
        for (int i = touched.size() - 1; i >= 0; i--) {
            StagedFact fact = touched.get(i);
            try {
                if (Files.exists(fact.backup())) {
                    Files.move(fact.backup(), fact.target(), StandardCopyOption.REPLACE_EXISTING);
                } else if (!Files.exists(fact.temp())) {
                    // target was created by this publish and had no predecessor
                    Files.deleteIfExists(fact.target());
                }
            } catch (IOException e) {
                log.error("Could not restore {}: {}", fact.target(), e.getMessage(), e);
                cause.addSuppressed(e);
            }
        }
    }

    private String[] toLobRow(FactRow r) {
        return new String[]{
                str(r.getDateKey()),
                str(r.getLocationKey()),
                str(r.getLobKey()),
                str(r.getDate()),
                str(r.getLocationName()),
                str(r.getLobName()),
                str(r.getYear()),
                str(r.getMonth()),
                str(r.isWeekend()),
                str(r.getAttendanceCount()),
                str(r.getCapacity()),
                rate(r.getOccupancyRate()),
                str(r.isHybridDay())
        };
    }

    private String[] toAggregatedRow(FactRow r) {
        return new String[]{
                str(r.getDateKey()),
                str(r.getLocationKey()),
                str(r.getDate()),
                str(r.getLocationName()),
                str(r.getYear()),
                str(r.getMonth()),
                str(r.isWeekend()),
                str(r.getAttendanceCount()),
                str(r.getCapacity()),
                rate(r.getOccupancyRate()),
                str(r.isHybridDay())
        };
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    /**
     * Plain decimal notation, never scientific: 1/2000 is written as 0.0005, 1.0 stays 1.0.
     */
    static String rate(Double rate) {
        if (rate == null) return "";
        BigDecimal value = BigDecimal.valueOf(rate).stripTrailingZeros();
        if (value.scale() < 1) value = value.setScale(1);
        return value.toPlainString();
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete " + path, e);
        }
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
