package com.workplaceintel.occupancy.input;

import com.opencsv.CSVReaderHeaderAware;
import com.opencsv.exceptions.CsvValidationException;
import com.workplaceintel.occupancy.model.AttendanceEvent;
import com.workplaceintel.occupancy.model.CapacitySnapshot;
import com.workplaceintel.occupancy.model.DateRow;
import com.workplaceintel.occupancy.model.LineOfBusinessRow;
import com.workplaceintel.occupancy.model.LocationRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Parses the cleaned upstream CSV datasets into typed rows.
 *
 * Dimension files define the fact grid, so any unparseable dimension row aborts the build.
 * Event and snapshot rows without a usable date or office are skipped and counted instead.
 *
 * Expected columns (extra columns are ignored):
 *   DimDate.csv              date_key, date [, year, month, is_weekend]
 *   DimLocation.csv          location_key, office_location
 *   DimLineOfBusiness.csv    lob_key, line_of_business
 *   Occupancy_cleaned.csv    logon_date, office_location, line_of_business
 *   Deskcount_cleaned.csv    office_location, date, deskcount
 */
@Component
@Slf4j
public class InputCsvReader {

    public List<DateRow> readDates(Path file) {
        List<DateRow> rows = new ArrayList<>();
        forEachRow(file, (row, line) -> {
            LocalDate date = parseDate(require(row, "date", file, line), file, line);
            int dateKey = parseInt(require(row, "date_key", file, line), "date_key", file, line);

            DateRow derived = DateRow.of(date);
            if (dateKey != derived.dateKey()) {
                throw new MalformedInputException(String.format(
                        "%s line %d: date_key %d does not match date %s", file, line, dateKey, date));
            }

            // year, month and is_weekend are optional; derive them from the date when absent
            String year = row.get("year");
            String month = row.get("month");
            String weekend = row.get("is_weekend");
            rows.add(new DateRow(
                    date,
                    dateKey,
                    isBlank(year) ? derived.year() : parseInt(year, "year", file, line),
                    isBlank(month) ? derived.month() : parseInt(month, "month", file, line),
                    isBlank(weekend) ? derived.weekend() : parseBoolean(weekend)));
        });
        log.info("Loaded {} dates from {}", rows.size(), file);
        return rows;
    }

    public List<LocationRow> readLocations(Path file) {
        List<LocationRow> rows = new ArrayList<>();
        forEachRow(file, (row, line) -> rows.add(new LocationRow(
                parseInt(require(row, "location_key", file, line), "location_key", file, line),
                require(row, "office_location", file, line))));
        log.info("Loaded {} locations from {}", rows.size(), file);
        return rows;
    }

    public List<LineOfBusinessRow> readLinesOfBusiness(Path file) {
        List<LineOfBusinessRow> rows = new ArrayList<>();
        forEachRow(file, (row, line) -> rows.add(new LineOfBusinessRow(
                parseInt(require(row, "lob_key", file, line), "lob_key", file, line),
                require(row, "line_of_business", file, line))));
        log.info("Loaded {} lines of business from {}", rows.size(), file);
        return rows;
    }

    public List<AttendanceEvent> readAttendance(Path file) {
        List<AttendanceEvent> events = new ArrayList<>();
        int[] skipped = {0};
        forEachRow(file, (row, line) -> {
            LocalDate date = tryParseDate(row.get("logon_date"));
            String office = emptyToNull(row.get("office_location"));
            if (date == null || office == null) {
                skipped[0]++;
                return;
            }
            events.add(new AttendanceEvent(date, office, emptyToNull(row.get("line_of_business"))));
        });
        log.info("Loaded {} attendance events from {}, {} rows without date/office skipped",
                events.size(), file, skipped[0]);
        return events;
    }

    public List<CapacitySnapshot> readCapacity(Path file) {
        List<CapacitySnapshot> snapshots = new ArrayList<>();
        int[] skipped = {0};
        forEachRow(file, (row, line) -> {
            LocalDate date = tryParseDate(row.get("date"));
            String office = emptyToNull(row.get("office_location"));
            if (date == null || office == null) {
                skipped[0]++;
                return;
            }
            snapshots.add(new CapacitySnapshot(office, date, parseCapacity(row.get("deskcount"), file, line)));
        });
        log.info("Loaded {} capacity snapshots from {}, {} rows without date/office skipped",
                snapshots.size(), file, skipped[0]);
        return snapshots;
    }

    // ── CSV plumbing ──────────────────────────────────────────────────────────

    private void forEachRow(Path file, BiConsumer<Map<String, String>, Long> handler) {
        try (CSVReaderHeaderAware reader = new CSVReaderHeaderAware(
                Files.newBufferedReader(file, StandardCharsets.UTF_8))) {
            Map<String, String> row;
            while ((row = reader.readMap()) != null) {
                handler.accept(row, reader.getLinesRead());
            }
        } catch (CsvValidationException e) {
            throw new MalformedInputException("Invalid CSV in " + file + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private String require(Map<String, String> row, String column, Path file, long line) {
        String value = row.get(column);
        if (value == null) {
            throw new MalformedInputException(file + " has no '" + column + "' column");
        }
        if (value.isBlank()) {
            throw new MalformedInputException(String.format("%s line %d: empty %s", file, line, column));
        }
        return value.trim();
    }

    // ── Value parsing ─────────────────────────────────────────────────────────

    /**
     * Accepts "2025-01-31" as well as timestamp renderings such as "2025-01-31 00:00:00".
     */
    static LocalDate tryParseDate(String val) {
        if (val == null || val.isBlank()) return null;
        String s = val.trim();
        if (s.length() > 10) s = s.substring(0, 10);
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private LocalDate parseDate(String val, Path file, long line) {
        LocalDate date = tryParseDate(val);
        if (date == null) {
            throw new MalformedInputException(String.format("%s line %d: unparseable date '%s'", file, line, val));
        }
        return date;
    }

    private int parseInt(String val, String column, Path file, long line) {
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            throw new MalformedInputException(
                    String.format("%s line %d: %s '%s' is not an integer", file, line, column, val), e);
        }
    }

    /**
     * Desk counts arrive as integers, as reals with an integral value ("120.0") when the
     * upstream column held gaps, or empty. Zero and negative values are kept as-is; the
     * capacity resolver treats them as "no valid capacity".
     */
    static Integer parseCapacity(String val, Path file, long line) {
        if (val == null || val.isBlank()) return null;
        try {
            double d = Double.parseDouble(val.trim());
            if (Double.isNaN(d)) return null;
            if (d != Math.rint(d)) {
                log.warn("{} line {}: non-integral desk count {} rounded", file, line, val);
            }
            return (int) Math.round(d);
        } catch (NumberFormatException e) {
            log.warn("{} line {}: unparseable desk count '{}' treated as unknown", file, line, val);
            return null;
        }
    }

    private boolean parseBoolean(String val) {
        String s = val.trim();
        return s.equalsIgnoreCase("true") || s.equals("1");
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }

    private boolean isBlank(String val) {
        return val == null || val.isBlank();
    }
}
