package com.workplaceintel.occupancy.report;

import com.workplaceintel.occupancy.config.OccupancyBuilderProperties;
import com.workplaceintel.occupancy.input.PipelineInputs;
import com.workplaceintel.occupancy.model.FactRow;
import com.workplaceintel.occupancy.model.FactTable;
import com.workplaceintel.occupancy.model.FactVariant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static com.workplaceintel.occupancy.TestData.attendance;
import static com.workplaceintel.occupancy.TestData.d;
import static com.workplaceintel.occupancy.TestData.location;
import static com.workplaceintel.occupancy.TestData.row;
import static com.workplaceintel.occupancy.TestData.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DataQualityReporterTest {

    @TempDir
    Path reportDir;

    private OccupancyBuilderProperties properties;
    private DataQualityReporter reporter;

    @BeforeEach
    void setUp() {
        properties = new OccupancyBuilderProperties();
        properties.getReport().setOutputDir(reportDir.toString());
        reporter = new DataQualityReporter(properties);
    }

    private static FactRow rated(String date, String office, int attendance, Integer capacity) {
        FactRow r = row(date, office, "Retail", attendance);
        r.setCapacity(capacity);
        r.setOccupancyRate(capacity == null ? null : attendance / (double) capacity);
        return r;
    }

    private List<FactRow> rows() {
        return List.of(
                rated("2025-03-03", "Austin", 12, 10),   // over capacity
                rated("2025-03-04", "Austin", 5, 10),
                rated("2025-03-03", "Boston", 4, null),  // attendance, no capacity
                rated("2025-03-04", "Boston", 0, null),
                rated("2025-03-03", "Chicago", 2, 10),
                rated("2025-03-08", "Chicago", 9, 10));  // Saturday
    }

    private FactTable aggregated() {
        return new FactTable(FactVariant.AGGREGATED, List.of(
                row("2025-03-03", "Austin", null, 12),
                row("2025-03-04", "Austin", null, 5)));
    }

    private PipelineInputs inputs() {
        return new PipelineInputs(List.of(),
                List.of(location(1, "Austin"), location(2, "Boston"), location(3, "Chicago"), location(4, "Denver")),
                List.of(),
                attendance("2025-03-08", "Chicago", "Retail", 1),
                List.of(snapshot("Austin", "2025-02-26", 10)));
    }

    @Test
    void summarizesCapacityGapsAndOverCapacityRows() {
        FactTable fact = new FactTable(FactVariant.BY_LINE_OF_BUSINESS, rows());

        DataQualitySummary summary = reporter.summarize(fact, new FactTable(FactVariant.AGGREGATED, List.of()), inputs());

        assertThat(summary.factRows()).isEqualTo(6);
        assertThat(summary.unresolvedCapacityRows()).isEqualTo(2);
        assertThat(summary.unresolvedWithAttendanceRows()).isEqualTo(1);
        assertThat(summary.overCapacityRows()).singleElement()
                .satisfies(r -> assertThat(r.getLocationName()).isEqualTo("Austin"));
        assertThat(summary.latestAttendanceDate()).isEqualTo(d("2025-03-08"));
        assertThat(summary.latestSnapshotDate()).isEqualTo(d("2025-02-26"));
        assertThat(summary.snapshotGapDays()).isEqualTo(10L);
        assertThat(summary.toLines()).anyMatch(line -> line.contains("gap: 10 days"));
    }

    @Test
    void locationsNeedingAttentionComeFirst() {
        List<LocationQuality> byLocation = reporter.byLocation(rows());

        assertThat(byLocation).extracting(LocationQuality::officeLocation)
                .containsExactly("Boston", "Austin", "Chicago");

        LocationQuality boston = byLocation.get(0);
        assertThat(boston.unresolvedWithAttendance()).isEqualTo(1);
        assertThat(boston.meanOccupancyRate()).isNull();

        LocationQuality chicago = byLocation.get(2);
        assertThat(chicago.rows()).as("weekend rows excluded").isEqualTo(1);
        assertThat(chicago.meanOccupancyRate()).isCloseTo(0.2, within(1e-9));
    }

    @Test
    void writesReportFiles() throws IOException {
        FactTable fact = new FactTable(FactVariant.BY_LINE_OF_BUSINESS, rows());

        reporter.write(reporter.summarize(fact, new FactTable(FactVariant.AGGREGATED, List.of()), inputs()));

        assertThat(Files.readAllLines(reportDir.resolve("validation_summary.txt"))).first().isEqualTo("== Summary ==");
        assertThat(Files.readAllLines(reportDir.resolve("by_location_summary.csv"))).containsExactly(
                "office_location,rows,mean_occupancy_rate,merge_issues,over_capacity_days",
                "Boston,2,,1,0",
                "Austin,2,0.8500,0,1",
                "Chicago,1,0.2000,0,0");
        assertThat(Files.readAllLines(reportDir.resolve("over_capacity_days.csv"))).hasSize(2);
    }

    @Test
    void overCapacityFileOnlyWrittenWhenNeeded() {
        FactTable fact = new FactTable(FactVariant.BY_LINE_OF_BUSINESS, List.of(rated("2025-03-04", "Austin", 5, 10)));

        reporter.write(reporter.summarize(fact, new FactTable(FactVariant.AGGREGATED, List.of()), inputs()));

        assertThat(reportDir.resolve("by_location_summary.csv")).exists();
        assertThat(reportDir.resolve("over_capacity_days.csv")).doesNotExist();
    }

    @Test
    void summaryCoversDateRangesDimensionsAndWeekdayWeekendMeans() {
        FactTable fact = new FactTable(FactVariant.BY_LINE_OF_BUSINESS, rows());

        DataQualitySummary summary = reporter.summarize(fact, aggregated(), inputs());

        assertThat(summary.factFirstDate()).isEqualTo(d("2025-03-03"));
        assertThat(summary.factLastDate()).isEqualTo(d("2025-03-08"));
        assertThat(summary.aggregatedLastDate()).isEqualTo(d("2025-03-04"));
        assertThat(summary.locationsInFact()).isEqualTo(3);
        assertThat(summary.locationsInDimension()).isEqualTo(4);
        assertThat(summary.linesOfBusinessInFact()).isEqualTo(1);
        assertThat(summary.weekdayMeanOccupancy()).isCloseTo((1.2 + 0.5 + 0.2) / 3, within(1e-9));
        assertThat(summary.weekendMeanOccupancy()).isCloseTo(0.9, within(1e-9));
        assertThat(summary.toLines()).contains(
                "Fact rows: 6; Agg rows: 2",
                "Fact date range: 2025-03-03 to 2025-03-08",
                "Agg date range: 2025-03-03 to 2025-03-04",
                "Locations: 3 (dim: 4)",
                "LOBs: 1 (in fact)",
                "Mean occupancy (weekday): 0.633; (weekend): 0.900");
    }

    @Test
    void emptyAggregatedFactPrintsNotAvailable() {
        FactTable fact = new FactTable(FactVariant.BY_LINE_OF_BUSINESS, rows());

        DataQualitySummary summary = reporter.summarize(fact, new FactTable(FactVariant.AGGREGATED, List.of()), inputs());

        assertThat(summary.toLines()).contains("Agg date range: n/a to n/a");
    }

    @Test
    void summaryTextDoesNotDependOnDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.GERMANY);
        try {
            FactTable fact = new FactTable(FactVariant.BY_LINE_OF_BUSINESS, rows());

            List<String> lines = reporter.summarize(fact, aggregated(), inputs()).toLines();

            assertThat(lines).contains(
                    "Rows with occupancy_rate > 1.0: 1 (16.7%)",
                    "Mean occupancy (weekday): 0.633; (weekend): 0.900");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void rowsWithAttendanceButNoCapacityAreListed() throws IOException {
        FactTable fact = new FactTable(FactVariant.BY_LINE_OF_BUSINESS, rows());

        reporter.write(reporter.summarize(fact, aggregated(), inputs()));

        assertThat(Files.readAllLines(reportDir.resolve("deskcount_merge_issues.csv"))).containsExactly(
                "date,office_location,line_of_business,attendance_count,capacity",
                "2025-03-03,Boston,Retail,4,");
    }

    @Test
    void staleDetailFilesAreRemovedWhenClean() throws IOException {
        Files.writeString(reportDir.resolve("deskcount_merge_issues.csv"), "old");
        Files.writeString(reportDir.resolve("over_capacity_days.csv"), "old");
        FactTable fact = new FactTable(FactVariant.BY_LINE_OF_BUSINESS, List.of(rated("2025-03-04", "Austin", 5, 10)));

        reporter.write(reporter.summarize(fact, aggregated(), inputs()));

        assertThat(reportDir.resolve("deskcount_merge_issues.csv")).doesNotExist();
        assertThat(reportDir.resolve("over_capacity_days.csv")).doesNotExist();
    }
}
