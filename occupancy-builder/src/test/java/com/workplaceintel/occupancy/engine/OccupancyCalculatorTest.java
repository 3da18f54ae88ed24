package com.workplaceintel.occupancy.engine;

import com.workplaceintel.occupancy.model.FactRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.workplaceintel.occupancy.TestData.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OccupancyCalculatorTest {

    private final OccupancyCalculator calculator = new OccupancyCalculator();

    @Test
    void rateIsAttendanceOverCapacity() {
        assertThat(OccupancyCalculator.rate(80, 100)).isCloseTo(0.8, within(1e-9));
        assertThat(OccupancyCalculator.rate(90, 120)).isCloseTo(0.75, within(1e-9));
        assertThat(OccupancyCalculator.rate(0, 40)).isZero();
    }

    @Test
    void overCapacityIsNotClipped() {
        assertThat(OccupancyCalculator.rate(150, 100)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void unknownOrNonPositiveCapacityGivesUnknownRate() {
        assertThat(OccupancyCalculator.rate(12, null)).isNull();
        assertThat(OccupancyCalculator.rate(12, 0)).isNull();
        assertThat(OccupancyCalculator.rate(0, -5)).isNull();
    }

    @Test
    void appliesRateToEveryRow() {
        FactRow known = row("2025-02-15", "Austin", null, 80);
        known.setCapacity(100);
        FactRow unknown = row("2025-02-15", "Boston", null, 12);

        calculator.apply(List.of(known, unknown));

        assertThat(known.getOccupancyRate()).isCloseTo(0.8, within(1e-9));
        assertThat(unknown.getOccupancyRate()).isNull();
    }
}
