package com.workplaceintel.occupancy.engine;

import org.junit.jupiter.api.Test;

import static com.workplaceintel.occupancy.TestData.d;
import static org.assertj.core.api.Assertions.assertThat;

class IsoWeekTest {

    @Test
    void lateDecemberCanBelongToNextYearsFirstWeek() {
        assertThat(IsoWeek.of(d("2024-12-30"))).isEqualTo(new IsoWeek(2025, 1));
        assertThat(IsoWeek.of(d("2025-01-05"))).isEqualTo(new IsoWeek(2025, 1));
    }

    @Test
    void earlyJanuaryCanBelongToPreviousYearsLastWeek() {
        assertThat(IsoWeek.of(d("2021-01-03"))).isEqualTo(new IsoWeek(2020, 53));
    }

    @Test
    void ordersChronologicallyAndPrints() {
        assertThat(new IsoWeek(2024, 52)).isLessThan(new IsoWeek(2025, 1));
        assertThat(new IsoWeek(2025, 3)).hasToString("2025-W03");
    }
}
