package com.workplaceintel.occupancy.engine;

import com.workplaceintel.occupancy.model.FactRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Flags each office's hybrid anchor days: up to three days per ISO week that carry the
 * office's dominant in-office attendance.
 *
 * <ol>
 *   <li>A date is eligible when it is a weekday and its calendar month contributes at least
 *       three weekdays to the date's ISO week. This depends only on the set of dates in the
 *       grid, never on attendance or office.</li>
 *   <li>Per (office, ISO week) the eligible dates are ranked by the office's daily attendance
 *       summed over all lines of business, highest first, earlier date first on ties. The top
 *       three are selected. Zero-attendance dates still qualify when fewer than three days
 *       have attendance.</li>
 *   <li>Every row of a selected (office, date) is flagged, across all lines of business, and a
 *       final guard clears the flag on any ineligible date.</li>
 * </ol>
 */
@Component
@Slf4j
public class HybridDayClassifier {

    public static final int ANCHOR_DAYS_PER_WEEK = 3;
    public static final int MIN_WEEKDAYS_FROM_MONTH = 3;

    private static final Comparator<Map.Entry<LocalDate, Integer>> RANKING =
            Map.Entry.<LocalDate, Integer>comparingByValue().reversed()
                    .thenComparing(Map.Entry.<LocalDate, Integer>comparingByKey());

    public void classify(List<FactRow> grid) {
        Map<LocalDate, Boolean> eligibility = eligibility(
                grid.stream().map(FactRow::getDate).collect(Collectors.toSet()));

        Set<OfficeDay> anchors = selectAnchorDays(grid, eligibility);

        int flagged = 0;
        for (FactRow row : grid) {
            boolean selected = anchors.contains(new OfficeDay(row.getLocationName(), row.getDate()));
            boolean eligible = eligibility.getOrDefault(row.getDate(), false);
            row.setHybridDay(selected && eligible);
            if (row.isHybridDay()) flagged++;
        }

        log.info("Hybrid days: {} office-days selected, {} of {} rows flagged ({})",
                anchors.size(), flagged, grid.size(),
                grid.isEmpty() ? "n/a" : String.format("%.1f%%", flagged * 100.0 / grid.size()));
    }

    /**
     * Date-level eligibility over a distinct date set. Weekday counts are taken from the
     * supplied dates only, so a week cut short by the horizon counts fewer weekdays.
     */
    public Map<LocalDate, Boolean> eligibility(Collection<LocalDate> dates) {
        Set<LocalDate> distinct = new TreeSet<>(dates);

        Map<MonthInWeek, Long> weekdaysPerMonthInWeek = distinct.stream()
                .filter(HybridDayClassifier::isWeekday)
                .collect(Collectors.groupingBy(MonthInWeek::of, Collectors.counting()));

        Map<LocalDate, Boolean> eligibility = new HashMap<>();
        for (LocalDate date : distinct) {
            long weekdays = weekdaysPerMonthInWeek.getOrDefault(MonthInWeek.of(date), 0L);
            eligibility.put(date, isWeekday(date) && weekdays >= MIN_WEEKDAYS_FROM_MONTH);
        }
        return eligibility;
    }

    private Set<OfficeDay> selectAnchorDays(List<FactRow> grid, Map<LocalDate, Boolean> eligibility) {
        // (office, week) -> date -> attendance across all LOB rows of that office-day
        Map<OfficeWeek, Map<LocalDate, Integer>> dailyTotals = new HashMap<>();
        for (FactRow row : grid) {
            dailyTotals
                    .computeIfAbsent(new OfficeWeek(row.getLocationName(), IsoWeek.of(row.getDate())),
                            k -> new TreeMap<>())
                    .merge(row.getDate(), row.getAttendanceCount(), Integer::sum);
        }

        Set<OfficeDay> anchors = new HashSet<>();
        for (Map.Entry<OfficeWeek, Map<LocalDate, Integer>> week : dailyTotals.entrySet()) {
            String office = week.getKey().office();
            List<LocalDate> selected = week.getValue().entrySet().stream()
                    .filter(day -> eligibility.getOrDefault(day.getKey(), false))
                    .sorted(RANKING)
                    .limit(ANCHOR_DAYS_PER_WEEK)
                    .map(Map.Entry::getKey)
                    .toList();
            selected.forEach(date -> anchors.add(new OfficeDay(office, date)));
            log.debug("{} {}: anchor days {}", office, week.getKey().week(), selected);
        }
        return anchors;
    }

    static boolean isWeekday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }

    private record OfficeWeek(String office, IsoWeek week) {}

    private record OfficeDay(String office, LocalDate date) {}

    private record MonthInWeek(IsoWeek week, YearMonth month) {
        static MonthInWeek of(LocalDate date) {
            return new MonthInWeek(IsoWeek.of(date), YearMonth.from(date));
        }
    }
}
