package com.workplaceintel.occupancy.engine;

import com.workplaceintel.occupancy.model.CapacitySnapshot;
import com.workplaceintel.occupancy.model.FactRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Attaches to every grid row the desk count of the office's latest valid snapshot whose
 * effective date is on or before the row's date (an as-of backward join).
 *
 * Each office is swept once in date order. The office's state starts unknown (null) and
 * only ever moves forward in time to the most recent valid value. Rows before the office's
 * first valid snapshot stay null. Invalid snapshots (missing, zero or negative capacity)
 * never change the state.
 *
 * Snapshots sharing an effective date are applied in input order, so the last one recorded wins.
 */
@Component
@Slf4j
public class CapacityResolver {

    private static final Comparator<CapacitySnapshot> BY_EFFECTIVE_DATE =
            Comparator.comparing(CapacitySnapshot::effectiveDate);

    public void resolve(List<FactRow> grid, List<CapacitySnapshot> snapshots) {
        Map<String, List<CapacitySnapshot>> timelines = snapshots.stream()
                .collect(Collectors.groupingBy(CapacitySnapshot::officeLocation,
                        LinkedHashMap::new, Collectors.toList()));

        Map<String, List<FactRow>> rowsByLocation = grid.stream()
                .collect(Collectors.groupingBy(FactRow::getLocationName,
                        LinkedHashMap::new, Collectors.toList()));

        int resolved = 0;
        for (Map.Entry<String, List<FactRow>> entry : rowsByLocation.entrySet()) {
            List<CapacitySnapshot> timeline = new ArrayList<>(timelines.getOrDefault(entry.getKey(), List.of()));
            timeline.sort(BY_EFFECTIVE_DATE); // stable: equal dates keep input order

            List<FactRow> rows = new ArrayList<>(entry.getValue());
            rows.sort(Comparator.comparing(FactRow::getDate));

            resolved += sweep(rows, timeline);
        }

        TreeSet<String> unmatched = new TreeSet<>(timelines.keySet());
        unmatched.removeAll(rowsByLocation.keySet());
        if (!unmatched.isEmpty()) {
            log.warn("Ignoring capacity snapshots for {} offices not in the location dimension: {}",
                    unmatched.size(), unmatched);
        }

        log.info("Capacity resolved on {} of {} rows; {} rows have no valid capacity yet",
                resolved, grid.size(), grid.size() - resolved);
    }

    private int sweep(List<FactRow> rows, List<CapacitySnapshot> timeline) {
        Integer current = null;
        int next = 0;
        int resolved = 0;

        for (FactRow row : rows) {
            while (next < timeline.size() && !timeline.get(next).effectiveDate().isAfter(row.getDate())) {
                CapacitySnapshot snapshot = timeline.get(next++);
                if (snapshot.isValid()) {
                    current = snapshot.capacity();
                }
            }
            row.setCapacity(current);
            if (current != null) resolved++;
        }
        return resolved;
    }
}
