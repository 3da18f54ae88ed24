package com.workplaceintel.occupancy.engine;

import com.workplaceintel.occupancy.model.FactRow;
import com.workplaceintel.occupancy.model.GridKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Left-joins aggregated attendance counts onto the grid. Grid rows without a count keep
 * their zero; a count that lands on no grid row is a dimension mismatch and aborts the build.
 */
@Component
@Slf4j
public class GridFiller {

    public void fill(List<FactRow> grid, Map<GridKey, Integer> counts) {
        Map<GridKey, FactRow> index = new HashMap<>(grid.size() * 2);
        for (FactRow row : grid) {
            FactRow previous = index.put(GridKey.of(row), row);
            if (previous != null) {
                throw new InconsistentKeyException("Grid contains duplicate key " + GridKey.of(row));
            }
        }

        for (Map.Entry<GridKey, Integer> entry : counts.entrySet()) {
            FactRow row = index.get(entry.getKey());
            if (row == null) {
                throw new InconsistentKeyException(
                        "Attendance for " + entry.getKey() + " has no matching grid row");
            }
            row.setAttendanceCount(entry.getValue());
            log.debug("{} -> {}", entry.getKey(), entry.getValue());
        }

        log.info("Filled {} of {} grid rows with observed attendance; {} zero-filled",
                counts.size(), grid.size(), grid.size() - counts.size());
    }
}
