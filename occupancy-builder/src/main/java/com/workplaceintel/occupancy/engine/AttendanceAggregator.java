package com.workplaceintel.occupancy.engine;

import com.workplaceintel.occupancy.model.AttendanceEvent;
import com.workplaceintel.occupancy.model.FactVariant;
import com.workplaceintel.occupancy.model.GridKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Counts attendance events per grid key. Only observed combinations appear in the result;
 * zero-filling is the grid filler's job.
 */
@Component
@Slf4j
public class AttendanceAggregator {

    public Map<GridKey, Integer> count(Collection<AttendanceEvent> events, FactVariant variant) {
        Map<GridKey, Integer> counts = new HashMap<>();
        for (AttendanceEvent event : events) {
            counts.merge(GridKey.of(event, variant), 1, Integer::sum);
        }
        log.info("{}: {} events aggregated into {} observed combinations",
                variant, events.size(), counts.size());
        return counts;
    }
}
