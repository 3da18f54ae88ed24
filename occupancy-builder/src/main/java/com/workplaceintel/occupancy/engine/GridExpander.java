package com.workplaceintel.occupancy.engine;

import com.workplaceintel.occupancy.model.DateRow;
import com.workplaceintel.occupancy.model.FactRow;
import com.workplaceintel.occupancy.model.FactVariant;
import com.workplaceintel.occupancy.model.LineOfBusinessRow;
import com.workplaceintel.occupancy.model.LocationRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds the exhaustive key space of a fact: every date in the horizon × every office
 * (× every line of business for the per-LOB variant), each exactly once, with zero attendance.
 */
@Component
@Slf4j
public class GridExpander {

    public List<FactRow> expand(List<DateRow> dates,
                                List<LocationRow> locations,
                                List<LineOfBusinessRow> linesOfBusiness,
                                Horizon horizon,
                                FactVariant variant) {

        List<DateRow> inHorizon = dates.stream()
                .filter(d -> horizon.contains(d.date()))
                .sorted(Comparator.comparing(DateRow::date))
                .toList();

        if (inHorizon.isEmpty()) throw new EmptyDimensionException("date");
        if (locations == null || locations.isEmpty()) throw new EmptyDimensionException("location");

        List<LineOfBusinessRow> lobs;
        if (variant.includesLineOfBusiness()) {
            if (linesOfBusiness == null || linesOfBusiness.isEmpty()) {
                throw new EmptyDimensionException("line_of_business");
            }
            lobs = linesOfBusiness;
        } else {
            // a single null entry keeps the loop below shared between both variants
            lobs = Collections.singletonList(null);
        }

        requireUnique(inHorizon, DateRow::date, "date");
        requireUnique(locations, LocationRow::officeLocation, "location");
        if (variant.includesLineOfBusiness()) {
            requireUnique(lobs, LineOfBusinessRow::lineOfBusiness, "line_of_business");
        }

        List<FactRow> grid = new ArrayList<>(inHorizon.size() * locations.size() * lobs.size());
        for (DateRow date : inHorizon) {
            for (LocationRow location : locations) {
                for (LineOfBusinessRow lob : lobs) {
                    grid.add(FactRow.builder()
                            .dateKey(date.dateKey())
                            .date(date.date())
                            .year(date.year())
                            .month(date.month())
                            .weekend(date.weekend())
                            .locationKey(location.locationKey())
                            .locationName(location.officeLocation())
                            .lobKey(lob != null ? lob.lobKey() : null)
                            .lobName(lob != null ? lob.lineOfBusiness() : null)
                            .attendanceCount(0)
                            .build());
                }
            }
        }

        log.info("{} grid: {} dates × {} locations{} = {} rows over {}",
                variant, inHorizon.size(), locations.size(),
                variant.includesLineOfBusiness() ? " × " + lobs.size() + " LOBs" : "",
                grid.size(), horizon);
        return grid;
    }

    private <T> void requireUnique(List<T> rows, Function<T, Object> naturalKey, String dimension) {
        Set<Object> seen = new HashSet<>();
        for (T row : rows) {
            Object key = naturalKey.apply(row);
            if (!seen.add(key)) {
                throw new InconsistentKeyException(
                        "Dimension '" + dimension + "' contains duplicate natural key: " + key);
            }
        }
    }
}
