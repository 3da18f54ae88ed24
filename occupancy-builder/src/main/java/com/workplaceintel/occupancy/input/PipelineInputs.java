package com.workplaceintel.occupancy.input;

import com.workplaceintel.occupancy.model.AttendanceEvent;
import com.workplaceintel.occupancy.model.CapacitySnapshot;
import com.workplaceintel.occupancy.model.DateRow;
import com.workplaceintel.occupancy.model.LineOfBusinessRow;
import com.workplaceintel.occupancy.model.LocationRow;

import java.util.List;

/**
 * Everything a build reads, fully materialised. Read-only once loaded.
 */
public record PipelineInputs(List<DateRow> dates,
                             List<LocationRow> locations,
                             List<LineOfBusinessRow> linesOfBusiness,
                             List<AttendanceEvent> attendance,
                             List<CapacitySnapshot> capacity) {

    public PipelineInputs {
        dates = List.copyOf(dates);
        locations = List.copyOf(locations);
        linesOfBusiness = List.copyOf(linesOfBusiness);
        attendance = List.copyOf(attendance);
        capacity = List.copyOf(capacity);
    }
}
