package com.workplaceintel.occupancy.model;

import java.util.List;

/**
 * A fully assembled fact, rows already in output order.
 */
public record FactTable(FactVariant variant, List<FactRow> rows) {

    public int size() {
        return rows.size();
    }

    public long hybridDayCount() {
        return rows.stream().filter(FactRow::isHybridDay).count();
    }

    public long unresolvedCapacityCount() {
        return rows.stream().filter(r -> r.getCapacity() == null).count();
    }
}
