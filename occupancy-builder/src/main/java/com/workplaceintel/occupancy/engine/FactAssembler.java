package com.workplaceintel.occupancy.engine;

import com.workplaceintel.occupancy.model.FactRow;
import com.workplaceintel.occupancy.model.FactTable;
import com.workplaceintel.occupancy.model.FactVariant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Puts a fully derived grid into its published order: date, then office, then line of business.
 */
@Component
@Slf4j
public class FactAssembler {

    static final Comparator<FactRow> OUTPUT_ORDER = Comparator
            .comparingInt(FactRow::getDateKey)
            .thenComparing(FactRow::getLocationName)
            .thenComparing(FactRow::getLobName, Comparator.nullsFirst(Comparator.naturalOrder()));

    public FactTable assemble(List<FactRow> grid, FactVariant variant) {
        List<FactRow> rows = new ArrayList<>(grid);
        rows.sort(OUTPUT_ORDER);

        FactTable table = new FactTable(variant, Collections.unmodifiableList(rows));

        if (!rows.isEmpty()) {
            log.info("{} assembled: {} rows, date keys {} to {}, {} hybrid rows, {} rows without capacity",
                    variant, table.size(),
                    rows.get(0).getDateKey(), rows.get(rows.size() - 1).getDateKey(),
                    table.hybridDayCount(), table.unresolvedCapacityCount());
        }
        return table;
    }
}
