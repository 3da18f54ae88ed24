package com.workplaceintel.occupancy.output;

import com.workplaceintel.occupancy.model.FactTable;

import java.nio.file.Path;

/**
 * A fact table written to {@code temp}, waiting to replace {@code target}.
 */
public record StagedFact(FactTable table, Path temp, Path target) {

    Path backup() {
        return target.resolveSibling(target.getFileName() + ".bak");
    }
}
