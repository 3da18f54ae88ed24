package com.workplaceintel.occupancy.engine;

import java.time.LocalDate;

/**
 * Inclusive date window a fact variant covers.
 */
public record Horizon(LocalDate start, LocalDate cutoff) {

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(cutoff);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + cutoff + "]";
    }
}
