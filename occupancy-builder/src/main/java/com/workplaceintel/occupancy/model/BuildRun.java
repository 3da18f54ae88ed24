package com.workplaceintel.occupancy.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each fact build for observability. The latest run is exposed over HTTP.
 */
@Data
@Builder
public class BuildRun {

    private String runId;               // UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;              // RUNNING | SUCCESS | FAILED
    private int lineOfBusinessRows;
    private int aggregatedRows;
    private long unresolvedCapacityRows;
    private long hybridDayRows;
    private String errorMessage;        // null on success
}
