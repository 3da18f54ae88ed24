package com.workplaceintel.occupancy.service;

import com.workplaceintel.occupancy.config.OccupancyBuilderProperties;
import com.workplaceintel.occupancy.engine.AttendanceAggregator;
import com.workplaceintel.occupancy.engine.CapacityResolver;
import com.workplaceintel.occupancy.engine.FactAssembler;
import com.workplaceintel.occupancy.engine.GridExpander;
import com.workplaceintel.occupancy.engine.GridFiller;
import com.workplaceintel.occupancy.engine.Horizon;
import com.workplaceintel.occupancy.engine.HybridDayClassifier;
import com.workplaceintel.occupancy.engine.OccupancyCalculator;
import com.workplaceintel.occupancy.input.InputLoader;
import com.workplaceintel.occupancy.input.PipelineInputs;
import com.workplaceintel.occupancy.model.AttendanceEvent;
import com.workplaceintel.occupancy.model.BuildRun;
import com.workplaceintel.occupancy.model.FactRow;
import com.workplaceintel.occupancy.model.FactTable;
import com.workplaceintel.occupancy.model.FactVariant;
import com.workplaceintel.occupancy.model.GridKey;
import com.workplaceintel.occupancy.output.FactCsvWriter;
import com.workplaceintel.occupancy.output.StagedFact;
import com.workplaceintel.occupancy.report.DataQualityReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates a full rebuild of both occupancy facts.
 *
 * Stages run strictly in sequence and each one materialises its whole output before the
 * next starts: expand grid, aggregate attendance, fill, resolve capacity, compute rates,
 * classify hybrid days, assemble. Both variants are computed before either is written,
 * so a failing build leaves the previous output untouched.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FactBuildService {

    private final InputLoader inputLoader;
    private final HorizonResolver horizonResolver;
    private final GridExpander gridExpander;
    private final AttendanceAggregator attendanceAggregator;
    private final GridFiller gridFiller;
    private final CapacityResolver capacityResolver;
    private final OccupancyCalculator occupancyCalculator;
    private final HybridDayClassifier hybridDayClassifier;
    private final FactAssembler factAssembler;
    private final FactCsvWriter factCsvWriter;
    private final DataQualityReporter dataQualityReporter;
    private final OccupancyBuilderProperties properties;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<BuildRun> lastRun = new AtomicReference<>();

    /**
     * Load inputs, build both facts, write them and the data-quality report.
     *
     * @return the finished run, or empty if another build was already in progress
     */
    public Optional<BuildRun> runBuild() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Build already in progress, ignoring request");
            return Optional.empty();
        }
        return Optional.of(executeClaimed());
    }

    /**
     * Claims the build slot and hands the build to {@code executor}.
     *
     * @return false, without submitting anything, if a build is already in progress
     */
    public boolean startBuild(Executor executor) {
        if (!running.compareAndSet(false, true)) {
            log.warn("Build already in progress, rejecting request");
            return false;
        }
        try {
            executor.execute(this::executeClaimed);
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        return true;
    }

    // caller must hold the running flag; it is released when the build ends
    private BuildRun executeClaimed() {
        BuildRun run = BuildRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();
        lastRun.set(run);
        log.info("Starting fact build {}", run.getRunId());

        try {
            PipelineInputs inputs = inputLoader.load();
            FactBuildResult result = build(inputs);

            // both facts are staged before either replaces the previous build's output
            List<StagedFact> staged = factCsvWriter.stage(List.of(result.byLineOfBusiness(), result.aggregated()));
            try {
                if (properties.getReport().isEnabled()) {
                    dataQualityReporter.write(
                            dataQualityReporter.summarize(result.byLineOfBusiness(), result.aggregated(), inputs));
                }
                factCsvWriter.publish(staged);
            } finally {
                factCsvWriter.discard(staged);
            }

            run.setLineOfBusinessRows(result.byLineOfBusiness().size());
            run.setAggregatedRows(result.aggregated().size());
            run.setUnresolvedCapacityRows(result.byLineOfBusiness().unresolvedCapacityCount());
            run.setHybridDayRows(result.byLineOfBusiness().hybridDayCount());
            run.setStatus("SUCCESS");
            log.info("Fact build {} complete: {} per-LOB rows, {} aggregated rows",
                    run.getRunId(), run.getLineOfBusinessRows(), run.getAggregatedRows());

        } catch (Exception e) {
            log.error("Fact build {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            running.set(false);
        }
        return run;
    }

    /**
     * Pure engine entry: computes both fact variants from already loaded inputs.
     */
    public FactBuildResult build(PipelineInputs inputs) {
        FactTable byLob = buildVariant(inputs, FactVariant.BY_LINE_OF_BUSINESS);
        FactTable aggregated = buildVariant(inputs, FactVariant.AGGREGATED);
        return new FactBuildResult(byLob, aggregated);
    }

    public FactTable buildVariant(PipelineInputs inputs, FactVariant variant) {
        log.info("Building {} fact...", variant);
        Horizon horizon = horizonResolver.resolve(inputs, variant);

        List<FactRow> grid = gridExpander.expand(
                inputs.dates(), inputs.locations(), inputs.linesOfBusiness(), horizon, variant);

        List<AttendanceEvent> inHorizon = inputs.attendance().stream()
                .filter(e -> horizon.contains(e.date()))
                .toList();
        if (inHorizon.size() < inputs.attendance().size()) {
            log.info("{}: {} attendance events outside {} excluded",
                    variant, inputs.attendance().size() - inHorizon.size(), horizon);
        }

        Map<GridKey, Integer> counts = attendanceAggregator.count(inHorizon, variant);
        gridFiller.fill(grid, counts);
        capacityResolver.resolve(grid, inputs.capacity());
        occupancyCalculator.apply(grid);
        hybridDayClassifier.classify(grid);

        return factAssembler.assemble(grid, variant);
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<BuildRun> getLastRun() {
        return Optional.ofNullable(lastRun.get());
    }
}
