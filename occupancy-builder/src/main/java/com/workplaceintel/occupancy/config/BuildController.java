package com.workplaceintel.occupancy.config;

import com.workplaceintel.occupancy.model.BuildRun;
import com.workplaceintel.occupancy.service.FactBuildService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class BuildController {

    private final FactBuildService buildService;
    private final OccupancyBuilderProperties properties;

    @PostMapping("/build/trigger")
    public ResponseEntity<Map<String, String>> trigger() {
        boolean started = buildService.startBuild(task -> new Thread(task, "manual-fact-build").start());
        if (!started) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("status", "rejected", "reason", "build already running"));
        }
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }

    /**
     * Latest build run, including one still in progress.
     *
     * GET /build/runs/latest
     */
    @GetMapping("/build/runs/latest")
    public ResponseEntity<BuildRun> latestRun() {
        return buildService.getLastRun()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/build/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "occupancy-builder",
                "version", "1.0.0",
                "running", buildService.isRunning(),
                "outputDir", properties.getOutput().getOutputDir(),
                "schedule", properties.getScheduling().getCron()
        ));
    }
}
