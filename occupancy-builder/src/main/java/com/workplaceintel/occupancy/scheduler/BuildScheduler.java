package com.workplaceintel.occupancy.scheduler;

import com.workplaceintel.occupancy.config.OccupancyBuilderProperties;
import com.workplaceintel.occupancy.service.FactBuildService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup fact builds.
 *
 * Default schedule: every day at 03:00 UTC, after the upstream cleaners have refreshed
 * the dimensions and cleaned extracts.
 *
 * Override with CRON env var or occupancy-builder.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BuildScheduler {

    private final FactBuildService buildService;
    private final OccupancyBuilderProperties properties;

    @PostConstruct
    public void onStartup() {
        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, building facts now");
            try {
                buildService.runBuild();
            } catch (Exception e) {
                log.error("Startup build failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Occupancy builder ready. Next scheduled build: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${occupancy-builder.scheduling.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledBuild() {
        log.info("Scheduled build triggered");
        try {
            buildService.runBuild();
        } catch (Exception e) {
            log.error("Scheduled build failed: {}", e.getMessage(), e);
        }
    }
}
