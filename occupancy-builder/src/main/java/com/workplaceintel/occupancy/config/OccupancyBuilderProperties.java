package com.workplaceintel.occupancy.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;

@Component
@ConfigurationProperties(prefix = "occupancy-builder")
@Data
public class OccupancyBuilderProperties {

    private Input input = new Input();
    private Output output = new Output();
    private Horizon horizon = new Horizon();
    private Report report = new Report();
    private Scheduling scheduling = new Scheduling();

    /**
     * Locations of the upstream datasets. Relative paths resolve against {@code baseDir}.
     */
    @Data
    public static class Input {
        private String baseDir = ".";
        private String dateDimension = "dimensions/DimDate.csv";
        private String locationDimension = "dimensions/DimLocation.csv";
        private String lineOfBusinessDimension = "dimensions/DimLineOfBusiness.csv";
        private String attendance = "cleaned_data/Occupancy_cleaned.csv";
        private String capacity = "cleaned_data/Deskcount_cleaned.csv";

        public Path resolve(String file) {
            return Paths.get(baseDir).resolve(file);
        }
    }

    @Data
    public static class Output {
        private String outputDir = "facts";
        private boolean includeHeader = true;
    }

    /**
     * Optional overrides for the derived date window. Unset means "derive from the data".
     */
    @Data
    public static class Horizon {
        private LocalDate startDate;
        private LocalDate cutoffDate;
    }

    @Data
    public static class Report {
        private boolean enabled = true;
        private String outputDir = "reports";
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = false;
    }
}
