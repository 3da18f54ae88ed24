package com.workplaceintel.occupancy.input;

import com.workplaceintel.occupancy.config.OccupancyBuilderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads all five upstream datasets for a build. Every file is checked for existence
 * before any of them is parsed, so a missing input fails the run before it starts.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InputLoader {

    private final InputCsvReader reader;
    private final OccupancyBuilderProperties properties;

    public PipelineInputs load() {
        OccupancyBuilderProperties.Input input = properties.getInput();

        Path dates = input.resolve(input.getDateDimension());
        Path locations = input.resolve(input.getLocationDimension());
        Path linesOfBusiness = input.resolve(input.getLineOfBusinessDimension());
        Path attendance = input.resolve(input.getAttendance());
        Path capacity = input.resolve(input.getCapacity());

        List<Path> missing = List.of(dates, locations, linesOfBusiness, attendance, capacity).stream()
                .filter(p -> !Files.isRegularFile(p))
                .toList();
        if (!missing.isEmpty()) {
            throw new MissingInputException(missing);
        }

        log.info("Loading inputs from {}", Path.of(input.getBaseDir()).toAbsolutePath());
        return new PipelineInputs(
                reader.readDates(dates),
                reader.readLocations(locations),
                reader.readLinesOfBusiness(linesOfBusiness),
                reader.readAttendance(attendance),
                reader.readCapacity(capacity));
    }
}
