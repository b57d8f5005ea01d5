package com.example.motion_photo_muxer.service;

import com.example.motion_photo_muxer.model.RunSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * End-of-run artifacts: the problematic-files list and the optional JSON summary.
 */
@Component
public class RunReportWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(RunReportWriter.class);
    static final String PROBLEMATIC_HEADER = "The following files could not be converted and were left unprocessed:";

    private final ObjectMapper objectMapper;

    public RunReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the report path, or {@code null} when there was nothing to report or it could not be written.
     */
    public Path writeProblematicReport(Path outputDir, String fileName, Collection<Path> problematic) {
        if (problematic == null || problematic.isEmpty()) {
            return null;
        }
        Path report = outputDir.resolve(fileName);
        List<String> lines = new ArrayList<>(problematic.size() + 1);
        lines.add(PROBLEMATIC_HEADER);
        problematic.forEach(path -> lines.add(path.toString()));
        try {
            Files.createDirectories(outputDir);
            Files.write(report, lines, StandardCharsets.UTF_8);
            LOGGER.warn("{} problematic file(s) listed in {}", problematic.size(), report);
            return report;
        } catch (IOException e) {
            LOGGER.warn("Could not write problematic report path={} err={}", report, e.toString());
            return null;
        }
    }

    public Path writeSummary(Path outputDir, String fileName, RunSummary summary) {
        Path target = outputDir.resolve(fileName);
        try {
            Files.createDirectories(outputDir);
            objectMapper.copy()
                    .enable(SerializationFeature.INDENT_OUTPUT)
                    .writeValue(target.toFile(), summary);
            LOGGER.info("Run summary written path={}", target);
            return target;
        } catch (IOException e) {
            LOGGER.warn("Could not write run summary path={} err={}", target, e.toString());
            return null;
        }
    }
}
