package com.fleetrank.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link ScoringReport} as indented JSON, with timestamps in
 * ISO-8601 form.
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper mapper;

    public ReportWriter() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @throws IllegalStateException if the report cannot be serialised
     */
    public String toJson(ScoringReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize scoring report: " + e.getMessage(), e);
        }
    }

    /**
     * Write to {@code path}, creating parent directories, or to {@code out}
     * when the path is blank.
     *
     * @throws IllegalStateException if the file cannot be written
     */
    public void write(ScoringReport report, String path, PrintStream out) {
        String json = toJson(report);
        if (path == null || path.isBlank()) {
            out.println(json);
            return;
        }
        Path target = Path.of(path);
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, json, StandardCharsets.UTF_8);
            LOG.info("Wrote scoring report to {}", target.toAbsolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write scoring report: " + path, e);
        }
    }
}
