package com.productdata.etl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Run history kept as a JSON-lines file: one {@link RunReport} per line, serialized with Jackson.
 * <p>
 * The scheduler reads it back to find the last scheduled interval, so restarts neither repeat
 * nor lose intervals.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public class RunHistoryService implements RunHistoryServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(RunHistoryService.class);

    private final Path historyFile;
    private final ObjectMapper mapper;

    public RunHistoryService(Path historyFile) {
        if (historyFile == null) {
            throw new IllegalArgumentException("History file cannot be null");
        }
        this.historyFile = historyFile;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void append(RunReport report) throws IOException {
        Path parent = historyFile.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
        String line = mapper.writeValueAsString(report) + System.lineSeparator();
        Files.writeString(historyFile, line, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        logger.debug("Appended run {} to history {}", report.runId(), historyFile);
    }

    @Override
    public synchronized List<RunReport> readAll() throws IOException {
        if (!Files.exists(historyFile)) return List.of();
        List<RunReport> reports = new ArrayList<>();
        for (String line : Files.readAllLines(historyFile, StandardCharsets.UTF_8)) {
            if (line.isBlank()) continue;
            reports.add(mapper.readValue(line, RunReport.class));
        }
        return reports;
    }

    @Override
    public Optional<LocalDateTime> lastLogicalDate(RunTrigger trigger) throws IOException {
        return readAll().stream()
            .filter(r -> r.trigger() == trigger)
            .map(RunReport::logicalDate)
            .max(Comparator.naturalOrder());
    }

    public Path getHistoryFile() {
        return historyFile;
    }
}
