package com.productdata.etl;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.function.Function;

/**
 * File locations and scheduling settings for one product ETL pipeline.
 * <p>
 * Every stage receives its paths from this record at construction; nothing reads process-wide
 * constants. {@link #fromEnvironment()} resolves each key from a JVM system property first, then an
 * environment variable, then the built-in default.
 *
 * @param rawFile raw product export read by every stage except load
 * @param transformedFile cleaned artifact written by transform and read by load; overwritten each run
 * @param archiveDir directory receiving timestamped snapshots of the raw file
 * @param runHistoryFile JSON-lines run history, or null to keep no history
 * @param retries extra attempts granted to a failing stage
 * @param retryDelay delay before the first retry; doubled for each further retry
 * @param startDate no interval starting before this date is ever scheduled
 * @param catchup whether missed intervals are replayed or only the latest one runs
 * @param interval schedule interval
 * @param missingInputPolicy how extract, transform and load react to an absent input
 *
 * @author Product ETL Team
 * @since 1.0
 */
public record PipelineConfig(
    Path rawFile,
    Path transformedFile,
    Path archiveDir,
    Path runHistoryFile,
    int retries,
    Duration retryDelay,
    LocalDate startDate,
    boolean catchup,
    Duration interval,
    MissingInputPolicy missingInputPolicy
) {
    public static final String RAW_FILE_KEY = "ETL_RAW_FILE";
    public static final String TRANSFORMED_FILE_KEY = "ETL_TRANSFORMED_FILE";
    public static final String ARCHIVE_DIR_KEY = "ETL_ARCHIVE_DIR";
    public static final String RUN_HISTORY_FILE_KEY = "ETL_RUN_HISTORY_FILE";
    public static final String RETRIES_KEY = "ETL_RETRIES";
    public static final String RETRY_DELAY_SECONDS_KEY = "ETL_RETRY_DELAY_SECONDS";
    public static final String START_DATE_KEY = "ETL_START_DATE";
    public static final String CATCHUP_KEY = "ETL_CATCHUP";
    public static final String INTERVAL_HOURS_KEY = "ETL_INTERVAL_HOURS";
    public static final String MISSING_INPUT_POLICY_KEY = "ETL_MISSING_INPUT_POLICY";

    public static final int MAX_RETRIES = 100;

    public static final LocalDate DEFAULT_START_DATE = LocalDate.of(2025, 12, 19);

    public PipelineConfig {
        if (rawFile == null || transformedFile == null || archiveDir == null) {
            throw new IllegalArgumentException("rawFile, transformedFile and archiveDir are required");
        }
        if (retries < 0 || retries > MAX_RETRIES) {
            throw new IllegalArgumentException("retries must be between 0 and " + MAX_RETRIES + " but was " + retries);
        }
        if (retryDelay == null || retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be zero or positive");
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (startDate == null || missingInputPolicy == null) {
            throw new IllegalArgumentException("startDate and missingInputPolicy are required");
        }
    }

    /**
     * Builds a configuration with default settings and all files laid out under one data directory,
     * the same layout the defaults use under {@code data/}.
     */
    public static PipelineConfig forDataDirectory(Path dataDir) {
        return new PipelineConfig(
            dataDir.resolve("products.csv"),
            dataDir.resolve("transformed_products.csv"),
            dataDir.resolve("archive"),
            dataDir.resolve("run-history.jsonl"),
            1,
            Duration.ofSeconds(1),
            DEFAULT_START_DATE,
            false,
            Duration.ofDays(1),
            MissingInputPolicy.SKIP
        );
    }

    /**
     * Resolves the configuration from system properties and environment variables.
     */
    public static PipelineConfig fromEnvironment() {
        return fromLookup(key -> System.getProperty(key, System.getenv(key)));
    }

    /**
     * Resolves the configuration through the given key lookup; a null lookup result selects the default.
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    static PipelineConfig fromLookup(Function<String, String> lookup) {
        String historyFile = valueOf(lookup, RUN_HISTORY_FILE_KEY, "data/run-history.jsonl");
        try {
            return new PipelineConfig(
                Paths.get(valueOf(lookup, RAW_FILE_KEY, "data/products.csv")),
                Paths.get(valueOf(lookup, TRANSFORMED_FILE_KEY, "data/transformed_products.csv")),
                Paths.get(valueOf(lookup, ARCHIVE_DIR_KEY, "data/archive")),
                historyFile.isBlank() ? null : Paths.get(historyFile),
                Integer.parseInt(valueOf(lookup, RETRIES_KEY, "1")),
                Duration.ofSeconds(Long.parseLong(valueOf(lookup, RETRY_DELAY_SECONDS_KEY, "1"))),
                LocalDate.parse(valueOf(lookup, START_DATE_KEY, DEFAULT_START_DATE.toString())),
                Boolean.parseBoolean(valueOf(lookup, CATCHUP_KEY, "false")),
                Duration.ofHours(Long.parseLong(valueOf(lookup, INTERVAL_HOURS_KEY, "24"))),
                MissingInputPolicy.valueOf(valueOf(lookup, MISSING_INPUT_POLICY_KEY, "SKIP").toUpperCase(Locale.ROOT))
            );
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid pipeline configuration: " + e.getMessage(), e);
        }
    }

    public PipelineConfig withMissingInputPolicy(MissingInputPolicy policy) {
        return new PipelineConfig(rawFile, transformedFile, archiveDir, runHistoryFile, retries, retryDelay,
            startDate, catchup, interval, policy);
    }

    public PipelineConfig withRetries(int retries, Duration retryDelay) {
        return new PipelineConfig(rawFile, transformedFile, archiveDir, runHistoryFile, retries, retryDelay,
            startDate, catchup, interval, missingInputPolicy);
    }

    public PipelineConfig withSchedule(LocalDate startDate, Duration interval, boolean catchup) {
        return new PipelineConfig(rawFile, transformedFile, archiveDir, runHistoryFile, retries, retryDelay,
            startDate, catchup, interval, missingInputPolicy);
    }

    private static String valueOf(Function<String, String> lookup, String key, String defaultValue) {
        String value = lookup.apply(key);
        return value == null ? defaultValue : value.trim();
    }
}
