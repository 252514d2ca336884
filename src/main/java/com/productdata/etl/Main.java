package com.productdata.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Main entry point for the product ETL pipeline.
 * <p>
 * Modes (first argument):
 * <ul>
 *   <li>{@code run} (default): run archive, extract, transform and load once now.</li>
 *   <li>{@code schedule}: run once per configured interval until the process is stopped.</li>
 *   <li>{@code history [n]}: print the last n runs from the run history (default 10).</li>
 * </ul>
 * Paths and settings come from {@link PipelineConfig#fromEnvironment()}.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final Duration SCHEDULER_POLL_INTERVAL = Duration.ofMinutes(1);

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = execute(args, PipelineConfig.fromEnvironment(), Clock.systemDefaultZone());
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration or arguments: {}", e.getMessage());
            exitCode = 2;
        } catch (Exception e) {
            logger.error("Pipeline terminated unexpectedly", e);
            exitCode = 1;
        }
        // schedule mode keeps the JVM alive on the scheduler thread
        if (exitCode != 0) System.exit(exitCode);
    }

    /**
     * Runs the requested mode and returns the process exit code.
     */
    static int execute(String[] args, PipelineConfig config, Clock clock) throws Exception {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase(Locale.ROOT) : "run";
        RunHistoryServiceInterface history = config.runHistoryFile() == null
            ? null : new RunHistoryService(config.runHistoryFile());
        ProductPipeline pipeline = ProductPipeline.create(config, new CsvService(), new LoggingRecordSink(), clock);
        PipelineRunner runner = new PipelineRunner(pipeline, config, history, clock);

        switch (mode) {
            case "run":
                return runOnce(runner);
            case "schedule":
                schedule(runner, config, history, clock);
                return 0;
            case "history":
                int limit = args.length > 1 ? Integer.parseInt(args[1]) : 10;
                return printHistory(history, limit);
            default:
                throw new IllegalArgumentException("Unknown mode '" + mode + "'. Expected run, schedule or history.");
        }
    }

    private static int runOnce(PipelineRunner runner) {
        RunReport report = runner.runNow();
        for (StageResult result : report.stages()) {
            System.out.printf("%-20s %-17s attempts=%d %s%n", result.stage(), result.outcome(), result.attempts(),
                result.message() == null ? "" : result.message());
        }
        return report.status() == RunStatus.SUCCESS ? 0 : 1;
    }

    private static void schedule(PipelineRunner runner, PipelineConfig config, RunHistoryServiceInterface history,
                                 Clock clock) {
        PipelineScheduler scheduler = new PipelineScheduler(runner, config, history, clock);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                scheduler.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while stopping scheduler");
            }
        }, "etl-shutdown"));
        scheduler.start(SCHEDULER_POLL_INTERVAL);
    }

    private static int printHistory(RunHistoryServiceInterface history, int limit) throws Exception {
        if (history == null) {
            System.out.println("Run history is disabled (" + PipelineConfig.RUN_HISTORY_FILE_KEY + " is blank).");
            return 0;
        }
        List<RunReport> reports = history.readAll();
        if (reports.isEmpty()) {
            System.out.println("No runs recorded yet.");
            return 0;
        }
        for (RunReport report : reports.subList(Math.max(0, reports.size() - limit), reports.size())) {
            System.out.printf("%s %-8s logical=%s started=%s%n", report.runId(), report.status(),
                report.logicalDate(), report.startedAt());
            for (StageResult result : report.stages()) {
                System.out.printf("    %-20s %-17s attempts=%d%n", result.stage(), result.outcome(), result.attempts());
            }
        }
        return 0;
    }
}
