package com.productdata.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Executes a {@link ProductPipeline} stage by stage.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Stages run strictly in order on the calling thread.</li>
 *   <li>A stage that throws is retried up to {@link PipelineConfig#retries()} times with exponential backoff.</li>
 *   <li>A stage that returns, including with {@link StageOutcome#SKIPPED_NO_INPUT}, counts as complete and the
 *       next stage runs.</li>
 *   <li>Once a stage has failed every attempt, the remaining stages are recorded as failed without running and
 *       the run is {@link RunStatus#FAILED}.</li>
 *   <li>Only one run may be in progress; an overlapping call gets {@link PipelineBusyException}.</li>
 *   <li>The finished {@link RunReport} is appended to the run history when one is configured. A failed
 *       append is logged and the report is still returned, since the stages have already run.</li>
 * </ul>
 *
 * @author Product ETL Team
 * @since 1.0
 */
public class PipelineRunner {
    private static final Logger logger = LoggerFactory.getLogger(PipelineRunner.class);

    static final String UPSTREAM_FAILED = "upstream failed";

    private final ProductPipeline pipeline;
    private final PipelineConfig config;
    private final RunHistoryServiceInterface history;
    private final Clock clock;
    private final ReentrantLock runLock = new ReentrantLock();

    /**
     * @param pipeline stages to run
     * @param config retry settings
     * @param history where finished runs are recorded, or null to record nothing
     * @param clock source of run timestamps
     */
    public PipelineRunner(ProductPipeline pipeline, PipelineConfig config, RunHistoryServiceInterface history, Clock clock) {
        this.pipeline = pipeline;
        this.config = config;
        this.history = history;
        this.clock = clock;
    }

    /**
     * Starts a manual run for the current time.
     */
    public RunReport runNow() {
        return run(LocalDateTime.now(clock), RunTrigger.MANUAL);
    }

    /**
     * Runs every stage once (plus retries) for the given logical date.
     * @param logicalDate start of the interval this run covers
     * @param trigger what started the run
     * @return the finished run report
     * @throws PipelineBusyException if another run is in progress
     */
    public RunReport run(LocalDateTime logicalDate, RunTrigger trigger) {
        if (!runLock.tryLock()) {
            throw new PipelineBusyException("Pipeline " + pipeline.dagId() + " is already running; refusing overlapping "
                + trigger.name().toLowerCase(Locale.ROOT) + " run for " + logicalDate);
        }
        try {
            Instant startedAt = clock.instant();
            String runId = runId(trigger, logicalDate, startedAt);
            logger.info("Starting run {} of {} with stages {}", runId, pipeline.dagId(), pipeline.stageNames());

            List<StageResult> results = new ArrayList<>();
            boolean failed = false;
            for (Stage stage : pipeline.stages()) {
                if (failed) {
                    logger.warn("Task {} not run: {}", stage.name(), UPSTREAM_FAILED);
                    results.add(StageResult.failed(stage.name(), 0, UPSTREAM_FAILED));
                    continue;
                }
                StageResult result = runStage(stage);
                results.add(result);
                failed = result.outcome() == StageOutcome.FAILED;
            }

            RunStatus status = failed ? RunStatus.FAILED : RunStatus.SUCCESS;
            RunReport report = new RunReport(runId, trigger, logicalDate, startedAt, clock.instant(), status, results);
            if (status == RunStatus.SUCCESS) {
                logger.info("Run {} finished: {}", runId, status);
            } else {
                logger.error("Run {} finished: {}", runId, status);
            }
            record(report);
            return report;
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Returns true while a run is in progress.
     */
    public boolean isRunning() {
        return runLock.isLocked();
    }

    public ProductPipeline getPipeline() {
        return pipeline;
    }

    private StageResult runStage(Stage stage) {
        logger.info("Running task {}", stage.name());
        Utils.RetryOutcome<StageResult> outcome = Utils.retry(stage::execute, config.retries() + 1,
            config.retryDelay(), "task " + stage.name());
        if (outcome.succeeded()) {
            StageResult result = outcome.value().withAttempts(outcome.attempts());
            logger.info("Task {} finished with {} after {} attempt(s): {}", stage.name(), result.outcome(),
                result.attempts(), result.message());
            return result;
        }
        Exception failure = outcome.failure();
        logger.error("Task {} failed after {} attempt(s)", stage.name(), outcome.attempts(), failure);
        return StageResult.failed(stage.name(), outcome.attempts(),
            failure.getClass().getSimpleName() + ": " + failure.getMessage());
    }

    private void record(RunReport report) {
        if (history == null) return;
        try {
            history.append(report);
        } catch (IOException e) {
            logger.error("Failed to record run {} in run history", report.runId(), e);
        }
    }

    private static String runId(RunTrigger trigger, LocalDateTime logicalDate, Instant startedAt) {
        String stamp = trigger == RunTrigger.SCHEDULED ? logicalDate.toString() : startedAt.toString();
        return trigger.name().toLowerCase(Locale.ROOT) + "__" + stamp;
    }
}
