package com.productdata.etl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class PipelineRunnerTest {
    @TempDir
    Path tempDir;

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-12-20T06:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime LOGICAL_DATE = LocalDateTime.of(2025, 12, 19, 0, 0);

    /**
     * Stage that fails a fixed number of times before returning its result.
     */
    static class ScriptedStage implements Stage {
        private final String name;
        private final int failuresBeforeSuccess;
        private final StageOutcome outcome;
        int executions;

        ScriptedStage(String name, int failuresBeforeSuccess, StageOutcome outcome) {
            this.name = name;
            this.failuresBeforeSuccess = failuresBeforeSuccess;
            this.outcome = outcome;
        }

        static ScriptedStage succeeding(String name) {
            return new ScriptedStage(name, 0, StageOutcome.SUCCESS);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public StageResult execute() throws IOException {
            executions++;
            if (executions <= failuresBeforeSuccess) {
                throw new IOException(name + " failed on attempt " + executions);
            }
            return outcome == StageOutcome.SKIPPED_NO_INPUT
                ? StageResult.skipped(name, "nothing to do")
                : StageResult.success(name, 1, "ok", null);
        }
    }

    private PipelineConfig config(int retries) {
        return PipelineConfig.forDataDirectory(tempDir).withRetries(retries, Duration.ZERO);
    }

    private PipelineRunner runner(int retries, Stage... stages) {
        return new PipelineRunner(new ProductPipeline("test_dag", List.of(stages)), config(retries), null, CLOCK);
    }

    @Test
    void testStagesRunInOrder() {
        List<String> order = new ArrayList<>();
        Stage[] stages = new Stage[3];
        for (int i = 0; i < 3; i++) {
            String stageName = "stage_" + i;
            stages[i] = new ScriptedStage(stageName, 0, StageOutcome.SUCCESS) {
                @Override
                public StageResult execute() throws IOException {
                    order.add(stageName);
                    return super.execute();
                }
            };
        }
        RunReport report = runner(0, stages).run(LOGICAL_DATE, RunTrigger.SCHEDULED);

        assertEquals(RunStatus.SUCCESS, report.status());
        assertEquals(List.of("stage_0", "stage_1", "stage_2"), order);
        assertEquals("scheduled__2025-12-19T00:00", report.runId());
        assertEquals(LOGICAL_DATE, report.logicalDate());
    }

    @Test
    void testFlakyStageSucceedsWithinRetryBudget() {
        ScriptedStage flaky = new ScriptedStage("flaky", 1, StageOutcome.SUCCESS);
        RunReport report = runner(1, flaky).run(LOGICAL_DATE, RunTrigger.SCHEDULED);

        assertEquals(RunStatus.SUCCESS, report.status());
        assertEquals(2, report.stage("flaky").attempts());
        assertEquals(2, flaky.executions);
    }

    @Test
    void testExhaustedRetriesFailRunAndBlockDownstream() {
        ScriptedStage broken = new ScriptedStage("broken", Integer.MAX_VALUE, StageOutcome.SUCCESS);
        ScriptedStage downstream = ScriptedStage.succeeding("downstream");
        RunReport report = runner(2, ScriptedStage.succeeding("upstream"), broken, downstream)
            .run(LOGICAL_DATE, RunTrigger.SCHEDULED);

        assertEquals(RunStatus.FAILED, report.status());
        assertEquals(StageOutcome.SUCCESS, report.stage("upstream").outcome());
        StageResult failed = report.stage("broken");
        assertEquals(StageOutcome.FAILED, failed.outcome());
        assertEquals(3, failed.attempts());
        assertTrue(failed.message().contains("IOException"));

        StageResult skipped = report.stage("downstream");
        assertEquals(StageOutcome.FAILED, skipped.outcome());
        assertEquals(0, skipped.attempts());
        assertEquals(PipelineRunner.UPSTREAM_FAILED, skipped.message());
        assertEquals(0, downstream.executions);
    }

    @Test
    void testSkippedStageDoesNotBlockDownstream() {
        ScriptedStage downstream = ScriptedStage.succeeding("downstream");
        RunReport report = runner(0, new ScriptedStage("nothing_to_do", 0, StageOutcome.SKIPPED_NO_INPUT), downstream)
            .run(LOGICAL_DATE, RunTrigger.SCHEDULED);

        assertEquals(RunStatus.SUCCESS, report.status());
        assertEquals(StageOutcome.SKIPPED_NO_INPUT, report.stage("nothing_to_do").outcome());
        assertEquals(1, downstream.executions);
    }

    @Test
    void testOverlappingRunIsRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Stage blocking = new Stage() {
            @Override
            public String name() {
                return "blocking";
            }

            @Override
            public StageResult execute() throws InterruptedException {
                entered.countDown();
                release.await();
                return StageResult.success("blocking", null, "done", null);
            }
        };
        PipelineRunner runner = runner(0, blocking);
        AtomicReference<RunReport> first = new AtomicReference<>();
        Thread background = new Thread(() -> first.set(runner.run(LOGICAL_DATE, RunTrigger.SCHEDULED)));
        background.start();
        try {
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertTrue(runner.isRunning());
            assertThrows(PipelineBusyException.class, runner::runNow);
        } finally {
            release.countDown();
            background.join(5_000);
        }
        assertEquals(RunStatus.SUCCESS, first.get().status());
        assertFalse(runner.isRunning());
        // the lock is free again once the first run finished
        assertEquals(RunStatus.SUCCESS, runner.runNow().status());
    }

    @Test
    void testRunIsAppendedToHistory() throws Exception {
        RunHistoryService history = new RunHistoryService(tempDir.resolve("history/runs.jsonl"));
        PipelineRunner runner = new PipelineRunner(
            new ProductPipeline("test_dag", List.of(ScriptedStage.succeeding("only"))), config(0), history, CLOCK);
        RunReport report = runner.runNow();

        assertEquals(RunTrigger.MANUAL, report.trigger());
        assertEquals("manual__2025-12-20T06:00:00Z", report.runId());
        assertEquals(List.of(report), history.readAll());
    }

    @Test
    void testHistoryWriteFailureStillReturnsReport() {
        ScriptedStage stage = ScriptedStage.succeeding("only");
        PipelineRunner runner = new PipelineRunner(
            new ProductPipeline("test_dag", List.of(stage)), config(0), new FailingHistory(), CLOCK);
        RunReport report = runner.run(LOGICAL_DATE, RunTrigger.SCHEDULED);

        assertEquals(RunStatus.SUCCESS, report.status());
        assertEquals(1, stage.executions);
        assertFalse(runner.isRunning());
    }

    /**
     * History that cannot be written and has nothing recorded.
     */
    static class FailingHistory implements RunHistoryServiceInterface {
        int appendAttempts;

        @Override
        public void append(RunReport report) throws IOException {
            appendAttempts++;
            throw new IOException("disk full");
        }

        @Override
        public List<RunReport> readAll() {
            return List.of();
        }

        @Override
        public Optional<LocalDateTime> lastLogicalDate(RunTrigger trigger) {
            return Optional.empty();
        }
    }

    @Test
    void testProductPipelineWithoutRawFileSkipsEveryStage() {
        PipelineConfig config = config(1);
        PipelineRunner runner = new PipelineRunner(
            ProductPipeline.create(config, new CsvService(), new LoggingRecordSink(), CLOCK), config, null, CLOCK);
        RunReport report = runner.run(LOGICAL_DATE, RunTrigger.SCHEDULED);

        assertEquals(RunStatus.SUCCESS, report.status());
        for (StageResult result : report.stages()) {
            assertEquals(StageOutcome.SKIPPED_NO_INPUT, result.outcome(), result.stage());
        }
        assertFalse(Files.exists(config.transformedFile()));
    }

    @Test
    void testProductPipelineWithoutRawFileFailsUnderFailPolicy() {
        PipelineConfig config = config(1).withMissingInputPolicy(MissingInputPolicy.FAIL);
        PipelineRunner runner = new PipelineRunner(
            ProductPipeline.create(config, new CsvService(), new LoggingRecordSink(), CLOCK), config, null, CLOCK);
        RunReport report = runner.run(LOGICAL_DATE, RunTrigger.SCHEDULED);

        assertEquals(RunStatus.FAILED, report.status());
        assertEquals(StageOutcome.SKIPPED_NO_INPUT, report.stage(ArchiveStage.NAME).outcome());
        assertEquals(StageOutcome.FAILED, report.stage(ExtractStage.NAME).outcome());
        assertEquals(2, report.stage(ExtractStage.NAME).attempts());
        assertTrue(report.stage(ExtractStage.NAME).message().contains("MissingInputException"));
        assertEquals(0, report.stage(TransformStage.NAME).attempts());
        assertEquals(0, report.stage(LoadStage.NAME).attempts());
    }

    @Test
    void testProductPipelineEndToEnd() throws Exception {
        PipelineConfig config = config(0);
        Files.writeString(config.rawFile(), "Name,Price\nWidget,9.5\nWidget,9.5\nGadget,\n");
        PipelineStagesTest.CapturingSink sink = new PipelineStagesTest.CapturingSink();
        ProductPipeline pipeline = ProductPipeline.create(config, new CsvService(), sink, CLOCK);
        RunReport report = new PipelineRunner(pipeline, config, null, CLOCK).run(LOGICAL_DATE, RunTrigger.SCHEDULED);

        assertEquals(List.of(ArchiveStage.NAME, ExtractStage.NAME, TransformStage.NAME, LoadStage.NAME),
            pipeline.stageNames());
        assertEquals(RunStatus.SUCCESS, report.status());
        assertTrue(Files.exists(config.archiveDir().resolve("products_20251220_060000.csv")));
        assertEquals(3, report.stage(ExtractStage.NAME).rowCount());
        assertEquals(2, report.stage(TransformStage.NAME).rowCount());
        assertEquals(2, report.stage(LoadStage.NAME).rowCount());
        assertEquals(List.of("name", "price"), sink.received.get(0).columns());
    }

    @Test
    void testDuplicateStageNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ProductPipeline("dup", List.of(
            ScriptedStage.succeeding("same"), ScriptedStage.succeeding("same"))));
    }
}
