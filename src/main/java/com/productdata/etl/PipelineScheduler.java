package com.productdata.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fires the pipeline once per schedule interval.
 * <p>
 * Intervals are laid out back to back from midnight of {@link PipelineConfig#startDate()}. An interval
 * {@code [t, t + interval)} becomes due once it has fully elapsed, and its run gets logical date {@code t}.
 * Nothing before the start date is ever scheduled. With {@link PipelineConfig#catchup()} off, only the most
 * recent due interval runs and older missed intervals are dropped; with it on, every missed interval is
 * replayed oldest first.
 * <p>
 * The last scheduled logical date is taken from the run history when one is available, so a restart
 * resumes where the previous process stopped.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public class PipelineScheduler {
    private static final Logger logger = LoggerFactory.getLogger(PipelineScheduler.class);

    private final PipelineRunner runner;
    private final PipelineConfig config;
    private final RunHistoryServiceInterface history;
    private final Clock clock;
    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService executor;
    private LocalDateTime lastScheduled;
    private boolean historyLoaded;

    /**
     * @param runner runner executing each due interval
     * @param config start date, interval and catchup settings
     * @param history run history to resume from, or null to start fresh
     * @param clock source of the current time
     */
    public PipelineScheduler(PipelineRunner runner, PipelineConfig config, RunHistoryServiceInterface history, Clock clock) {
        this.runner = runner;
        this.config = config;
        this.history = history;
        this.clock = clock;
    }

    /**
     * Returns the logical dates that are due at {@code now}, oldest first.
     * @param lastLogicalDate logical date of the last scheduled run, or null if none has run
     * @param now current time in the schedule's zone
     */
    public List<LocalDateTime> dueRuns(LocalDateTime lastLogicalDate, LocalDateTime now) {
        LocalDateTime first = config.startDate().atStartOfDay();
        long intervalMillis = config.interval().toMillis();
        if (now.isBefore(first.plus(config.interval()))) return List.of();

        long newest = Duration.between(first, now).toMillis() / intervalMillis - 1;
        long oldest = 0;
        if (lastLogicalDate != null && !lastLogicalDate.isBefore(first)) {
            oldest = Duration.between(first, lastLogicalDate).toMillis() / intervalMillis + 1;
        }
        if (oldest > newest) return List.of();
        if (!config.catchup()) oldest = newest;

        List<LocalDateTime> due = new ArrayList<>();
        for (long k = oldest; k <= newest; k++) {
            due.add(first.plus(config.interval().multipliedBy(k)));
        }
        return due;
    }

    /**
     * Runs every interval due now. Called on each poll; also usable directly.
     * @return reports of the runs started, oldest first
     * @throws IOException if the run history cannot be read
     */
    public synchronized List<RunReport> runDue() throws IOException {
        if (!historyLoaded) {
            if (history != null) {
                Optional<LocalDateTime> last = history.lastLogicalDate(RunTrigger.SCHEDULED);
                lastScheduled = last.orElse(null);
            }
            historyLoaded = true;
        }
        List<LocalDateTime> due = dueRuns(lastScheduled, LocalDateTime.now(clock));
        if (due.isEmpty()) {
            logger.debug("No interval due; last scheduled run {}", lastScheduled);
            return List.of();
        }
        logger.info("{} interval(s) due: {}", due.size(), due);
        List<RunReport> reports = new ArrayList<>();
        for (LocalDateTime logicalDate : due) {
            reports.add(runner.run(logicalDate, RunTrigger.SCHEDULED));
            lastScheduled = logicalDate;
        }
        return reports;
    }

    /**
     * Starts polling for due intervals on a background thread.
     * @param pollInterval time between checks
     */
    public void start(Duration pollInterval) {
        synchronized (lifecycleLock) {
            if (executor != null) {
                throw new IllegalStateException("Scheduler already started");
            }
            executor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "etl-scheduler"));
            executor.scheduleWithFixedDelay(this::poll, 0, pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
        logger.info("Scheduler started: interval {}, start date {}, catchup {}, polling every {}",
            config.interval(), config.startDate(), config.catchup(), pollInterval);
    }

    /**
     * Stops polling and waits briefly for an in-progress run to finish.
     */
    public void stop() throws InterruptedException {
        ScheduledExecutorService running;
        synchronized (lifecycleLock) {
            running = executor;
            executor = null;
        }
        if (running == null) return;
        running.shutdown();
        if (!running.awaitTermination(30, TimeUnit.SECONDS)) {
            logger.warn("Scheduler did not stop within 30s; interrupting");
            running.shutdownNow();
        }
        logger.info("Scheduler stopped.");
    }

    private void poll() {
        // an exception escaping here would cancel all further polls
        try {
            runDue();
        } catch (Exception e) {
            logger.error("Scheduled poll failed", e);
        }
    }
}
