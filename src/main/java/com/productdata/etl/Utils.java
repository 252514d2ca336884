package com.productdata.etl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Helper methods shared by the pipeline stages and the runner.
 *
 * @author Product ETL Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Result of {@link #retry}: either a value or the last failure, plus the attempts made.
     */
    public record RetryOutcome<T>(T value, Exception failure, int attempts) {
        public boolean succeeded() {
            return failure == null;
        }
    }

    /**
     * Runs an action up to maxAttempts times with exponential backoff between attempts.
     * The delay before retry n is {@code baseDelay * 2^(n-1)}.
     * <p>
     * If the thread is interrupted while waiting, the interrupt flag is restored and no further
     * attempts are made.
     *
     * @param action Callable action to execute
     * @param maxAttempts Maximum number of attempts, at least 1
     * @param baseDelay Delay before the first retry
     * @param actionDesc Description for logging
     * @param <T> Return type
     * @return the value of the first successful attempt, or the last failure
     */
    public static <T> RetryOutcome<T> retry(Callable<T> action, int maxAttempts, Duration baseDelay, String actionDesc) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
        }
        int attempts = 0;
        Exception lastFailure = null;
        while (attempts < maxAttempts) {
            try {
                attempts++;
                return new RetryOutcome<>(action.call(), null, attempts);
            } catch (Exception e) {
                lastFailure = e;
                logger.warn("Failed {} (attempt {} of {}): {}", actionDesc, attempts, maxAttempts, e.getMessage());
                if (attempts >= maxAttempts) break;
                try {
                    Thread.sleep(backoff(baseDelay, attempts).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while waiting to retry {}", actionDesc);
                    lastFailure.addSuppressed(ie);
                    break;
                }
            }
        }
        logger.error("Giving up on {} after {} attempts.", actionDesc, attempts);
        return new RetryOutcome<>(null, lastFailure, attempts);
    }

    /**
     * Delay before the given retry: {@code baseDelay * 2^(retryNumber-1)}.
     */
    static Duration backoff(Duration baseDelay, int retryNumber) {
        return baseDelay.multipliedBy(1L << Math.min(retryNumber - 1, 30));
    }

    /**
     * Applies the missing-input policy for a stage whose required input is absent.
     * The absence is always logged as an error.
     *
     * @return a {@link StageOutcome#SKIPPED_NO_INPUT} result under {@link MissingInputPolicy#SKIP}
     * @throws MissingInputException under {@link MissingInputPolicy#FAIL}
     */
    static StageResult missingInput(String stage, MissingInputPolicy policy, Path path, String message)
            throws MissingInputException {
        logger.error(message);
        if (policy == MissingInputPolicy.FAIL) {
            throw new MissingInputException(path, message);
        }
        return StageResult.skipped(stage, message);
    }
}
