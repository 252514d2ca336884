package com.productdata.etl;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Callable;

import static org.junit.jupiter.api.Assertions.*;

public class UtilsTest {
    @Test
    void testRetrySuccessAfterRetries() {
        final int[] attempts = {0};
        Callable<String> action = () -> {
            if (attempts[0] < 2) {
                attempts[0]++;
                throw new IOException("Simulated failure");
            }
            return "Success";
        };
        Utils.RetryOutcome<String> outcome = Utils.retry(action, 3, Duration.ZERO, "test action");
        assertTrue(outcome.succeeded());
        assertEquals("Success", outcome.value());
        assertEquals(3, outcome.attempts());
    }

    @Test
    void testRetryFailureKeepsLastException() {
        final int[] calls = {0};
        Utils.RetryOutcome<String> outcome = Utils.retry(() -> {
            calls[0]++;
            throw new IOException("Always fails " + calls[0]);
        }, 2, Duration.ZERO, "test always fail");
        assertFalse(outcome.succeeded());
        assertNull(outcome.value());
        assertEquals(2, outcome.attempts());
        assertEquals("Always fails 2", outcome.failure().getMessage());
    }

    @Test
    void testRetryNeedsAtLeastOneAttempt() {
        assertThrows(IllegalArgumentException.class, () -> Utils.retry(() -> 1, 0, Duration.ZERO, "none"));
    }

    @Test
    void testBackoffDoubles() {
        Duration base = Duration.ofMillis(100);
        assertEquals(Duration.ofMillis(100), Utils.backoff(base, 1));
        assertEquals(Duration.ofMillis(200), Utils.backoff(base, 2));
        assertEquals(Duration.ofMillis(400), Utils.backoff(base, 3));
    }

    @Test
    void testInterruptStopsRetrying() {
        final int[] calls = {0};
        Thread.currentThread().interrupt();
        try {
            Utils.RetryOutcome<Integer> outcome = Utils.retry(() -> {
                calls[0]++;
                throw new IllegalStateException("fail");
            }, 5, Duration.ofSeconds(10), "interrupted action");
            assertEquals(1, calls[0]);
            assertEquals(1, outcome.attempts());
            assertFalse(outcome.succeeded());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testMissingInputPolicy() throws Exception {
        StageResult skipped = Utils.missingInput("stage", MissingInputPolicy.SKIP, java.nio.file.Paths.get("x.csv"), "missing");
        assertEquals(StageOutcome.SKIPPED_NO_INPUT, skipped.outcome());
        assertThrows(MissingInputException.class,
            () -> Utils.missingInput("stage", MissingInputPolicy.FAIL, java.nio.file.Paths.get("x.csv"), "missing"));
    }
}
