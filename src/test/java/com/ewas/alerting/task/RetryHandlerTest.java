package com.ewas.alerting.task;

import com.ewas.alerting.exception.DetectorConfigurationException;
import com.ewas.alerting.exception.DetectorUnavailableException;
import com.ewas.alerting.exception.RetryExhaustedException;
import com.ewas.alerting.exception.TransientTaskException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Backoffs are recorded instead of slept so the schedule can be asserted.
 */
@DisplayName("RetryHandler")
class RetryHandlerTest {

    private List<Duration> slept;
    private RetryHandler retryHandler;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        slept = new ArrayList<>();
        retryHandler = new RetryHandler(slept::add);
        policy = new RetryPolicy(3, Duration.ofSeconds(60));
    }

    // ========== SUCCESSFUL OPERATION TESTS ==========

    @Test
    @DisplayName("Should succeed on first attempt without sleeping")
    void testSuccessFirstAttempt() {
        RetryOutcome<String> outcome = retryHandler.supervise(() -> "success", "test-operation", policy);

        assertTrue(outcome.isSuccess());
        assertEquals("success", outcome.getValue());
        assertEquals(1, outcome.getAttempts());
        assertTrue(slept.isEmpty());
    }

    @Test
    @DisplayName("Should retry transient failures with exponential backoff")
    void testSuccessAfterRetries() {
        AtomicInteger attempts = new AtomicInteger();

        RetryOutcome<String> outcome = retryHandler.supervise(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new TransientTaskException("store temporarily unavailable");
            }
            return "done";
        }, "test-retry-operation", policy);

        assertTrue(outcome.isSuccess());
        assertEquals(3, outcome.getAttempts());
        assertEquals(List.of(Duration.ofSeconds(60), Duration.ofSeconds(120)), slept);
        assertEquals(slept, outcome.getBackoffs());
    }

    // ========== FAILURE TESTS ==========

    @Test
    @DisplayName("Should stop after max retries")
    void testExhausted() {
        AtomicInteger attempts = new AtomicInteger();

        RetryOutcome<Object> outcome = retryHandler.supervise(() -> {
            attempts.incrementAndGet();
            throw new ResourceAccessException("Connection refused");
        }, "always-failing", policy);

        assertFalse(outcome.isSuccess());
        assertFalse(outcome.isTerminal());
        assertEquals(4, attempts.get());
        assertEquals(4, outcome.getAttempts());
        assertEquals(List.of(Duration.ofSeconds(60), Duration.ofSeconds(120), Duration.ofSeconds(240)), slept);
    }

    @Test
    @DisplayName("Should not retry an unavailable detector")
    void testTerminalFailure() {
        AtomicInteger attempts = new AtomicInteger();

        RetryOutcome<Object> outcome = retryHandler.supervise(() -> {
            attempts.incrementAndGet();
            throw new DetectorUnavailableException("Detector d1 is inactive");
        }, "run-detector", policy);

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.isTerminal());
        assertEquals(1, attempts.get());
        assertEquals("Detector d1 is inactive", outcome.errorMessage());
        assertTrue(slept.isEmpty());
    }

    @Test
    @DisplayName("executeWithRetry rethrows terminal failures and wraps exhausted ones")
    void testExecuteWithRetry() {
        assertThrows(IllegalArgumentException.class, () ->
            retryHandler.executeWithRetry(() -> {
                throw new IllegalArgumentException("bad window");
            }, "op", policy));

        RetryExhaustedException exhausted = assertThrows(RetryExhaustedException.class, () ->
            retryHandler.executeWithRetry(() -> {
                throw new TransientTaskException("flaky");
            }, "op", new RetryPolicy(1, Duration.ZERO)));
        assertEquals(2, exhausted.getAttempts());
        assertInstanceOf(TransientTaskException.class, exhausted.getCause());
    }

    @Test
    @DisplayName("Interrupted backoff ends the loop")
    void testInterrupted() {
        RetryHandler interrupting = new RetryHandler(delay -> {
            throw new InterruptedException();
        });

        RetryOutcome<Object> outcome = interrupting.supervise(() -> {
            throw new TransientTaskException("flaky");
        }, "op", policy);

        assertTrue(outcome.isTerminal());
        assertTrue(Thread.interrupted(), "interrupt flag restored");
    }

    // ========== CLASSIFICATION TESTS ==========

    @Test
    @DisplayName("Retryable error classification")
    void testIsRetryable() {
        assertTrue(retryHandler.isRetryable(new TransientTaskException("x")));
        assertTrue(retryHandler.isRetryable(new RuntimeException(new SocketTimeoutException("read"))));
        assertTrue(retryHandler.isRetryable(new IOException("broken pipe")));
        assertTrue(retryHandler.isRetryable(new HttpServerErrorException(HttpStatus.BAD_GATEWAY)));
        assertTrue(retryHandler.isRetryable(new DataAccessResourceFailureException("mongo")));
        assertTrue(retryHandler.isRetryable(new RuntimeException("Read timed out")));

        assertFalse(retryHandler.isRetryable(new HttpClientErrorException(HttpStatus.BAD_REQUEST)));
        assertFalse(retryHandler.isRetryable(new DetectorConfigurationException("bad")));
        assertFalse(retryHandler.isRetryable(new IllegalStateException("timeout")));
        assertFalse(retryHandler.isRetryable(new RuntimeException("boom")));
    }

    // ========== POLICY TESTS ==========

    @Test
    @DisplayName("Backoff doubles and is capped")
    void testPolicyBackoff() {
        RetryPolicy capped = new RetryPolicy(10, Duration.ofMinutes(20), Duration.ofHours(1));

        assertEquals(Duration.ofMinutes(20), capped.backoffFor(0));
        assertEquals(Duration.ofMinutes(40), capped.backoffFor(1));
        assertEquals(Duration.ofHours(1), capped.backoffFor(2));
        assertEquals(Duration.ofHours(1), capped.backoffFor(40));
        assertEquals(1, RetryPolicy.noRetry().maxAttempts());
        assertEquals(1, new RetryPolicy(-2, Duration.ZERO).maxAttempts());
    }
}
