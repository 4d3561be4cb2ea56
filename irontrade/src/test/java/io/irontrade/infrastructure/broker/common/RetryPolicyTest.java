package io.irontrade.infrastructure.broker.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RetryPolicy.
 *
 * Tests:
 * - Exponential backoff calculations
 * - Retry budget exhaustion
 * - Reset functionality
 * - Builder validation
 */
class RetryPolicyTest {

    @Test
    void testInitialState() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(5))
            .multiplier(2.0)
            .maxRetries(3)
            .build();

        assertTrue(policy.shouldRetry(), "Should allow first retry");
        assertEquals(0, policy.getRetryCount());
    }

    @Test
    void testExponentialBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(5))
            .multiplier(2.0)
            .maxRetries(5)
            .build();

        assertEquals(Duration.ofMillis(100), policy.recordFailure(), "First wait is the initial delay");
        assertEquals(Duration.ofMillis(200), policy.recordFailure());
        assertEquals(Duration.ofMillis(400), policy.recordFailure());
        assertEquals(3, policy.getRetryCount());
    }

    @Test
    void testMaxDelayRespected() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofSeconds(3))
            .multiplier(3.0)
            .maxRetries(10)
            .build();

        assertEquals(Duration.ofSeconds(1), policy.recordFailure());
        assertEquals(Duration.ofSeconds(3), policy.recordFailure());
        assertEquals(Duration.ofSeconds(3), policy.recordFailure(), "Delay stays capped");
    }

    @Test
    void testRetryBudgetExhausted() {
        RetryPolicy policy = RetryPolicy.builder()
            .initialDelay(Duration.ofMillis(10))
            .maxDelay(Duration.ofMillis(100))
            .maxRetries(2)
            .build();

        policy.recordFailure();
        assertTrue(policy.shouldRetry());
        policy.recordFailure();
        assertFalse(policy.shouldRetry(), "No retries left after maxRetries failures");
    }

    @Test
    void testZeroRetriesNeverRetries() {
        RetryPolicy policy = RetryPolicy.builder().maxRetries(0).build();

        assertFalse(policy.shouldRetry());
    }

    @Test
    void testSuccessResets() {
        RetryPolicy policy = RetryPolicy.forApiRequests();
        policy.recordFailure();
        policy.recordFailure();

        policy.recordSuccess();

        assertEquals(0, policy.getRetryCount());
        assertTrue(policy.shouldRetry());
        assertEquals(Duration.ofMillis(250), policy.recordFailure(), "Backoff restarts from the initial delay");
    }

    @Test
    void testBuilderValidation() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxDelay(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().multiplier(0.5));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxRetries(-1));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(1))
            .build());
    }
}
