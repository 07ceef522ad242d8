package com.ivamare.eventsourcing.policy;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void shouldCreateDefaultPolicy() {
        RetryPolicy policy = RetryPolicy.defaultPolicy();

        assertEquals(3, policy.maxAttempts());
        assertEquals(Duration.ofSeconds(1), policy.delay());
    }

    @Test
    void shouldNotRetryWithNoRetryPolicy() {
        RetryPolicy policy = RetryPolicy.noRetry();

        assertFalse(policy.shouldRetry(1));
        assertEquals(Duration.ZERO, policy.getBackoff(1));
    }

    @Test
    void shouldGrowBackoffLinearly() {
        RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(100));

        assertEquals(Duration.ofMillis(100), policy.getBackoff(1));
        assertEquals(Duration.ofMillis(200), policy.getBackoff(2));
        assertEquals(Duration.ofMillis(300), policy.getBackoff(3));
        assertEquals(Duration.ZERO, policy.getBackoff(4));
    }

    @Test
    void shouldRetryUntilMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO);

        assertTrue(policy.shouldRetry(1));
        assertTrue(policy.shouldRetry(2));
        assertFalse(policy.shouldRetry(3));
    }

    @Test
    void shouldTreatNullDelayAsZero() {
        assertEquals(Duration.ZERO, new RetryPolicy(2, null).delay());
    }

    @Test
    void shouldRejectZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO));
    }
}
