package com.pacer.service.ratelimit;

import com.pacer.config.PacerProperties;
import com.pacer.model.BackoffStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BackoffPolicy.
 */
class BackoffPolicyTest {

    private PacerProperties.RateLimitConfig config;

    @BeforeEach
    void setUp() {
        config = new PacerProperties.RateLimitConfig();
        config.setMinBackoff(Duration.ofMillis(100));
        config.setMaxBackoff(Duration.ofSeconds(60));
        config.setBackoffMultiplier(2.0);
    }

    @Test
    void testExponentialDoubles() {
        config.setBackoffStrategy(BackoffStrategy.EXPONENTIAL);

        Duration first = BackoffPolicy.next(Duration.ofMillis(100), null, config);
        Duration second = BackoffPolicy.next(first, null, config);
        Duration third = BackoffPolicy.next(second, null, config);

        assertEquals(Duration.ofMillis(200), first);
        assertEquals(Duration.ofMillis(400), second);
        assertEquals(Duration.ofMillis(800), third);
    }

    @Test
    void testLinearAddsMinBackoff() {
        config.setBackoffStrategy(BackoffStrategy.LINEAR);

        Duration first = BackoffPolicy.next(Duration.ofMillis(100), null, config);
        Duration second = BackoffPolicy.next(first, null, config);

        assertEquals(Duration.ofMillis(200), first);
        assertEquals(Duration.ofMillis(300), second);
    }

    @Test
    void testFibonacciGrowsByGoldenRatio() {
        config.setBackoffStrategy(BackoffStrategy.FIBONACCI);

        assertEquals(Duration.ofMillis(1618), BackoffPolicy.next(Duration.ofSeconds(1), null, config));
    }

    @Test
    void testServerSuggestionOverridesStrategy() {
        config.setBackoffStrategy(BackoffStrategy.EXPONENTIAL);

        assertEquals(Duration.ofSeconds(5),
                BackoffPolicy.next(Duration.ofMillis(100), Duration.ofSeconds(5), config));
    }

    @Test
    void testNonPositiveServerSuggestionIsIgnored() {
        config.setBackoffStrategy(BackoffStrategy.EXPONENTIAL);

        assertEquals(Duration.ofMillis(200), BackoffPolicy.next(Duration.ofMillis(100), Duration.ZERO, config));
    }

    @Test
    void testResultIsClampedToBounds() {
        config.setBackoffStrategy(BackoffStrategy.EXPONENTIAL);

        assertEquals(Duration.ofSeconds(60), BackoffPolicy.next(Duration.ofSeconds(45), null, config));
        assertEquals(Duration.ofSeconds(60), BackoffPolicy.next(Duration.ofMillis(100), Duration.ofMinutes(10), config));
        assertEquals(Duration.ofMillis(100), BackoffPolicy.next(Duration.ofMillis(100), Duration.ofMillis(10), config));
    }
}
